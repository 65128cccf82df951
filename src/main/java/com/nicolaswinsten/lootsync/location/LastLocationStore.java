package com.nicolaswinsten.lootsync.location;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

/**
 * The one piece of location state that survives a restart: each device's last reported position,
 * used to center the map. Writes go through the store writer.
 */
@Repository
public class LastLocationStore {

    private final JdbcTemplate jdbcTemplate;

    public LastLocationStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void save(String deviceUuid, double latitude, double longitude, Instant updatedAt) {
        jdbcTemplate.update(
            "MERGE INTO user_last_locations (device_uuid, latitude, longitude, updated_at) KEY (device_uuid)"
                + " VALUES (?, ?, ?, ?)",
            deviceUuid, latitude, longitude, updatedAt.atOffset(ZoneOffset.UTC));
    }

    /** Most recently updated position across all devices. */
    public Optional<MapCenter> mostRecent() {
        List<MapCenter> rows = jdbcTemplate.query(
            "SELECT latitude, longitude FROM user_last_locations ORDER BY updated_at DESC LIMIT 1",
            (rs, rowNum) -> new MapCenter(rs.getDouble("latitude"), rs.getDouble("longitude"), "last_known"));
        return rows.stream().findFirst();
    }

    public int delete(String deviceUuid) {
        return jdbcTemplate.update("DELETE FROM user_last_locations WHERE device_uuid = ?", deviceUuid);
    }
}
