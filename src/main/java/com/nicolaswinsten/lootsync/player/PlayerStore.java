package com.nicolaswinsten.lootsync.player;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

/** JDBC access to the {@code players} table. Writes must go through the store writer. */
@Repository
public class PlayerStore {

    private final JdbcTemplate jdbcTemplate;

    public PlayerStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /** Creates the player or renames it, keeping the original {@code created_at}. */
    public Player upsert(String deviceUuid, String playerName, Instant now) {
        OffsetDateTime timestamp = now.atOffset(ZoneOffset.UTC);
        int updated = jdbcTemplate.update(
            "UPDATE players SET player_name = ?, updated_at = ? WHERE device_uuid = ?",
            playerName, timestamp, deviceUuid);
        if (updated == 0) {
            jdbcTemplate.update(
                "INSERT INTO players (device_uuid, player_name, created_at, updated_at) VALUES (?, ?, ?, ?)",
                deviceUuid, playerName, timestamp, timestamp);
        }
        return find(deviceUuid).orElseThrow();
    }

    public Optional<Player> find(String deviceUuid) {
        return jdbcTemplate.query(
                "SELECT * FROM players WHERE device_uuid = ?", PlayerStore::mapPlayer, deviceUuid)
            .stream()
            .findFirst();
    }

    /** Most recently updated first. */
    public List<Player> findAll() {
        return jdbcTemplate.query(
            "SELECT * FROM players ORDER BY updated_at DESC, device_uuid", PlayerStore::mapPlayer);
    }

    public int delete(String deviceUuid) {
        return jdbcTemplate.update("DELETE FROM players WHERE device_uuid = ?", deviceUuid);
    }

    private static Player mapPlayer(ResultSet rs, int rowNum) throws SQLException {
        return new Player(
            rs.getString("device_uuid"),
            rs.getString("player_name"),
            rs.getObject("created_at", OffsetDateTime.class).toInstant(),
            rs.getObject("updated_at", OffsetDateTime.class).toInstant());
    }
}
