package com.nicolaswinsten.lootsync.world;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

/**
 * JDBC access to the {@code objects} table. Methods that change rows must be called through
 * {@link StoreWriter}; this class does no locking of its own.
 */
@Repository
public class WorldStore {

    private static final String COLUMNS = """
        id, name, type, latitude, longitude, radius, created_at, created_by, grounding_height,
        ar_origin_latitude, ar_origin_longitude, ar_offset_x, ar_offset_y, ar_offset_z,
        ar_placement_timestamp, ar_anchor_transform, ar_placement_heading, multifindable
        """;

    private static final RowMapper<WorldObject> OBJECT_MAPPER = WorldStore::mapObject;

    private final JdbcTemplate jdbcTemplate;

    public WorldStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /** Inserts a new row. A duplicate id surfaces as Spring's {@code DuplicateKeyException}. */
    public void insert(WorldObject object) {
        ArPlacement ar = object.arPlacement() != null ? object.arPlacement() : ArPlacement.none();
        jdbcTemplate.update(
            "INSERT INTO objects (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
            object.id(),
            object.name(),
            object.type(),
            object.latitude(),
            object.longitude(),
            object.radius(),
            toDb(object.createdAt()),
            object.createdBy(),
            object.groundingHeight(),
            ar.originLatitude(),
            ar.originLongitude(),
            ar.offsetX(),
            ar.offsetY(),
            ar.offsetZ(),
            toDb(ar.placementTimestamp()),
            ar.anchorTransform(),
            ar.placementHeading(),
            object.multifindable());
    }

    public Optional<WorldObject> find(String id) {
        List<WorldObject> rows = jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM objects WHERE id = ?", OBJECT_MAPPER, id);
        return rows.stream().findFirst();
    }

    public boolean exists(String id) {
        Integer count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM objects WHERE id = ?", Integer.class, id);
        return count != null && count > 0;
    }

    /** All objects, newest first, optionally restricted to a bounding box. */
    public List<WorldObject> findAll(Optional<BoundingBox> area) {
        if (area.isEmpty()) {
            return jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM objects ORDER BY created_at DESC, id", OBJECT_MAPPER);
        }
        BoundingBox box = area.get();
        return jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM objects"
                + " WHERE latitude BETWEEN ? AND ? AND longitude BETWEEN ? AND ?"
                + " ORDER BY created_at DESC, id",
            OBJECT_MAPPER,
            box.minLatitude(), box.maxLatitude(), box.minLongitude(), box.maxLongitude());
    }

    public long count() {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM objects", Long.class);
        return count == null ? 0 : count;
    }

    /** @return rows changed, 0 when the object does not exist */
    public int updateLocation(String id, double latitude, double longitude) {
        return jdbcTemplate.update(
            "UPDATE objects SET latitude = ?, longitude = ? WHERE id = ?", latitude, longitude, id);
    }

    public int updateGrounding(String id, double groundingHeight) {
        return jdbcTemplate.update(
            "UPDATE objects SET grounding_height = ? WHERE id = ?", groundingHeight, id);
    }

    public int updateArPlacement(String id, ArPlacement ar) {
        return jdbcTemplate.update("""
            UPDATE objects SET
                ar_origin_latitude = ?, ar_origin_longitude = ?,
                ar_offset_x = ?, ar_offset_y = ?, ar_offset_z = ?,
                ar_placement_timestamp = ?, ar_anchor_transform = ?, ar_placement_heading = ?
            WHERE id = ?
            """,
            ar.originLatitude(),
            ar.originLongitude(),
            ar.offsetX(),
            ar.offsetY(),
            ar.offsetZ(),
            toDb(ar.placementTimestamp()),
            ar.anchorTransform(),
            ar.placementHeading(),
            id);
    }

    public int delete(String id) {
        return jdbcTemplate.update("DELETE FROM objects WHERE id = ?", id);
    }

    private static WorldObject mapObject(ResultSet rs, int rowNum) throws SQLException {
        ArPlacement ar = new ArPlacement(
            nullableDouble(rs, "ar_origin_latitude"),
            nullableDouble(rs, "ar_origin_longitude"),
            nullableDouble(rs, "ar_offset_x"),
            nullableDouble(rs, "ar_offset_y"),
            nullableDouble(rs, "ar_offset_z"),
            fromDb(rs, "ar_placement_timestamp"),
            rs.getString("ar_anchor_transform"),
            nullableDouble(rs, "ar_placement_heading"));
        return new WorldObject(
            rs.getString("id"),
            rs.getString("name"),
            rs.getString("type"),
            rs.getDouble("latitude"),
            rs.getDouble("longitude"),
            rs.getDouble("radius"),
            fromDb(rs, "created_at"),
            rs.getString("created_by"),
            nullableDouble(rs, "grounding_height"),
            ar.isEmpty() ? null : ar,
            rs.getBoolean("multifindable"));
    }

    static Double nullableDouble(ResultSet rs, String column) throws SQLException {
        double value = rs.getDouble(column);
        return rs.wasNull() ? null : value;
    }

    static OffsetDateTime toDb(Instant instant) {
        return instant == null ? null : instant.atOffset(ZoneOffset.UTC);
    }

    static Instant fromDb(ResultSet rs, String column) throws SQLException {
        OffsetDateTime value = rs.getObject(column, OffsetDateTime.class);
        return value == null ? null : value.toInstant();
    }
}
