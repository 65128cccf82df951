package com.nicolaswinsten.lootsync.world;

import static com.nicolaswinsten.lootsync.world.WorldStore.fromDb;
import static com.nicolaswinsten.lootsync.world.WorldStore.toDb;

import java.sql.PreparedStatement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.jdbc.core.JdbcOperations;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

/**
 * Append-only ledger of finds. Rows are only ever inserted or deleted (per object, or all at
 * once); nothing updates them. Insertion order, carried by the generated {@code id}, is the
 * order finds are reported in.
 */
@Repository
public class FindLedger {

    private static final RowMapper<Find> FIND_MAPPER = (rs, rowNum) -> new Find(
        rs.getLong("id"),
        rs.getString("object_id"),
        rs.getString("found_by"),
        fromDb(rs, "found_at"));

    private final NamedParameterJdbcTemplate namedJdbc;
    private final JdbcOperations jdbc;

    public FindLedger(NamedParameterJdbcTemplate namedJdbc) {
        this.namedJdbc = namedJdbc;
        this.jdbc = namedJdbc.getJdbcOperations();
    }

    /** Appends a find. Does not look for an earlier find by the same finder. */
    public Find append(String objectId, String foundBy, Instant foundAt) {
        KeyHolder keys = new GeneratedKeyHolder();
        jdbc.update(connection -> {
            PreparedStatement ps = connection.prepareStatement(
                "INSERT INTO finds (object_id, found_by, found_at) VALUES (?, ?, ?)", new String[] {"ID"});
            ps.setString(1, objectId);
            ps.setString(2, foundBy);
            ps.setObject(3, toDb(foundAt));
            return ps;
        }, keys);
        Number id = keys.getKey();
        return new Find(id == null ? 0 : id.longValue(), objectId, foundBy, foundAt);
    }

    public List<Find> findsFor(String objectId) {
        return jdbc.query("SELECT * FROM finds WHERE object_id = ? ORDER BY id", FIND_MAPPER, objectId);
    }

    /** Finds for each of the given objects, in insertion order. Objects with no finds are absent. */
    public Map<String, List<Find>> findsByObject(Collection<String> objectIds) {
        Map<String, List<Find>> byObject = new LinkedHashMap<>();
        if (objectIds.isEmpty()) {
            return byObject;
        }
        List<Find> finds = namedJdbc.query(
            "SELECT * FROM finds WHERE object_id IN (:ids) ORDER BY id",
            Map.of("ids", objectIds),
            FIND_MAPPER);
        for (Find find : finds) {
            byObject.computeIfAbsent(find.objectId(), k -> new ArrayList<>()).add(find);
        }
        return byObject;
    }

    /** @return number of rows removed, possibly 0 */
    public int deleteFor(String objectId) {
        return jdbc.update("DELETE FROM finds WHERE object_id = ?", objectId);
    }

    public int deleteAll() {
        return jdbc.update("DELETE FROM finds");
    }

    /** Objects found by {@code foundBy}, most recent find first. Repeat finds appear once per row. */
    public List<UserFind> findsBy(String foundBy) {
        return jdbc.query("""
            SELECT o.id, o.name, o.type, o.latitude, o.longitude, f.found_at
            FROM finds f
            JOIN objects o ON f.object_id = o.id
            WHERE f.found_by = ?
            ORDER BY f.found_at DESC, f.id DESC
            """,
            (rs, rowNum) -> new UserFind(
                rs.getString("id"),
                rs.getString("name"),
                rs.getString("type"),
                rs.getDouble("latitude"),
                rs.getDouble("longitude"),
                fromDb(rs, "found_at")),
            foundBy);
    }

    public long countFinds() {
        Long count = jdbc.queryForObject("SELECT COUNT(*) FROM finds", Long.class);
        return count == null ? 0 : count;
    }

    /** Number of distinct objects with at least one find. */
    public long countFoundObjects() {
        Long count = jdbc.queryForObject("SELECT COUNT(DISTINCT object_id) FROM finds", Long.class);
        return count == null ? 0 : count;
    }

    public List<WorldStats.TopFinder> topFinders(int limit) {
        return jdbc.query("""
            SELECT f.found_by, p.player_name, COUNT(*) AS find_count
            FROM finds f
            LEFT JOIN players p ON p.device_uuid = f.found_by
            GROUP BY f.found_by, p.player_name
            ORDER BY find_count DESC, f.found_by
            LIMIT ?
            """,
            (rs, rowNum) -> new WorldStats.TopFinder(
                rs.getString("found_by"),
                rs.getString("player_name"),
                rs.getLong("find_count")),
            limit);
    }

    /** Find totals per finder, used for the player list. */
    public Map<String, Long> countsByFinder() {
        Map<String, Long> counts = new LinkedHashMap<>();
        jdbc.query("SELECT found_by, COUNT(*) AS find_count FROM finds GROUP BY found_by",
            rs -> {
                counts.put(rs.getString("found_by"), rs.getLong("find_count"));
            });
        return counts;
    }
}
