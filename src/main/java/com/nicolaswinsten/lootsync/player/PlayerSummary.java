package com.nicolaswinsten.lootsync.player;

import java.time.Instant;

/**
 * Player row as listed on the admin dashboard.
 *
 * @param displayName name made unique for display when several devices share a player name
 * @param connected   whether the device currently holds at least one session
 */
public record PlayerSummary(
        String deviceUuid,
        String playerName,
        String displayName,
        long findCount,
        boolean connected,
        Instant createdAt,
        Instant updatedAt) {}
