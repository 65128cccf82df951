package com.nicolaswinsten.lootsync.player;

import java.time.Instant;

/**
 * A player, identified only by the device uuid. Names are free text and may repeat across devices.
 */
public record Player(String deviceUuid, String playerName, Instant createdAt, Instant updatedAt) {}
