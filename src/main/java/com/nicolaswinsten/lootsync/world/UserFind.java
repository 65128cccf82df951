package com.nicolaswinsten.lootsync.world;

import java.time.Instant;

/** An object a given user has found, as listed on that user's find history. */
public record UserFind(
        String id,
        String name,
        String type,
        double latitude,
        double longitude,
        Instant foundAt) {}
