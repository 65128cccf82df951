package com.nicolaswinsten.lootsync.location;

import java.time.Instant;

/** Latest known position of a device. The newest report replaces the previous one. */
public record LiveLocation(
        String deviceUuid,
        double latitude,
        double longitude,
        Double accuracy,
        Double heading,
        ArOffset arOffset,
        Instant updatedAt) {}
