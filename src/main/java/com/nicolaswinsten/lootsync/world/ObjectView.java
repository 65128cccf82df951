package com.nicolaswinsten.lootsync.world;

import java.time.Instant;

/**
 * An object together with its resolved collected status, as sent to clients over HTTP,
 * in broadcasts and in resync batches.
 */
public record ObjectView(
        String id,
        String name,
        String type,
        double latitude,
        double longitude,
        double radius,
        Instant createdAt,
        String createdBy,
        Double groundingHeight,
        ArPlacement arPlacement,
        boolean multifindable,
        boolean collected,
        String foundBy,
        Instant foundAt,
        int findCount) {

    public static ObjectView of(WorldObject object, Visibility visibility) {
        return new ObjectView(
            object.id(),
            object.name(),
            object.type(),
            object.latitude(),
            object.longitude(),
            object.radius(),
            object.createdAt(),
            object.createdBy(),
            object.groundingHeight(),
            object.arPlacement(),
            object.multifindable(),
            visibility.collected(),
            visibility.foundBy(),
            visibility.foundAt(),
            visibility.findCount());
    }
}
