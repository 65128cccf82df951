package com.nicolaswinsten.lootsync.world;

import java.time.Instant;

/**
 * A placeable, collectible object as persisted. The {@code id} is chosen by the client
 * and never changes once stored.
 *
 * @param createdBy       device that placed the object, or {@code "unknown"}
 * @param groundingHeight optional height correction reported by AR clients
 * @param arPlacement     opaque placement payload, {@code null} when the object was placed from the map
 * @param multifindable   {@code false}: one find collects it for everyone;
 *                        {@code true}: each viewer collects it separately
 */
public record WorldObject(
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
        boolean multifindable) {

    public static final String UNKNOWN_CREATOR = "unknown";
}
