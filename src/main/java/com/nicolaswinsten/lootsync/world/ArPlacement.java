package com.nicolaswinsten.lootsync.world;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * AR placement data recorded by the device that placed an object. Stored and returned
 * untouched; the server never reads meaning into these values.
 *
 * <p>Every field is optional. When used as an update, only the non-null fields are applied.
 */
public record ArPlacement(
        Double originLatitude,
        Double originLongitude,
        Double offsetX,
        Double offsetY,
        Double offsetZ,
        Instant placementTimestamp,
        String anchorTransform,
        Double placementHeading) {

    @JsonIgnore
    public boolean isEmpty() {
        return originLatitude == null
            && originLongitude == null
            && offsetX == null
            && offsetY == null
            && offsetZ == null
            && placementTimestamp == null
            && anchorTransform == null
            && placementHeading == null;
    }

    /** Returns a copy of this placement with every non-null field of {@code update} applied on top. */
    public ArPlacement mergedWith(ArPlacement update) {
        if (update == null) {
            return this;
        }
        return new ArPlacement(
            pick(update.originLatitude, originLatitude),
            pick(update.originLongitude, originLongitude),
            pick(update.offsetX, offsetX),
            pick(update.offsetY, offsetY),
            pick(update.offsetZ, offsetZ),
            pick(update.placementTimestamp, placementTimestamp),
            pick(update.anchorTransform, anchorTransform),
            pick(update.placementHeading, placementHeading));
    }

    static ArPlacement none() {
        return new ArPlacement(null, null, null, null, null, null, null, null);
    }

    private static <T> T pick(T preferred, T fallback) {
        return preferred != null ? preferred : fallback;
    }
}
