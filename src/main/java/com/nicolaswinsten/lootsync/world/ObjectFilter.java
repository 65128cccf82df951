package com.nicolaswinsten.lootsync.world;

import java.util.Optional;

import com.nicolaswinsten.lootsync.error.ValidationException;

/**
 * Query for {@link WorldStateService#listObjects}.
 *
 * @param latitude     center of the search area, {@code null} together with {@code longitude} for no area restriction
 * @param longitude    center of the search area, {@code null} for no area restriction
 * @param radius       search radius in meters, {@link #DEFAULT_RADIUS_METERS} when {@code null}
 * @param includeFound whether objects collected for the viewer are returned
 * @param viewer       device the collected status is resolved for, {@code null} for the global view
 */
public record ObjectFilter(Double latitude, Double longitude, Double radius, boolean includeFound, String viewer) {

    public static final double DEFAULT_RADIUS_METERS = 10_000.0;

    /** Every object, found or not, as seen by {@code viewer}. */
    public static ObjectFilter everything(String viewer) {
        return new ObjectFilter(null, null, null, true, viewer);
    }

    /** @throws ValidationException if only one coordinate of the center is given, or the radius is negative */
    public Optional<BoundingBox> boundingBox() {
        if (latitude == null && longitude == null) {
            return Optional.empty();
        }
        if (latitude == null || longitude == null) {
            throw new ValidationException("latitude and longitude must be given together; missing "
                + (latitude == null ? "latitude" : "longitude"));
        }
        double meters = radius != null ? radius : DEFAULT_RADIUS_METERS;
        if (meters < 0) {
            throw new ValidationException("radius must not be negative");
        }
        return Optional.of(BoundingBox.around(latitude, longitude, meters));
    }
}
