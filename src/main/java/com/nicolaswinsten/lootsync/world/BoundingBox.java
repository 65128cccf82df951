package com.nicolaswinsten.lootsync.world;

/**
 * Latitude/longitude rectangle approximating a circle on the ground. Not geodesic: one degree of
 * latitude is taken as 111 km and longitude degrees shrink with {@code cos(latitude)}.
 */
public record BoundingBox(double minLatitude, double maxLatitude, double minLongitude, double maxLongitude) {

    static final double METERS_PER_DEGREE = 111_000.0;

    public static BoundingBox around(double latitude, double longitude, double radiusMeters) {
        double latRange = radiusMeters / METERS_PER_DEGREE;
        double cos = Math.abs(Math.cos(Math.toRadians(latitude)));
        if (cos < 1e-9) {
            // At the poles every longitude is within range
            return new BoundingBox(latitude - latRange, latitude + latRange, -180.0, 180.0);
        }
        double lonRange = radiusMeters / (METERS_PER_DEGREE * cos);
        return new BoundingBox(
            latitude - latRange,
            latitude + latRange,
            longitude - lonRange,
            longitude + lonRange);
    }
}
