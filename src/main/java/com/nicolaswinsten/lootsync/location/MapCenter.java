package com.nicolaswinsten.lootsync.location;

/**
 * Where the admin map opens.
 * @param source {@code "last_known"} when taken from a device report, {@code "default"} otherwise
 */
public record MapCenter(double latitude, double longitude, String source) {}
