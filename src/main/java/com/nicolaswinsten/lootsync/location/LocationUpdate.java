package com.nicolaswinsten.lootsync.location;

/** A device reporting where it is. Only latitude and longitude are required. */
public record LocationUpdate(Double latitude, Double longitude, Double accuracy, Double heading, ArOffset arOffset) {}
