package com.nicolaswinsten.lootsync.location;

/** Device position relative to its AR session origin. Passed through to map clients as is. */
public record ArOffset(double x, double y, double z) {}
