package com.nicolaswinsten.lootsync.world;

/**
 * Client request to place a new object. Boxed fields so a missing value can be told apart
 * from zero and rejected.
 */
public record ObjectDraft(
        String id,
        String name,
        String type,
        Double latitude,
        Double longitude,
        Double radius,
        String createdBy,
        Double groundingHeight,
        ArPlacement arPlacement,
        Boolean multifindable) {
}
