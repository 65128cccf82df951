package com.nicolaswinsten.lootsync.world;

import java.time.Instant;

/**
 * Collected status of one object as seen by one viewer (or by nobody in particular).
 *
 * @param foundBy   finder that makes the object collected for this viewer, {@code null} if uncollected
 * @param findCount total ledger rows for the object, whatever the viewer
 */
public record Visibility(boolean collected, String foundBy, Instant foundAt, int findCount) {

    public static Visibility uncollected(int findCount) {
        return new Visibility(false, null, null, findCount);
    }
}
