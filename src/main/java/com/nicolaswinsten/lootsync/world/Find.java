package com.nicolaswinsten.lootsync.world;

import java.time.Instant;

/**
 * One row of the find ledger. Rows are appended, never edited; {@code id} grows with
 * insertion order and is the ordering used for "who found it first".
 */
public record Find(long id, String objectId, String foundBy, Instant foundAt) {}
