package com.nicolaswinsten.lootsync.presence;

/**
 * Where a connection is in its life. {@code SYNCING} is re-entered on every resync, not only
 * the first one.
 */
public enum SessionState {
    CONNECTED,
    REGISTERED,
    SYNCING,
    LIVE,
    DISCONNECTED
}
