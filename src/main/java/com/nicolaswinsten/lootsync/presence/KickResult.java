package com.nicolaswinsten.lootsync.presence;

import java.util.List;

/**
 * Outcome of {@link PresenceRegistry#kick}. {@code kicked} is {@code false}, not an error, when
 * the device had no sessions.
 */
public record KickResult(boolean kicked, String deviceUuid, List<String> sessionIds) {

    public static KickResult notConnected(String deviceUuid) {
        return new KickResult(false, deviceUuid, List.of());
    }
}
