package com.nicolaswinsten.lootsync.presence;

import java.util.List;

/** A device with at least one open session. */
public record ConnectedDevice(String deviceUuid, int sessionCount, List<String> sessionIds) {}
