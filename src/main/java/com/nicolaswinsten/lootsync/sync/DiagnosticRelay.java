package com.nicolaswinsten.lootsync.sync;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.nicolaswinsten.lootsync.config.LootSyncProperties;
import com.nicolaswinsten.lootsync.error.ErrorKind;
import com.nicolaswinsten.lootsync.presence.PresenceRegistry;
import com.nicolaswinsten.lootsync.sync.SyncMessages.AdminDiagnosticPing;
import com.nicolaswinsten.lootsync.sync.SyncMessages.AdminPingError;
import com.nicolaswinsten.lootsync.sync.SyncMessages.AdminPingResponse;

/**
 * Round-trips diagnostic pings from an admin session to a device's sessions and back.
 * Messages are addressed by session id, never broadcast.
 *
 * <p>A ping stays pending until the device answers, the admin disconnects, or it is older than
 * {@code lootsync.presence.admin-ping-expiry}.
 */
@Component
public class DiagnosticRelay {
    private static final Logger LOGGER = LoggerFactory.getLogger(DiagnosticRelay.class);

    /** Ping id → who asked. */
    private final ConcurrentMap<String, PendingPing> pending = new ConcurrentHashMap<>();

    private final PresenceRegistry presenceRegistry;
    private final EventFanout eventFanout;
    private final Clock clock;
    private final Duration expiry;

    public DiagnosticRelay(PresenceRegistry presenceRegistry,
                           EventFanout eventFanout,
                           Clock clock,
                           LootSyncProperties properties) {
        this.presenceRegistry = presenceRegistry;
        this.eventFanout = eventFanout;
        this.clock = clock;
        this.expiry = properties.presence().adminPingExpiry();
    }

    /**
     * Forwards an admin's ping to every session of {@code deviceUuid}, or answers the admin with
     * {@code admin_ping_error} when that is impossible.
     *
     * @return the ping id used, generated when the admin sent none
     */
    public String pingDevice(String adminSessionId, String deviceUuid, String pingId) {
        String id = pingId == null || pingId.isBlank() ? UUID.randomUUID().toString() : pingId;
        Instant now = clock.instant();
        purgeExpired(now);
        if (deviceUuid == null || deviceUuid.isBlank()) {
            eventFanout.sendToSession(adminSessionId, EventType.ADMIN_PING_ERROR,
                new AdminPingError(id, deviceUuid, "device_uuid is required", ErrorKind.VALIDATION_ERROR));
            return id;
        }
        List<String> targets = presenceRegistry.sessionsFor(deviceUuid);
        if (targets.isEmpty()) {
            eventFanout.sendToSession(adminSessionId, EventType.ADMIN_PING_ERROR,
                new AdminPingError(id, deviceUuid, "Device is not connected", ErrorKind.NOT_FOUND));
            return id;
        }
        pending.put(id, new PendingPing(adminSessionId, deviceUuid, now));
        for (String target : targets) {
            eventFanout.sendToSession(target, EventType.ADMIN_DIAGNOSTIC_PING, new AdminDiagnosticPing(id, now));
        }
        LOGGER.debug("Admin ping {} sent to device {} ({} session(s))", id, deviceUuid, targets.size());
        return id;
    }

    /**
     * Relays a device's answer to the admin that asked. Only the first answer per ping is relayed.
     *
     * @return {@code false} when the ping is unknown, already answered or expired
     */
    public boolean onClientPong(String deviceSessionId, String pingId, String clientTimestamp) {
        if (pingId == null) {
            return false;
        }
        PendingPing ping = pending.remove(pingId);
        if (ping == null) {
            LOGGER.debug("Ignoring pong for unknown ping {} from session {}", pingId, deviceSessionId);
            return false;
        }
        String device = presenceRegistry.deviceFor(deviceSessionId).orElse(ping.deviceUuid());
        eventFanout.sendToSession(ping.adminSessionId(), EventType.ADMIN_PING_RESPONSE,
            new AdminPingResponse(pingId, device, clientTimestamp, clock.instant()));
        return true;
    }

    /** Drops pings the given admin session is waiting on. */
    public void forgetAdmin(String adminSessionId) {
        pending.values().removeIf(ping -> ping.adminSessionId().equals(adminSessionId));
    }

    int pendingCount() {
        return pending.size();
    }

    private void purgeExpired(Instant now) {
        Instant cutoff = now.minus(expiry);
        pending.values().removeIf(ping -> ping.sentAt().isBefore(cutoff));
    }

    private record PendingPing(String adminSessionId, String deviceUuid, Instant sentAt) {}
}
