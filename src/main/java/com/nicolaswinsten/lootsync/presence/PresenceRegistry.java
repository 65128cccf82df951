package com.nicolaswinsten.lootsync.presence;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.nicolaswinsten.lootsync.error.ValidationException;

/**
 * Which transport sessions are open and which device each one belongs to.
 *
 * <h3>State model</h3>
 * Two maps, {@code session → entry} and {@code device → sessions}, guarded by one lock so they
 * never disagree: a session is in exactly one device's set, or in none. A session belongs to at
 * most one device; a device may hold any number of sessions (several tabs, several logins).
 * Nothing here is persisted.
 *
 * <p>All operations are in-memory and short. Transport work (closing sockets on a kick) is done
 * after the lock is released.
 */
@Component
public class PresenceRegistry {
    private static final Logger LOGGER = LoggerFactory.getLogger(PresenceRegistry.class);

    /** How many closed session ids are remembered to turn away frames that arrive after the close. */
    static final int CLOSED_SESSION_MEMORY = 10_000;

    private final Object lock = new Object();
    /** Session id → entry, including sessions not yet bound to a device. */
    private final Map<String, SessionEntry> sessions = new HashMap<>();
    /** Device uuid → ids of its open sessions. Devices with no sessions are removed. */
    private final Map<String, Set<String>> deviceSessions = new HashMap<>();
    /** Recently disconnected or kicked session ids, oldest evicted first. */
    private final Set<String> closedSessions = Collections.newSetFromMap(new LinkedHashMap<>() {
        @Override
        protected boolean removeEldestEntry(Map.Entry<String, Boolean> eldest) {
            return size() > CLOSED_SESSION_MEMORY;
        }
    });

    private final SessionTerminator sessionTerminator;

    public PresenceRegistry(SessionTerminator sessionTerminator) {
        this.sessionTerminator = sessionTerminator;
    }

    /**
     * Records a freshly opened session with no device yet. Repeated calls keep the existing entry.
     * A session that already closed is not brought back.
     */
    public void onConnect(String sessionId) {
        synchronized (lock) {
            if (closedSessions.contains(sessionId)) {
                LOGGER.debug("Ignoring connect for closed session {}", sessionId);
                return;
            }
            sessions.putIfAbsent(sessionId, new SessionEntry());
        }
        LOGGER.debug("Session connected: {}", sessionId);
    }

    /**
     * Binds {@code sessionId} to {@code deviceUuid}. A session that was bound to another device is
     * first removed from that device's set. Registering the same pair again changes nothing.
     *
     * @return the trimmed device uuid now bound to the session
     * @throws ValidationException if {@code deviceUuid} is missing or blank, or the session has
     *                             already closed
     */
    public String registerDevice(String sessionId, String deviceUuid) {
        String device = ValidationException.requireText(deviceUuid, "device_uuid");
        String previous;
        synchronized (lock) {
            if (closedSessions.contains(sessionId)) {
                throw new ValidationException("Session " + sessionId + " is closed");
            }
            SessionEntry entry = sessions.computeIfAbsent(sessionId, k -> new SessionEntry());
            previous = entry.deviceUuid;
            if (previous != null && !previous.equals(device)) {
                detach(sessionId, previous);
            }
            entry.deviceUuid = device;
            if (entry.state == SessionState.CONNECTED) {
                entry.state = SessionState.REGISTERED;
            }
            deviceSessions.computeIfAbsent(device, k -> new LinkedHashSet<>()).add(sessionId);
        }
        if (device.equals(previous)) {
            LOGGER.debug("Device re-registered: device={}, session={}", device, sessionId);
        } else if (previous != null) {
            LOGGER.info("Session switched device: session={}, from={}, to={}", sessionId, previous, device);
        } else {
            LOGGER.info("Device registered: device={}, session={}", device, sessionId);
        }
        return device;
    }

    /**
     * Forgets a closed session. A no-op for sessions that were never seen or already kicked.
     *
     * @return the device the session was bound to, if any
     */
    public Optional<String> onDisconnect(String sessionId) {
        String device;
        synchronized (lock) {
            closedSessions.add(sessionId);
            SessionEntry entry = sessions.remove(sessionId);
            if (entry == null || entry.deviceUuid == null) {
                return Optional.empty();
            }
            entry.state = SessionState.DISCONNECTED;
            device = entry.deviceUuid;
            detach(sessionId, device);
        }
        LOGGER.info("Session disconnected: device={}, session={}", device, sessionId);
        return Optional.of(device);
    }

    /**
     * Closes every session of {@code deviceUuid} at the transport level and removes all registry
     * entries for it.
     */
    public KickResult kick(String deviceUuid) {
        String device = ValidationException.requireText(deviceUuid, "device_uuid");
        List<String> removed;
        synchronized (lock) {
            Set<String> owned = deviceSessions.remove(device);
            if (owned == null || owned.isEmpty()) {
                return KickResult.notConnected(device);
            }
            removed = new ArrayList<>(owned);
            for (String sessionId : removed) {
                closedSessions.add(sessionId);
                SessionEntry entry = sessions.remove(sessionId);
                if (entry != null) {
                    entry.state = SessionState.DISCONNECTED;
                }
            }
        }
        for (String sessionId : removed) {
            if (!sessionTerminator.terminate(sessionId)) {
                LOGGER.warn("Kick: session {} of device {} was already closed", sessionId, device);
            }
        }
        LOGGER.info("Kicked device {}: {} session(s) closed", device, removed.size());
        return new KickResult(true, device, List.copyOf(removed));
    }

    /** Devices with at least one session, sorted by device uuid. */
    public List<ConnectedDevice> listConnected() {
        synchronized (lock) {
            List<ConnectedDevice> devices = new ArrayList<>(deviceSessions.size());
            for (Map.Entry<String, Set<String>> entry : deviceSessions.entrySet()) {
                devices.add(new ConnectedDevice(
                    entry.getKey(), entry.getValue().size(), List.copyOf(entry.getValue())));
            }
            devices.sort(Comparator.comparing(ConnectedDevice::deviceUuid));
            return devices;
        }
    }

    public Optional<String> deviceFor(String sessionId) {
        synchronized (lock) {
            SessionEntry entry = sessions.get(sessionId);
            return entry == null ? Optional.empty() : Optional.ofNullable(entry.deviceUuid);
        }
    }

    public List<String> sessionsFor(String deviceUuid) {
        synchronized (lock) {
            Set<String> owned = deviceSessions.get(deviceUuid);
            return owned == null ? List.of() : List.copyOf(owned);
        }
    }

    public boolean isConnected(String deviceUuid) {
        synchronized (lock) {
            return deviceSessions.containsKey(deviceUuid);
        }
    }

    /** Every open session, bound to a device or not. */
    public List<String> sessionIds() {
        synchronized (lock) {
            return List.copyOf(sessions.keySet());
        }
    }

    public SessionState stateOf(String sessionId) {
        synchronized (lock) {
            SessionEntry entry = sessions.get(sessionId);
            return entry == null ? SessionState.DISCONNECTED : entry.state;
        }
    }

    /** @return {@code false} if the session is no longer open, so no resync should be sent */
    public boolean markSyncing(String sessionId) {
        return transition(sessionId, SessionState.SYNCING);
    }

    public boolean markLive(String sessionId) {
        return transition(sessionId, SessionState.LIVE);
    }

    private boolean transition(String sessionId, SessionState state) {
        synchronized (lock) {
            SessionEntry entry = sessions.get(sessionId);
            if (entry == null) {
                return false;
            }
            entry.state = state;
            return true;
        }
    }

    /** Caller holds {@link #lock}. */
    private void detach(String sessionId, String deviceUuid) {
        Set<String> owned = deviceSessions.get(deviceUuid);
        if (owned == null) {
            return;
        }
        owned.remove(sessionId);
        if (owned.isEmpty()) {
            deviceSessions.remove(deviceUuid);
        }
    }

    /** Mutable per-session record; only touched while holding {@link #lock}. */
    private static final class SessionEntry {
        String deviceUuid;
        SessionState state = SessionState.CONNECTED;
    }
}
