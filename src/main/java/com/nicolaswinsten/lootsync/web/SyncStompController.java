package com.nicolaswinsten.lootsync.web;

import java.time.Clock;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.messaging.handler.annotation.MessageExceptionHandler;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.messaging.simp.annotation.SubscribeMapping;
import org.springframework.stereotype.Controller;
import org.springframework.web.socket.messaging.SessionConnectedEvent;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;

import com.nicolaswinsten.lootsync.error.ValidationException;
import com.nicolaswinsten.lootsync.error.WorldStateException;
import com.nicolaswinsten.lootsync.location.LiveLocationTracker;
import com.nicolaswinsten.lootsync.location.LocationUpdate;
import com.nicolaswinsten.lootsync.presence.PresenceRegistry;
import com.nicolaswinsten.lootsync.sync.DiagnosticRelay;
import com.nicolaswinsten.lootsync.sync.EventFanout;
import com.nicolaswinsten.lootsync.sync.EventType;
import com.nicolaswinsten.lootsync.sync.ReconciliationService;
import com.nicolaswinsten.lootsync.sync.SyncMessages.AdminPingClient;
import com.nicolaswinsten.lootsync.sync.SyncMessages.ClientDiagnosticPong;
import com.nicolaswinsten.lootsync.sync.SyncMessages.Connected;
import com.nicolaswinsten.lootsync.sync.SyncMessages.ConnectedClients;
import com.nicolaswinsten.lootsync.sync.SyncMessages.DeviceRegistered;
import com.nicolaswinsten.lootsync.sync.SyncMessages.DiagnosticPing;
import com.nicolaswinsten.lootsync.sync.SyncMessages.DiagnosticPong;
import com.nicolaswinsten.lootsync.sync.SyncMessages.Pong;
import com.nicolaswinsten.lootsync.sync.SyncMessages.RegisterDevice;
import com.nicolaswinsten.lootsync.sync.SyncMessages.WorldEvent;

/**
 * Handles every STOMP message a client sends and the session lifecycle events around them.
 *
 * <h3>Session lifecycle</h3>
 * <ol>
 *   <li><strong>Connect</strong>: the STOMP CONNECT is recorded in the {@link PresenceRegistry}
 *       with no device bound.</li>
 *   <li><strong>Subscribe</strong>: subscribing to {@code /app/session} answers with
 *       {@code connected} and sends a full resync to the session's queue.</li>
 *   <li><strong>Register</strong>: {@code /app/register_device} binds the session to a device uuid,
 *       answers {@code device_registered}, then resyncs again so collected status is resolved for
 *       that device.</li>
 *   <li><strong>Live</strong>: the session receives deltas on {@code /topic/world}, can ask for
 *       more resyncs with {@code /app/request_sync} and push its position with
 *       {@code /app/update_location}.</li>
 *   <li><strong>Disconnect</strong>: on WebSocket close the registry entry and any admin pings the
 *       session was waiting on are dropped.</li>
 * </ol>
 *
 * Client input problems are answered on the session's own queue rather than thrown back at the
 * transport.
 */
@Controller
public class SyncStompController {
    private static final Logger LOGGER = LoggerFactory.getLogger(SyncStompController.class);

    private final PresenceRegistry presenceRegistry;
    private final ReconciliationService reconciliationService;
    private final EventFanout eventFanout;
    private final DiagnosticRelay diagnosticRelay;
    private final LiveLocationTracker liveLocationTracker;
    private final Clock clock;

    public SyncStompController(PresenceRegistry presenceRegistry,
                               ReconciliationService reconciliationService,
                               EventFanout eventFanout,
                               DiagnosticRelay diagnosticRelay,
                               LiveLocationTracker liveLocationTracker,
                               Clock clock) {
        this.presenceRegistry = presenceRegistry;
        this.reconciliationService = reconciliationService;
        this.eventFanout = eventFanout;
        this.diagnosticRelay = diagnosticRelay;
        this.liveLocationTracker = liveLocationTracker;
        this.clock = clock;
    }

    @EventListener
    public void handleConnected(SessionConnectedEvent event) {
        String sessionId = SimpMessageHeaderAccessor.getSessionId(event.getMessage().getHeaders());
        if (sessionId != null) {
            presenceRegistry.onConnect(sessionId);
        }
    }

    /**
     * Acknowledges the connection and starts the initial resync. The return value goes straight
     * back to the subscriber; the batches follow on {@code /user/queue/events}.
     */
    @SubscribeMapping("/session")
    public WorldEvent session(@Header("simpSessionId") String sessionId) {
        presenceRegistry.onConnect(sessionId);
        reconciliationService.resync(sessionId);
        return new WorldEvent(EventType.CONNECTED, new Connected(sessionId, "Connected to loot sync server"));
    }

    /**
     * Binds the session to a device. A session already bound to another device is moved over.
     * Answers {@code device_registered} with an error instead when the uuid is missing.
     */
    @MessageMapping("/register_device")
    public void registerDevice(@Payload(required = false) RegisterDevice message,
                               @Header("simpSessionId") String sessionId) {
        String requested = message == null ? null : message.deviceUuid();
        String device;
        try {
            device = presenceRegistry.registerDevice(sessionId, requested);
        } catch (ValidationException e) {
            LOGGER.warn("Rejected device registration on session {}: {}", sessionId, e.getMessage());
            eventFanout.sendToSession(sessionId, EventType.DEVICE_REGISTERED,
                DeviceRegistered.failed(requested, sessionId, e.getMessage(), e.getKind()));
            return;
        }
        eventFanout.sendToSession(sessionId, EventType.DEVICE_REGISTERED, DeviceRegistered.ok(device, sessionId));
        reconciliationService.resync(sessionId);
    }

    @MessageMapping("/request_sync")
    public void requestSync(@Header("simpSessionId") String sessionId) {
        reconciliationService.resync(sessionId);
    }

    /** Live position from a registered device. Ignored for sessions with no device bound. */
    @MessageMapping("/update_location")
    public void updateLocation(@Payload(required = false) LocationUpdate update,
                               @Header("simpSessionId") String sessionId) {
        Optional<String> device = presenceRegistry.deviceFor(sessionId);
        if (device.isEmpty()) {
            LOGGER.debug("Location update from unregistered session {} ignored", sessionId);
            return;
        }
        liveLocationTracker.update(device.get(), update);
    }

    @MessageMapping("/get_connected_clients")
    public void connectedClients(@Header("simpSessionId") String sessionId) {
        eventFanout.sendToSession(sessionId, EventType.CONNECTED_CLIENTS_LIST,
            new ConnectedClients(presenceRegistry.listConnected()));
    }

    @MessageMapping("/ping")
    public void ping(@Header("simpSessionId") String sessionId) {
        eventFanout.sendToSession(sessionId, EventType.PONG, new Pong(clock.instant()));
    }

    /** Server round-trip check: echoes the ping id with the server's time. */
    @MessageMapping("/diagnostic_ping")
    public void diagnosticPing(@Payload(required = false) DiagnosticPing ping,
                               @Header("simpSessionId") String sessionId) {
        String pingId = ping == null ? null : ping.pingId();
        String clientTimestamp = ping == null ? null : ping.timestamp();
        eventFanout.sendToSession(sessionId, EventType.DIAGNOSTIC_PONG,
            new DiagnosticPong(pingId, clientTimestamp, clock.instant()));
        LOGGER.debug("Diagnostic ping {} from session {}", pingId, sessionId);
    }

    /** An admin session asks the server to ping every session of one device. */
    @MessageMapping("/admin_ping_client")
    public void adminPingClient(@Payload(required = false) AdminPingClient request,
                                @Header("simpSessionId") String sessionId) {
        if (request == null) {
            diagnosticRelay.pingDevice(sessionId, null, null);
            return;
        }
        diagnosticRelay.pingDevice(sessionId, request.deviceUuid(), request.pingId());
    }

    /** A device answering an {@code admin_diagnostic_ping}. */
    @MessageMapping("/client_diagnostic_pong")
    public void clientDiagnosticPong(@Payload(required = false) ClientDiagnosticPong pong,
                                     @Header("simpSessionId") String sessionId) {
        if (pong == null) {
            return;
        }
        diagnosticRelay.onClientPong(sessionId, pong.pingId(), pong.timestamp());
    }

    /**
     * Cleans up all server-side state when a WebSocket connection closes. Sessions that were
     * already purged by a kick are a no-op.
     */
    @EventListener
    public void handleDisconnect(SessionDisconnectEvent event) {
        String sessionId = event.getSessionId();
        presenceRegistry.onDisconnect(sessionId);
        diagnosticRelay.forgetAdmin(sessionId);
    }

    /** Store failures during a resync or location push; the session simply gets the next resync. */
    @MessageExceptionHandler(WorldStateException.class)
    public void handleWorldStateException(WorldStateException e, @Header("simpSessionId") String sessionId) {
        LOGGER.warn("STOMP request from session {} failed ({}): {}", sessionId, e.getKind().getValue(), e.getMessage());
    }
}
