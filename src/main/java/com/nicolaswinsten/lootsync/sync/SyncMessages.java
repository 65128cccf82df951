package com.nicolaswinsten.lootsync.sync;

import java.time.Instant;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.nicolaswinsten.lootsync.error.ErrorKind;
import com.nicolaswinsten.lootsync.presence.ConnectedDevice;
import com.nicolaswinsten.lootsync.world.ObjectView;

/**
 * Message payloads exchanged over STOMP. Serialized to snake_case JSON by the application's
 * Jackson configuration.
 */
public final class SyncMessages {

    private SyncMessages() {}

    // ── Server → client ─────────────────────────────────────────────────────

    /**
     * Envelope for every server→client message, sent to {@code /topic/world} or to a
     * session's {@code /user/queue/events}.
     */
    public record WorldEvent(EventType event, Object data) {}

    /** Acknowledges a new connection. */
    public record Connected(String sessionId, String message) {}

    public record ObjectCollected(String objectId, String foundBy, Instant foundAt) {}

    public record ObjectUncollected(String objectId, int findsDeleted) {}

    public record ObjectDeleted(String objectId, int findsDeleted) {}

    public record FindsReset(int findsRemoved) {}

    /**
     * Answer to {@code register_device}. On failure {@code error} and {@code errorKind} are set and
     * {@code deviceUuid} echoes whatever the client sent.
     */
    public record DeviceRegistered(String deviceUuid, String sessionId, String error, ErrorKind errorKind) {

        public static DeviceRegistered ok(String deviceUuid, String sessionId) {
            return new DeviceRegistered(deviceUuid, sessionId, null, null);
        }

        public static DeviceRegistered failed(String deviceUuid, String sessionId, String error, ErrorKind kind) {
            return new DeviceRegistered(deviceUuid, sessionId, error, kind);
        }
    }

    public record ConnectedClients(List<ConnectedDevice> clients) {}

    public record DiagnosticPong(String pingId, String clientTimestamp, Instant serverTimestamp) {}

    /** Sent to each session of a device an admin asked to ping. */
    public record AdminDiagnosticPing(String pingId, Instant serverTimestamp) {}

    /** Relayed to the admin once the pinged device answers. */
    public record AdminPingResponse(String pingId, String deviceUuid, String clientTimestamp, Instant serverTimestamp) {}

    public record AdminPingError(String pingId, String deviceUuid, String error, ErrorKind errorKind) {}

    /**
     * One slice of a full resync. Batches of one resync share {@code totalBatches}; the one with
     * {@code isLastBatch} set closes it.
     */
    public record ObjectsBatch(
            List<ObjectView> objects,
            int batchIndex,
            int totalBatches,
            @JsonProperty("is_last_batch") boolean isLastBatch) {}

    public record Pong(Instant serverTimestamp) {}

    // ── Client → server ─────────────────────────────────────────────────────

    public record RegisterDevice(String deviceUuid) {}

    public record DiagnosticPing(String pingId, String timestamp) {}

    public record AdminPingClient(String deviceUuid, String pingId, String timestamp) {}

    public record ClientDiagnosticPong(String pingId, String timestamp) {}
}
