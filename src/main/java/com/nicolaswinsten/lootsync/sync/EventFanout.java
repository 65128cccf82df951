package com.nicolaswinsten.lootsync.sync;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.messaging.simp.SimpMessageType;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

import com.nicolaswinsten.lootsync.sync.SyncMessages.WorldEvent;

/**
 * Pushes events to connected STOMP sessions.
 *
 * <p>Delivery is fire-and-forget. A failed send is logged and reported through the return value,
 * never thrown: by the time anything is broadcast the mutation behind it is already committed,
 * and a delivery problem must not turn it into an error for the caller.
 */
@Component
public class EventFanout {
    private static final Logger LOGGER = LoggerFactory.getLogger(EventFanout.class);

    /** Destination every session subscribes to for world-wide events. */
    public static final String WORLD_TOPIC = "/topic/world";
    /** Per-session queue, subscribed to by clients as {@code /user/queue/events}. */
    public static final String SESSION_QUEUE = "/queue/events";

    private final SimpMessagingTemplate messagingTemplate;

    public EventFanout(SimpMessagingTemplate messagingTemplate) {
        this.messagingTemplate = messagingTemplate;
    }

    /** Sends one event to every connected session. */
    public boolean broadcast(EventType type, Object data) {
        try {
            messagingTemplate.convertAndSend(WORLD_TOPIC, new WorldEvent(type, data));
            return true;
        } catch (MessagingException e) {
            LOGGER.warn("Broadcast of {} failed: {}", type.getValue(), e.getMessage());
            return false;
        }
    }

    /** Sends one event to a single session, addressed by its STOMP session id. */
    public boolean sendToSession(String sessionId, EventType type, Object data) {
        SimpMessageHeaderAccessor headers = SimpMessageHeaderAccessor.create(SimpMessageType.MESSAGE);
        headers.setSessionId(sessionId);
        headers.setLeaveMutable(true);
        try {
            messagingTemplate.convertAndSendToUser(
                sessionId, SESSION_QUEUE, new WorldEvent(type, data), headers.getMessageHeaders());
            return true;
        } catch (MessagingException e) {
            LOGGER.warn("Delivery of {} to session {} failed: {}", type.getValue(), sessionId, e.getMessage());
            return false;
        }
    }
}
