package com.nicolaswinsten.lootsync.web;

import java.io.IOException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.WebSocketHandlerDecorator;
import org.springframework.web.socket.handler.WebSocketHandlerDecoratorFactory;

import com.nicolaswinsten.lootsync.presence.SessionTerminator;

/**
 * Tracks open WebSocket sessions by id so they can be closed from the server side.
 *
 * <p>The STOMP session id Spring hands to controllers ({@code simpSessionId}) is the id of the
 * underlying WebSocket session, so the presence registry can address sessions here directly.
 */
@Component
public class WebSocketSessionTerminator implements WebSocketHandlerDecoratorFactory, SessionTerminator {
    private static final Logger LOGGER = LoggerFactory.getLogger(WebSocketSessionTerminator.class);

    static final CloseStatus KICKED = CloseStatus.POLICY_VIOLATION.withReason("Kicked by admin");

    private final ConcurrentMap<String, WebSocketSession> openSessions = new ConcurrentHashMap<>();

    @Override
    public WebSocketHandler decorate(WebSocketHandler handler) {
        return new WebSocketHandlerDecorator(handler) {
            @Override
            public void afterConnectionEstablished(WebSocketSession session) throws Exception {
                openSessions.put(session.getId(), session);
                super.afterConnectionEstablished(session);
            }

            @Override
            public void afterConnectionClosed(WebSocketSession session, CloseStatus closeStatus) throws Exception {
                openSessions.remove(session.getId());
                super.afterConnectionClosed(session, closeStatus);
            }
        };
    }

    @Override
    public boolean terminate(String sessionId) {
        WebSocketSession session = openSessions.remove(sessionId);
        if (session == null || !session.isOpen()) {
            return false;
        }
        try {
            session.close(KICKED);
            return true;
        } catch (IOException e) {
            LOGGER.warn("Failed to close session {}: {}", sessionId, e.getMessage());
            return false;
        }
    }

    int openSessionCount() {
        return openSessions.size();
    }
}
