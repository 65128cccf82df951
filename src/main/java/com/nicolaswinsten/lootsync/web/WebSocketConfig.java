package com.nicolaswinsten.lootsync.web;

import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.simp.config.MessageBrokerRegistry;
import org.springframework.web.socket.config.annotation.EnableWebSocketMessageBroker;
import org.springframework.web.socket.config.annotation.StompEndpointRegistry;
import org.springframework.web.socket.config.annotation.WebSocketMessageBrokerConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketTransportRegistration;

/**
 * Configures the STOMP-over-WebSocket message broker used for all real-time world traffic.
 *
 * <h3>How messages flow</h3>
 * <ol>
 *   <li>Native clients open a plain WebSocket to {@code /ws}; browsers may use the SockJS
 *       endpoint {@code /sockjs}.</li>
 *   <li>A client subscribes to {@code /topic/world} and {@code /user/queue/events} first, then to
 *       {@code /app/session}, which answers with {@code connected} and starts a full resync.</li>
 *   <li>Messages the client sends to {@code /app/*} are routed to
 *       {@link SyncStompController @MessageMapping} methods.</li>
 *   <li>The server publishes world changes to {@code /topic/world}; replies meant for one session
 *       go to that session's {@code /user/queue/events}.</li>
 * </ol>
 *
 * <h3>Key destinations</h3>
 * <table>
 *   <tr><th>Destination</th><th>Direction</th><th>Purpose</th></tr>
 *   <tr><td>{@code /app/register_device}</td><td>client → server</td><td>bind the session to a device uuid</td></tr>
 *   <tr><td>{@code /app/request_sync}</td><td>client → server</td><td>ask for a full resync</td></tr>
 *   <tr><td>{@code /app/update_location}</td><td>client → server</td><td>report the device position</td></tr>
 *   <tr><td>{@code /app/get_connected_clients}</td><td>client → server</td><td>list connected devices</td></tr>
 *   <tr><td>{@code /app/admin_ping_client}</td><td>client → server</td><td>admin pings one device</td></tr>
 *   <tr><td>{@code /topic/world}</td><td>server → clients</td><td>object, find and location events</td></tr>
 *   <tr><td>{@code /user/queue/events}</td><td>server → one session</td><td>batches, replies, diagnostics</td></tr>
 * </table>
 *
 * Messages from one session are handled in the order they were received, and messages to one
 * session are delivered in the order they were sent, so resync batches arrive in index order.
 */
@Configuration
@EnableWebSocketMessageBroker
public class WebSocketConfig implements WebSocketMessageBrokerConfigurer {

    private final WebSocketSessionTerminator sessionTerminator;

    public WebSocketConfig(WebSocketSessionTerminator sessionTerminator) {
        this.sessionTerminator = sessionTerminator;
    }

    /**
     * Enable an in-memory STOMP broker on {@code /topic} and {@code /queue} and route
     * client-sent messages prefixed with {@code /app} to controller methods.
     */
    @Override
    public void configureMessageBroker(MessageBrokerRegistry registry) {
        registry.enableSimpleBroker("/topic", "/queue");
        registry.setApplicationDestinationPrefixes("/app");
        registry.setUserDestinationPrefix("/user");
        registry.setPreservePublishOrder(true);
    }

    /**
     * Expose {@code /ws} (plain WebSocket) and {@code /sockjs} (SockJS fallback) as handshake endpoints.
     * Devices identify themselves by uuid only, so any origin is accepted.
     */
    @Override
    public void registerStompEndpoints(StompEndpointRegistry registry) {
        registry.addEndpoint("/ws")
            .setAllowedOriginPatterns("*");
        registry.addEndpoint("/sockjs")
            .setAllowedOriginPatterns("*")
            .withSockJS();
        registry.setPreserveReceiveOrder(true);
    }

    /** Keep a handle on every transport session so a kick can close it. */
    @Override
    public void configureWebSocketTransport(WebSocketTransportRegistration registration) {
        registration.addDecoratorFactory(sessionTerminator);
    }
}
