package com.nicolaswinsten.lootsync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Entry point for the loot sync server.
 *
 * <p>This Spring Boot application keeps every connected AR client consistent with one
 * authoritative store of placed objects, finds and players. Writes arrive over HTTP or STOMP,
 * are committed through a single writer, then fanned out to all live sessions. A periodic
 * batch resync repairs whatever a client missed while disconnected.
 *
 * @see com.nicolaswinsten.lootsync.web.WebSocketConfig  WebSocket/STOMP wiring
 * @see com.nicolaswinsten.lootsync.web.SyncStompController  real-time session handling
 * @see com.nicolaswinsten.lootsync.world.WorldStateService  write-then-broadcast core
 */
@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
public class LootSyncServer {
    public static void main(String[] args) {
        SpringApplication.run(LootSyncServer.class, args);
    }
}
