package com.nicolaswinsten.lootsync.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Typed view of the {@code lootsync.*} block in {@code application.yml}.
 */
@ConfigurationProperties(prefix = "lootsync")
public record LootSyncProperties(
        @DefaultValue Sync sync,
        @DefaultValue Store store,
        @DefaultValue Presence presence,
        @DefaultValue MapCenter map) {

    /**
     * Batch resync settings.
     * @param batchSize        maximum objects per {@code objects_batch} message
     * @param periodicInterval delay between two server-initiated resyncs of every session
     * @param periodicEnabled  turns the periodic resync off entirely
     */
    public record Sync(
            @DefaultValue("50") int batchSize,
            @DefaultValue("30s") Duration periodicInterval,
            @DefaultValue("true") boolean periodicEnabled) {}

    /**
     * Single-writer retry policy.
     * @param writeTimeout how long a writer waits for its turn before the call is reported busy
     */
    public record Store(
            @DefaultValue("3") int maxAttempts,
            @DefaultValue("100ms") Duration initialBackoff,
            @DefaultValue("2.0") double backoffMultiplier,
            @DefaultValue("1s") Duration maxBackoff,
            @DefaultValue("5s") Duration writeTimeout) {}

    /**
     * @param locationFreshness live locations older than this are left out of "active" queries
     * @param adminPingExpiry   unanswered admin pings are forgotten after this long
     */
    public record Presence(
            @DefaultValue("5m") Duration locationFreshness,
            @DefaultValue("60s") Duration adminPingExpiry) {}

    /** Fallback map center used before any device has reported a location. */
    public record MapCenter(
            @DefaultValue("40.0758") double defaultLatitude,
            @DefaultValue("-105.3008") double defaultLongitude) {}
}
