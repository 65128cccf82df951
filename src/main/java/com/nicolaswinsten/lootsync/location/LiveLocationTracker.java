package com.nicolaswinsten.lootsync.location;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.nicolaswinsten.lootsync.config.LootSyncProperties;
import com.nicolaswinsten.lootsync.error.StorageBusyException;
import com.nicolaswinsten.lootsync.error.ValidationException;
import com.nicolaswinsten.lootsync.sync.EventFanout;
import com.nicolaswinsten.lootsync.sync.EventType;
import com.nicolaswinsten.lootsync.world.StoreWriter;

/**
 * Live device positions for the admin map.
 *
 * <p>Last write wins per device: reports are applied in the order they reach the server, with no
 * sequence check against late retransmits. Entries older than
 * {@code lootsync.presence.location-freshness} drop out of {@link #activeLocations()} but stay in
 * memory until replaced or the device is forgotten.
 */
@Service
public class LiveLocationTracker {
    private static final Logger LOGGER = LoggerFactory.getLogger(LiveLocationTracker.class);

    private final ConcurrentMap<String, LiveLocation> locations = new ConcurrentHashMap<>();

    private final LastLocationStore lastLocationStore;
    private final StoreWriter storeWriter;
    private final EventFanout eventFanout;
    private final Clock clock;
    private final Duration freshness;
    private final MapCenter defaultCenter;

    public LiveLocationTracker(LastLocationStore lastLocationStore,
                               StoreWriter storeWriter,
                               EventFanout eventFanout,
                               Clock clock,
                               LootSyncProperties properties) {
        this.lastLocationStore = lastLocationStore;
        this.storeWriter = storeWriter;
        this.eventFanout = eventFanout;
        this.clock = clock;
        this.freshness = properties.presence().locationFreshness();
        this.defaultCenter = new MapCenter(
            properties.map().defaultLatitude(), properties.map().defaultLongitude(), "default");
    }

    /**
     * Records a position, snapshots it as the device's last known location and broadcasts
     * {@code user_location_updated}.
     *
     * <p>The snapshot is best effort: when the store stays busy the live position is still kept
     * and broadcast.
     */
    public LiveLocation update(String deviceUuid, LocationUpdate update) {
        String device = ValidationException.requireText(deviceUuid, "device_uuid");
        if (update == null) {
            throw new ValidationException("Request body is required");
        }
        double latitude = ValidationException.requirePresent(update.latitude(), "latitude");
        double longitude = ValidationException.requirePresent(update.longitude(), "longitude");
        LiveLocation location = new LiveLocation(
            device, latitude, longitude, update.accuracy(), update.heading(), update.arOffset(), clock.instant());
        locations.put(device, location);

        try {
            storeWriter.run("save last location",
                () -> lastLocationStore.save(device, latitude, longitude, location.updatedAt()));
        } catch (StorageBusyException e) {
            LOGGER.warn("Last known location of {} not persisted: {}", device, e.getMessage());
        }

        eventFanout.broadcast(EventType.USER_LOCATION_UPDATED, location);
        LOGGER.debug("Location updated: device={}, lat={}, lon={}", device, latitude, longitude);
        return location;
    }

    /** Positions reported within the freshness window, keyed and sorted by device uuid. */
    public Map<String, LiveLocation> activeLocations() {
        Instant cutoff = clock.instant().minus(freshness);
        Map<String, LiveLocation> active = new TreeMap<>();
        for (LiveLocation location : locations.values()) {
            if (!location.updatedAt().isBefore(cutoff)) {
                active.put(location.deviceUuid(), location);
            }
        }
        return active;
    }

    public Optional<LiveLocation> get(String deviceUuid) {
        return Optional.ofNullable(locations.get(deviceUuid));
    }

    /** Center for the admin map: the most recent persisted position, or the configured default. */
    public MapCenter defaultCenter() {
        return lastLocationStore.mostRecent().orElse(defaultCenter);
    }

    /** Drops both the live and the persisted position of a device. */
    public void forget(String deviceUuid) {
        locations.remove(deviceUuid);
        storeWriter.run("forget last location", () -> lastLocationStore.delete(deviceUuid));
    }
}
