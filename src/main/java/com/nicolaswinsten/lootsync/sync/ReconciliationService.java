package com.nicolaswinsten.lootsync.sync;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;
import org.springframework.stereotype.Service;

import com.nicolaswinsten.lootsync.config.LootSyncProperties;
import com.nicolaswinsten.lootsync.error.WorldStateException;
import com.nicolaswinsten.lootsync.presence.PresenceRegistry;
import com.nicolaswinsten.lootsync.sync.SyncMessages.ObjectsBatch;
import com.nicolaswinsten.lootsync.world.ObjectFilter;
import com.nicolaswinsten.lootsync.world.ObjectView;
import com.nicolaswinsten.lootsync.world.WorldStateService;

/**
 * Full-state resync, the mechanism clients actually converge on.
 *
 * <p>Broadcast deltas only shorten the time until a client sees a change; a client that missed
 * some of them (offline, dropped socket) is repaired by the next resync alone. A resync sends the
 * complete object set, found objects included, as seen by the session's device, split into
 * {@code objects_batch} messages of at most {@code lootsync.sync.batch-size} objects. The last
 * batch has {@code is_last_batch} set so the client knows the set is complete. An empty world is
 * still sent as one empty, final batch.
 *
 * <p>Resyncs run when a session subscribes, when it registers a device, when it asks for one, and
 * for every open session on a fixed delay.
 */
@Service
public class ReconciliationService implements SchedulingConfigurer {
    private static final Logger LOGGER = LoggerFactory.getLogger(ReconciliationService.class);

    private final WorldStateService worldStateService;
    private final PresenceRegistry presenceRegistry;
    private final EventFanout eventFanout;
    private final LootSyncProperties.Sync settings;

    public ReconciliationService(WorldStateService worldStateService,
                                 PresenceRegistry presenceRegistry,
                                 EventFanout eventFanout,
                                 LootSyncProperties properties) {
        this.worldStateService = worldStateService;
        this.presenceRegistry = presenceRegistry;
        this.eventFanout = eventFanout;
        this.settings = properties.sync();
    }

    /**
     * Sends the complete object set to one session.
     *
     * @return number of batches sent, 0 if the session is gone
     */
    public int resync(String sessionId) {
        if (!presenceRegistry.markSyncing(sessionId)) {
            LOGGER.debug("Skipping resync for closed session {}", sessionId);
            return 0;
        }
        String viewer = presenceRegistry.deviceFor(sessionId).orElse(null);
        List<ObjectView> objects = worldStateService.listObjects(ObjectFilter.everything(viewer));
        List<ObjectsBatch> batches = toBatches(objects, settings.batchSize());
        for (ObjectsBatch batch : batches) {
            eventFanout.sendToSession(sessionId, EventType.OBJECTS_BATCH, batch);
        }
        presenceRegistry.markLive(sessionId);
        LOGGER.debug("Resynced session {}: {} objects in {} batch(es)", sessionId, objects.size(), batches.size());
        return batches.size();
    }

    /** Resyncs every open session. One failing session does not stop the others. */
    public void resyncAll() {
        List<String> sessionIds = presenceRegistry.sessionIds();
        for (String sessionId : sessionIds) {
            try {
                resync(sessionId);
            } catch (WorldStateException e) {
                LOGGER.warn("Periodic resync of session {} failed: {}", sessionId, e.getMessage());
            }
        }
        if (!sessionIds.isEmpty()) {
            LOGGER.debug("Periodic resync sent to {} session(s)", sessionIds.size());
        }
    }

    @Override
    public void configureTasks(ScheduledTaskRegistrar registrar) {
        if (!settings.periodicEnabled()) {
            LOGGER.info("Periodic resync disabled");
            return;
        }
        registrar.addFixedDelayTask(this::resyncAll, settings.periodicInterval());
        LOGGER.info("Periodic resync every {}", settings.periodicInterval());
    }

    static List<ObjectsBatch> toBatches(List<ObjectView> objects, int batchSize) {
        int size = Math.max(1, batchSize);
        int total = Math.max(1, (objects.size() + size - 1) / size);
        List<ObjectsBatch> batches = new ArrayList<>(total);
        for (int index = 0; index < total; index++) {
            int from = index * size;
            int to = Math.min(objects.size(), from + size);
            batches.add(new ObjectsBatch(
                List.copyOf(objects.subList(from, to)), index, total, index == total - 1));
        }
        return batches;
    }
}
