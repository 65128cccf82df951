package com.nicolaswinsten.lootsync.world;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import com.nicolaswinsten.lootsync.error.ConflictException;
import com.nicolaswinsten.lootsync.error.NotFoundException;
import com.nicolaswinsten.lootsync.error.ValidationException;
import com.nicolaswinsten.lootsync.sync.EventFanout;
import com.nicolaswinsten.lootsync.sync.EventType;
import com.nicolaswinsten.lootsync.sync.SyncMessages.FindsReset;
import com.nicolaswinsten.lootsync.sync.SyncMessages.ObjectCollected;
import com.nicolaswinsten.lootsync.sync.SyncMessages.ObjectDeleted;
import com.nicolaswinsten.lootsync.sync.SyncMessages.ObjectUncollected;

/**
 * Write-then-broadcast core for objects and finds.
 *
 * <h3>Flow of a write</h3>
 * <ol>
 *   <li>Validate the request; validation failures never reach the store.</li>
 *   <li>Commit through {@link StoreWriter}, the only path that changes rows.</li>
 *   <li>Only after the commit returns, emit exactly one event to every connected session via
 *       {@link EventFanout}. A failed write emits nothing.</li>
 * </ol>
 *
 * Reads go straight to the store and resolve collected status through {@link VisibilityResolver}.
 */
@Service
public class WorldStateService {
    private static final Logger LOGGER = LoggerFactory.getLogger(WorldStateService.class);

    static final int TOP_FINDER_LIMIT = 10;

    private final WorldStore worldStore;
    private final FindLedger findLedger;
    private final StoreWriter storeWriter;
    private final VisibilityResolver visibilityResolver;
    private final EventFanout eventFanout;
    private final Clock clock;

    public WorldStateService(WorldStore worldStore,
                             FindLedger findLedger,
                             StoreWriter storeWriter,
                             VisibilityResolver visibilityResolver,
                             EventFanout eventFanout,
                             Clock clock) {
        this.worldStore = worldStore;
        this.findLedger = findLedger;
        this.storeWriter = storeWriter;
        this.visibilityResolver = visibilityResolver;
        this.eventFanout = eventFanout;
        this.clock = clock;
    }

    // ── Objects ─────────────────────────────────────────────────────────────

    /**
     * Stores a new object and announces it with {@code object_created}.
     *
     * @throws ConflictException   if an object with the same id already exists; the stored one is left untouched
     * @throws ValidationException if a required field is missing
     */
    public ObjectView createObject(ObjectDraft draft) {
        if (draft == null) {
            throw new ValidationException("Request body is required");
        }
        String createdBy = draft.createdBy() == null || draft.createdBy().isBlank()
            ? WorldObject.UNKNOWN_CREATOR
            : draft.createdBy().trim();
        ArPlacement ar = draft.arPlacement() == null || draft.arPlacement().isEmpty() ? null : draft.arPlacement();
        WorldObject object = new WorldObject(
            // Stored verbatim: every lookup matches the id exactly as sent
            ValidationException.requireNonBlank(draft.id(), "id"),
            ValidationException.requireText(draft.name(), "name"),
            ValidationException.requireText(draft.type(), "type"),
            ValidationException.requirePresent(draft.latitude(), "latitude"),
            ValidationException.requirePresent(draft.longitude(), "longitude"),
            ValidationException.requirePresent(draft.radius(), "radius"),
            clock.instant(),
            createdBy,
            draft.groundingHeight(),
            ar,
            Boolean.TRUE.equals(draft.multifindable()));

        try {
            storeWriter.run("create object", () -> worldStore.insert(object));
        } catch (DuplicateKeyException e) {
            throw new ConflictException("Object with this ID already exists: " + object.id(), e);
        }
        LOGGER.info("Object created: id={}, type={}, createdBy={}", object.id(), object.type(), createdBy);

        ObjectView view = ObjectView.of(object, Visibility.uncollected(0));
        eventFanout.broadcast(EventType.OBJECT_CREATED, view);
        return view;
    }

    /** @throws NotFoundException if there is no object with this id */
    public ObjectView getObject(String id, String viewer) {
        WorldObject object = worldStore.find(id).orElseThrow(() -> NotFoundException.object(id));
        return ObjectView.of(object, visibilityResolver.resolve(object, findLedger.findsFor(id), viewer));
    }

    /**
     * Objects matching {@code filter}, newest first. Objects collected for the filter's viewer are
     * dropped unless {@link ObjectFilter#includeFound()} is set.
     */
    public List<ObjectView> listObjects(ObjectFilter filter) {
        List<WorldObject> objects = worldStore.findAll(filter.boundingBox());
        Map<String, List<Find>> finds = findLedger.findsByObject(objects.stream().map(WorldObject::id).toList());
        List<ObjectView> views = new ArrayList<>(objects.size());
        for (WorldObject object : objects) {
            Visibility visibility = visibilityResolver.resolve(
                object, finds.getOrDefault(object.id(), List.of()), filter.viewer());
            if (visibility.collected() && !filter.includeFound()) {
                continue;
            }
            views.add(ObjectView.of(object, visibility));
        }
        return views;
    }

    public ObjectView updateLocation(String id, Double latitude, Double longitude) {
        if (latitude == null && longitude == null) {
            throw new ValidationException("No location fields supplied (latitude, longitude)");
        }
        double lat = ValidationException.requirePresent(latitude, "latitude");
        double lon = ValidationException.requirePresent(longitude, "longitude");
        storeWriter.run("update object location", () -> requireUpdated(worldStore.updateLocation(id, lat, lon), id));
        LOGGER.info("Object moved: id={}, lat={}, lon={}", id, lat, lon);
        return announceUpdate(id);
    }

    public ObjectView updateGrounding(String id, Double groundingHeight) {
        if (groundingHeight == null) {
            throw new ValidationException("No grounding field supplied (grounding_height)");
        }
        storeWriter.run("update grounding", () -> requireUpdated(worldStore.updateGrounding(id, groundingHeight), id));
        LOGGER.debug("Grounding height updated: id={}, height={}", id, groundingHeight);
        return announceUpdate(id);
    }

    /** Applies the non-null fields of {@code update} on top of the stored AR placement. */
    public ObjectView updateArOffset(String id, ArPlacement update) {
        if (update == null || update.isEmpty()) {
            throw new ValidationException("No AR placement fields supplied");
        }
        storeWriter.run("update AR offset", () -> {
            WorldObject current = worldStore.find(id).orElseThrow(() -> NotFoundException.object(id));
            ArPlacement base = current.arPlacement() != null ? current.arPlacement() : ArPlacement.none();
            worldStore.updateArPlacement(id, base.mergedWith(update));
        });
        LOGGER.debug("AR placement updated: id={}", id);
        return announceUpdate(id);
    }

    /**
     * Deletes an object together with all of its finds, in one transaction.
     *
     * @return number of find rows removed along with the object
     */
    public int deleteObject(String id) {
        int findsDeleted = storeWriter.write("delete object", () -> {
            int removed = findLedger.deleteFor(id);
            requireUpdated(worldStore.delete(id), id);
            return removed;
        });
        LOGGER.info("Object deleted: id={}, findsDeleted={}", id, findsDeleted);
        eventFanout.broadcast(EventType.OBJECT_DELETED, new ObjectDeleted(id, findsDeleted));
        return findsDeleted;
    }

    // ── Finds ───────────────────────────────────────────────────────────────

    /**
     * Appends a find. Repeat finds by the same finder are recorded too.
     *
     * @throws NotFoundException   if the object does not exist
     * @throws ValidationException if {@code foundBy} is missing
     */
    public Find markFound(String objectId, String foundBy) {
        String finder = ValidationException.requireText(foundBy, "found_by");
        Instant now = clock.instant();
        Find find = storeWriter.write("mark found", () -> {
            if (!worldStore.exists(objectId)) {
                throw NotFoundException.object(objectId);
            }
            return findLedger.append(objectId, finder, now);
        });
        LOGGER.info("Object found: id={}, foundBy={}", objectId, finder);
        eventFanout.broadcast(EventType.OBJECT_COLLECTED, new ObjectCollected(objectId, finder, find.foundAt()));
        return find;
    }

    /**
     * Removes every find of an object. Succeeds with {@code 0} when there was nothing to remove,
     * including for unknown ids.
     */
    public int unmarkFound(String objectId) {
        int deleted = storeWriter.write("unmark found", () -> findLedger.deleteFor(objectId));
        if (deleted == 0) {
            LOGGER.info("Object already unfound: id={}", objectId);
        } else {
            LOGGER.info("Finds removed: id={}, count={}", objectId, deleted);
        }
        eventFanout.broadcast(EventType.OBJECT_UNCOLLECTED, new ObjectUncollected(objectId, deleted));
        return deleted;
    }

    /** @return number of find rows removed */
    public int resetAllFinds() {
        int removed = storeWriter.write("reset finds", findLedger::deleteAll);
        LOGGER.info("All finds reset: removed={}", removed);
        eventFanout.broadcast(EventType.ALL_FINDS_RESET, new FindsReset(removed));
        return removed;
    }

    public List<Find> findsFor(String objectId) {
        return findLedger.findsFor(objectId);
    }

    public List<UserFind> findsBy(String userId) {
        return findLedger.findsBy(ValidationException.requireText(userId, "user_id"));
    }

    public WorldStats stats() {
        long totalObjects = worldStore.count();
        long foundObjects = findLedger.countFoundObjects();
        return new WorldStats(
            totalObjects,
            foundObjects,
            Math.max(0, totalObjects - foundObjects),
            findLedger.countFinds(),
            findLedger.topFinders(TOP_FINDER_LIMIT));
    }

    private ObjectView announceUpdate(String id) {
        Optional<WorldObject> updated = worldStore.find(id);
        if (updated.isEmpty()) {
            // Deleted between commit and re-read; the delete broadcast covers it
            throw NotFoundException.object(id);
        }
        ObjectView view = ObjectView.of(updated.get(),
            visibilityResolver.resolve(updated.get(), findLedger.findsFor(id), null));
        eventFanout.broadcast(EventType.OBJECT_UPDATED, view);
        return view;
    }

    private static void requireUpdated(int rows, String id) {
        if (rows == 0) {
            throw NotFoundException.object(id);
        }
    }
}
