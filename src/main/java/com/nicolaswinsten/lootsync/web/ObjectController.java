package com.nicolaswinsten.lootsync.web;

import java.time.Instant;
import java.util.List;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import com.nicolaswinsten.lootsync.error.ValidationException;
import com.nicolaswinsten.lootsync.world.ArPlacement;
import com.nicolaswinsten.lootsync.world.Find;
import com.nicolaswinsten.lootsync.world.ObjectDraft;
import com.nicolaswinsten.lootsync.world.ObjectFilter;
import com.nicolaswinsten.lootsync.world.ObjectView;
import com.nicolaswinsten.lootsync.world.UserFind;
import com.nicolaswinsten.lootsync.world.WorldStateService;
import com.nicolaswinsten.lootsync.world.WorldStats;

/**
 * HTTP surface for objects, finds and world statistics. Every mutation here is broadcast to
 * connected sessions by {@link WorldStateService} once it has committed.
 */
@RestController
@RequestMapping("/api")
public class ObjectController {

    private final WorldStateService worldStateService;

    public ObjectController(WorldStateService worldStateService) {
        this.worldStateService = worldStateService;
    }

    // ── Objects ─────────────────────────────────────────────────────────────

    @GetMapping("/objects")
    public List<ObjectView> listObjects(@RequestParam(required = false) Double latitude,
                                        @RequestParam(required = false) Double longitude,
                                        @RequestParam(required = false) Double radius,
                                        @RequestParam(name = "include_found", defaultValue = "false") boolean includeFound,
                                        @RequestParam(name = "user_id", required = false) String userId) {
        return worldStateService.listObjects(new ObjectFilter(latitude, longitude, radius, includeFound, blankToNull(userId)));
    }

    @GetMapping("/objects/{id}")
    public ObjectView getObject(@PathVariable String id,
                                @RequestParam(name = "user_id", required = false) String userId) {
        return worldStateService.getObject(id, blankToNull(userId));
    }

    @PostMapping("/objects")
    @ResponseStatus(HttpStatus.CREATED)
    public ObjectView createObject(@RequestBody ObjectDraft draft) {
        return worldStateService.createObject(draft);
    }

    /** Moves an object. Both coordinates are required. */
    @PutMapping("/objects/{id}")
    public UpdateResponse updateLocation(@PathVariable String id, @RequestBody LocationBody body) {
        return new UpdateResponse(true, worldStateService.updateLocation(id, body.latitude(), body.longitude()));
    }

    @PutMapping("/objects/{id}/grounding")
    public UpdateResponse updateGrounding(@PathVariable String id, @RequestBody GroundingBody body) {
        return new UpdateResponse(true, worldStateService.updateGrounding(id, body.groundingHeight()));
    }

    /** Partial update: only the AR fields present in the body replace the stored ones. */
    @PutMapping("/objects/{id}/ar-offset")
    public UpdateResponse updateArOffset(@PathVariable String id, @RequestBody ArPlacement body) {
        return new UpdateResponse(true, worldStateService.updateArOffset(id, body));
    }

    @DeleteMapping("/objects/{id}")
    public DeletedResponse deleteObject(@PathVariable String id) {
        int findsDeleted = worldStateService.deleteObject(id);
        return new DeletedResponse(id, "Object deleted", findsDeleted);
    }

    // ── Finds ───────────────────────────────────────────────────────────────

    @PostMapping("/objects/{id}/found")
    public FoundResponse markFound(@PathVariable String id, @RequestBody(required = false) FoundBody body) {
        if (body == null) {
            throw new ValidationException("Missing required field: found_by");
        }
        Find find = worldStateService.markFound(id, body.foundBy());
        return new FoundResponse(find.objectId(), find.foundBy(), find.foundAt(), "Object marked as found");
    }

    /** Removes every find of the object. Succeeds with zero removals when it was not found. */
    @DeleteMapping("/objects/{id}/found")
    public DeletedResponse unmarkFound(@PathVariable String id) {
        int findsDeleted = worldStateService.unmarkFound(id);
        String message = findsDeleted == 0 ? "Object already unfound" : "Find records removed";
        return new DeletedResponse(id, message, findsDeleted);
    }

    @GetMapping("/objects/{id}/finds")
    public List<Find> findsFor(@PathVariable String id) {
        return worldStateService.findsFor(id);
    }

    @GetMapping("/users/{userId}/finds")
    public List<UserFind> findsBy(@PathVariable String userId) {
        return worldStateService.findsBy(userId);
    }

    @PostMapping("/finds/reset")
    public ResetResponse resetAllFinds() {
        int removed = worldStateService.resetAllFinds();
        return new ResetResponse("All finds reset", removed);
    }

    @GetMapping("/stats")
    public WorldStats stats() {
        return worldStateService.stats();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    // ── Request and response bodies ─────────────────────────────────────────

    public record LocationBody(Double latitude, Double longitude) {}

    public record GroundingBody(Double groundingHeight) {}

    public record FoundBody(String foundBy) {}

    public record UpdateResponse(boolean success, ObjectView object) {}

    public record DeletedResponse(String objectId, String message, int findsDeleted) {}

    public record FoundResponse(String objectId, String foundBy, Instant foundAt, String message) {}

    public record ResetResponse(String message, int findsRemoved) {}
}
