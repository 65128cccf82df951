package com.nicolaswinsten.lootsync.web;

import java.util.Map;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.nicolaswinsten.lootsync.location.LiveLocation;
import com.nicolaswinsten.lootsync.location.LiveLocationTracker;
import com.nicolaswinsten.lootsync.location.LocationUpdate;
import com.nicolaswinsten.lootsync.location.MapCenter;

/**
 * Live device positions for the admin map.
 */
@RestController
@RequestMapping("/api")
public class LocationController {

    private final LiveLocationTracker liveLocationTracker;

    public LocationController(LiveLocationTracker liveLocationTracker) {
        this.liveLocationTracker = liveLocationTracker;
    }

    @PostMapping("/users/{deviceUuid}/location")
    public LiveLocation updateLocation(@PathVariable String deviceUuid,
                                       @RequestBody(required = false) LocationUpdate update) {
        return liveLocationTracker.update(deviceUuid, update);
    }

    /** Fresh positions only, keyed by device uuid. */
    @GetMapping("/users/locations")
    public Map<String, LiveLocation> activeLocations() {
        return liveLocationTracker.activeLocations();
    }

    @GetMapping("/map/default_center")
    public MapCenter defaultCenter() {
        return liveLocationTracker.defaultCenter();
    }
}
