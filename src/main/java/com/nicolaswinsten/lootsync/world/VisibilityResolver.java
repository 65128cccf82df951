package com.nicolaswinsten.lootsync.world;

import java.util.List;

import org.springframework.stereotype.Component;

/**
 * Decides whether an object counts as collected for a viewer. Computed from the find ledger
 * on every read and never stored.
 *
 * <ul>
 *   <li>Single-find objects ({@code multifindable == false}) are collected for everyone as soon as
 *       any find exists.</li>
 *   <li>Multi-find objects are collected only for viewers with a find of their own; everyone else
 *       still sees them.</li>
 *   <li>Without a viewer (admin map, global listings) an object is collected when any find exists.</li>
 * </ul>
 * The reported finder is the earliest matching ledger row.
 */
@Component
public class VisibilityResolver {

    /**
     * @param finds  ledger rows for {@code object}, in insertion order
     * @param viewer device the status is resolved for, or {@code null} for the global view
     */
    public Visibility resolve(WorldObject object, List<Find> finds, String viewer) {
        if (finds.isEmpty()) {
            return Visibility.uncollected(0);
        }
        if (!object.multifindable() || viewer == null || viewer.isBlank()) {
            Find first = finds.get(0);
            return new Visibility(true, first.foundBy(), first.foundAt(), finds.size());
        }
        for (Find find : finds) {
            if (viewer.equals(find.foundBy())) {
                return new Visibility(true, find.foundBy(), find.foundAt(), finds.size());
            }
        }
        return Visibility.uncollected(finds.size());
    }
}
