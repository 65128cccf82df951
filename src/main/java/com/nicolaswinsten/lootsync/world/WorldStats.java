package com.nicolaswinsten.lootsync.world;

import java.util.List;

/** Counts shown on the admin dashboard plus the finder leaderboard. */
public record WorldStats(
        long totalObjects,
        long foundObjects,
        long unfoundObjects,
        long totalFinds,
        List<TopFinder> topFinders) {

    /**
     * @param user       device uuid of the finder
     * @param playerName registered name of that device, {@code null} if it never registered one
     */
    public record TopFinder(String user, String playerName, long count) {}
}
