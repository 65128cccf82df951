package com.nicolaswinsten.lootsync.player;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.nicolaswinsten.lootsync.error.NotFoundException;
import com.nicolaswinsten.lootsync.error.ValidationException;
import com.nicolaswinsten.lootsync.location.LiveLocationTracker;
import com.nicolaswinsten.lootsync.presence.KickResult;
import com.nicolaswinsten.lootsync.presence.PresenceRegistry;
import com.nicolaswinsten.lootsync.world.FindLedger;
import com.nicolaswinsten.lootsync.world.StoreWriter;

/**
 * Player records and the admin actions on them.
 *
 * <p>The device uuid is the only identity. Two devices may pick the same name; that is
 * resolved at display time by {@link #displayNames}, never rejected.
 */
@Service
public class PlayerService {
    private static final Logger LOGGER = LoggerFactory.getLogger(PlayerService.class);

    private static final int SHARED_NAME_PREFIX = 4;
    private static final int UNNAMED_PREFIX = 8;

    private final PlayerStore playerStore;
    private final FindLedger findLedger;
    private final StoreWriter storeWriter;
    private final PresenceRegistry presenceRegistry;
    private final LiveLocationTracker liveLocationTracker;
    private final Clock clock;

    public PlayerService(PlayerStore playerStore,
                         FindLedger findLedger,
                         StoreWriter storeWriter,
                         PresenceRegistry presenceRegistry,
                         LiveLocationTracker liveLocationTracker,
                         Clock clock) {
        this.playerStore = playerStore;
        this.findLedger = findLedger;
        this.storeWriter = storeWriter;
        this.presenceRegistry = presenceRegistry;
        this.liveLocationTracker = liveLocationTracker;
        this.clock = clock;
    }

    /** Creates the player on first use, renames it afterwards. */
    public Player savePlayerName(String deviceUuid, String playerName) {
        String device = ValidationException.requireText(deviceUuid, "device_uuid");
        String name = ValidationException.requireText(playerName, "player_name");
        Player player = storeWriter.write("save player", () -> playerStore.upsert(device, name, clock.instant()));
        LOGGER.info("Player saved: device={}, name={}", device, name);
        return player;
    }

    /** @throws NotFoundException if the device never registered a name */
    public Player getPlayer(String deviceUuid) {
        return playerStore.find(deviceUuid).orElseThrow(() -> NotFoundException.player(deviceUuid));
    }

    public List<PlayerSummary> listPlayers() {
        List<Player> players = playerStore.findAll();
        Map<String, Long> findCounts = findLedger.countsByFinder();
        Map<String, String> displayNames = displayNames(players);
        List<PlayerSummary> summaries = new ArrayList<>(players.size());
        for (Player player : players) {
            summaries.add(new PlayerSummary(
                player.deviceUuid(),
                player.playerName(),
                displayNames.get(player.deviceUuid()),
                findCounts.getOrDefault(player.deviceUuid(), 0L),
                presenceRegistry.isConnected(player.deviceUuid()),
                player.createdAt(),
                player.updatedAt()));
        }
        return summaries;
    }

    /**
     * Deletes the player record and its last known location. Finds made by the device stay in
     * the ledger.
     */
    public void deletePlayer(String deviceUuid) {
        storeWriter.run("delete player", () -> {
            if (playerStore.delete(deviceUuid) == 0) {
                throw NotFoundException.player(deviceUuid);
            }
        });
        liveLocationTracker.forget(deviceUuid);
        LOGGER.info("Player deleted: device={}", deviceUuid);
    }

    public KickResult kick(String deviceUuid) {
        return presenceRegistry.kick(deviceUuid);
    }

    /**
     * Display names keyed by device uuid. A name held by one device is shown as is; a name shared by
     * several gets a uuid prefix appended, four characters to start with. Unnamed players show as
     * {@code "Player <first 8 chars of uuid>"}. Whenever two players would still display the same,
     * the prefixes of the colliding suffixed groups grow one character at a time, up to the full uuid.
     */
    static Map<String, String> displayNames(List<Player> players) {
        Map<String, Integer> nameUse = new HashMap<>();
        int longestUuid = 0;
        for (Player player : players) {
            longestUuid = Math.max(longestUuid, player.deviceUuid().length());
            String name = nameOf(player);
            if (!name.isEmpty()) {
                nameUse.merge(name, 1, Integer::sum);
            }
        }
        // Prefix length per suffixed group; "" is the group of unnamed players
        Map<String, Integer> prefixLength = new HashMap<>();
        for (Player player : players) {
            String name = nameOf(player);
            if (name.isEmpty()) {
                prefixLength.put(name, UNNAMED_PREFIX);
            } else if (nameUse.get(name) > 1) {
                prefixLength.put(name, SHARED_NAME_PREFIX);
            }
        }
        while (true) {
            Map<String, String> displayNames = new HashMap<>();
            Map<String, Integer> displayUse = new HashMap<>();
            for (Player player : players) {
                String name = nameOf(player);
                String display = display(name, player.deviceUuid(), prefixLength.get(name));
                displayNames.put(player.deviceUuid(), display);
                displayUse.merge(display, 1, Integer::sum);
            }
            Set<String> growing = new HashSet<>();
            for (Player player : players) {
                String name = nameOf(player);
                Integer length = prefixLength.get(name);
                if (length != null && length < longestUuid
                    && displayUse.get(displayNames.get(player.deviceUuid())) > 1) {
                    growing.add(name);
                }
            }
            if (growing.isEmpty()) {
                return displayNames;
            }
            for (String name : growing) {
                prefixLength.merge(name, 1, Integer::sum);
            }
        }
    }

    private static String nameOf(Player player) {
        return player.playerName() == null ? "" : player.playerName().trim();
    }

    private static String display(String name, String uuid, Integer prefixLength) {
        if (name.isEmpty()) {
            return "Player " + prefix(uuid, prefixLength);
        }
        if (prefixLength == null) {
            return name;
        }
        return name + " (" + prefix(uuid, prefixLength) + ")";
    }

    private static String prefix(String value, int length) {
        return value.length() <= length ? value : value.substring(0, length);
    }
}
