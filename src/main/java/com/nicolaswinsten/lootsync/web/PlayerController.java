package com.nicolaswinsten.lootsync.web;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.nicolaswinsten.lootsync.error.ValidationException;
import com.nicolaswinsten.lootsync.player.Player;
import com.nicolaswinsten.lootsync.player.PlayerService;
import com.nicolaswinsten.lootsync.player.PlayerSummary;
import com.nicolaswinsten.lootsync.presence.ConnectedDevice;
import com.nicolaswinsten.lootsync.presence.KickResult;
import com.nicolaswinsten.lootsync.presence.PresenceRegistry;

/**
 * Player names and the admin actions on connected devices.
 */
@RestController
@RequestMapping("/api")
public class PlayerController {
    private static final Logger LOGGER = LoggerFactory.getLogger(PlayerController.class);

    private final PlayerService playerService;
    private final PresenceRegistry presenceRegistry;

    public PlayerController(PlayerService playerService, PresenceRegistry presenceRegistry) {
        this.playerService = playerService;
        this.presenceRegistry = presenceRegistry;
    }

    @GetMapping("/players")
    public List<PlayerSummary> listPlayers() {
        return playerService.listPlayers();
    }

    @GetMapping("/players/{deviceUuid}")
    public Player getPlayer(@PathVariable String deviceUuid) {
        return playerService.getPlayer(deviceUuid);
    }

    /** Creates or renames the player for a device. */
    @PostMapping("/players/{deviceUuid}")
    public Player savePlayer(@PathVariable String deviceUuid, @RequestBody(required = false) PlayerBody body) {
        if (body == null) {
            throw new ValidationException("Missing required field: player_name");
        }
        return playerService.savePlayerName(deviceUuid, body.playerName());
    }

    @DeleteMapping("/players/{deviceUuid}")
    public MessageResponse deletePlayer(@PathVariable String deviceUuid) {
        playerService.deletePlayer(deviceUuid);
        return new MessageResponse("Player deleted");
    }

    /** Disconnects every session of the device. Not an error when the device is offline. */
    @PostMapping("/players/{deviceUuid}/kick")
    public KickResult kick(@PathVariable String deviceUuid) {
        KickResult result = playerService.kick(deviceUuid);
        LOGGER.info("Kick requested for {}: kicked={}, sessions={}", deviceUuid, result.kicked(), result.sessionIds().size());
        return result;
    }

    @GetMapping("/clients/connected")
    public List<ConnectedDevice> connectedClients() {
        return presenceRegistry.listConnected();
    }

    public record PlayerBody(String playerName) {}

    public record MessageResponse(String message) {}
}
