package ch.battleship.navalcombat.web.api.dto;

import ch.battleship.navalcombat.domain.ActionResult;
import ch.battleship.navalcombat.domain.EventLogEntry;
import ch.battleship.navalcombat.domain.Game;
import ch.battleship.navalcombat.domain.Player;
import ch.battleship.navalcombat.domain.enums.GameEventType;
import ch.battleship.navalcombat.domain.enums.GameState;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Notification sent to {@code /topic/games/{gameCode}/events}.
 */
public record GameEventDto(
        GameEventType type,
        String gameCode,
        GameState gameState,
        Instant timeStamp,
        Map<String, Object> payload
) {
    public static GameEventDto playerJoined(Game game, Player player) {
        return new GameEventDto(
                GameEventType.PLAYER_JOINED,
                game.getGameCode(),
                game.getState(),
                Instant.now(),
                Map.of(
                        "playerName", player.getName(),
                        "playerType", player.getType().name(),
                        "allianceId", player.getAllianceId()
                )
        );
    }

    public static GameEventDto placementStarted(Game game) {
        return new GameEventDto(
                GameEventType.PLACEMENT_STARTED,
                game.getGameCode(),
                game.getState(),
                Instant.now(),
                Map.of(
                        "playerCount", game.getPlayers().size()
                )
        );
    }

    public static GameEventDto shipPlaced(Game game, Player player, String placement) {
        return new GameEventDto(
                GameEventType.SHIP_PLACED,
                game.getGameCode(),
                game.getState(),
                Instant.now(),
                Map.of(
                        "playerName", player.getName(),
                        "placement", placement,
                        "fleetComplete", player.getFleet().isComplete()
                )
        );
    }

    public static GameEventDto fleetPlaced(Game game, Player player) {
        return new GameEventDto(
                GameEventType.FLEET_PLACED,
                game.getGameCode(),
                game.getState(),
                Instant.now(),
                Map.of(
                        "playerName", player.getName()
                )
        );
    }

    public static GameEventDto gameStarted(Game game, Player currentTurnPlayer) {
        return new GameEventDto(
                GameEventType.GAME_STARTED,
                game.getGameCode(),
                game.getState(),
                Instant.now(),
                Map.of(
                        "currentTurnPlayerName", currentTurnPlayer.getName()
                )
        );
    }

    public static GameEventDto actionResolved(Game game, ActionResult result) {
        // result and munition are null for placement actions, Map.of does not accept null values
        Map<String, Object> payload = new HashMap<>();
        payload.put("actionType", result.type().name());
        payload.put("playerId", result.playerId());
        payload.put("munition", result.munition() == null ? null : result.munition().name());
        payload.put("result", result.result() == null ? null : result.result().name());
        payload.put("cells", result.cells().stream().map(CellDto::from).toList());
        payload.put("log", result.logEntries().stream().map(EventLogEntry::message).toList());

        return new GameEventDto(
                GameEventType.ACTION_RESOLVED,
                game.getGameCode(),
                result.state(),
                Instant.now(),
                payload
        );
    }

    public static GameEventDto turnChanged(Game game, Player currentTurnPlayer, ActionResult lastAction) {
        return new GameEventDto(
                GameEventType.TURN_CHANGED,
                game.getGameCode(),
                game.getState(),
                Instant.now(),
                Map.of(
                        "currentTurnPlayerId", currentTurnPlayer.getId(),
                        "currentTurnPlayerName", currentTurnPlayer.getName(),
                        "lastShotResult", lastAction.result().name()
                )
        );
    }

    public static GameEventDto targetRequested(Game game, Player player, long timeoutMs) {
        return new GameEventDto(
                GameEventType.TARGET_REQUESTED,
                game.getGameCode(),
                game.getState(),
                Instant.now(),
                Map.of(
                        "playerId", player.getId(),
                        "playerName", player.getName(),
                        "timeoutMs", timeoutMs
                )
        );
    }

    public static GameEventDto targetTimedOut(Game game, Player player) {
        return new GameEventDto(
                GameEventType.TARGET_TIMEOUT,
                game.getGameCode(),
                game.getState(),
                Instant.now(),
                Map.of(
                        "playerId", player.getId(),
                        "playerName", player.getName()
                )
        );
    }

    public static GameEventDto gameFinished(Game game, String winnerName) {
        // winnerName is null on a draw
        Map<String, Object> payload = new HashMap<>();
        payload.put("winnerAllianceId", game.getWinner());
        payload.put("winnerName", winnerName);
        payload.put("draw", game.getWinner() == null);
        payload.put("totalTurns", game.getTurnNumber());

        return new GameEventDto(
                GameEventType.GAME_FINISHED,
                game.getGameCode(),
                game.getState(),
                Instant.now(),
                payload
        );
    }

    public static GameEventDto gameReset(Game game) {
        return new GameEventDto(
                GameEventType.GAME_RESET,
                game.getGameCode(),
                game.getState(),
                Instant.now(),
                Map.of()
        );
    }
}
