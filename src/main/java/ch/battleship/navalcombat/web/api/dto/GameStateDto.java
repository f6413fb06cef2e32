package ch.battleship.navalcombat.web.api.dto;

import ch.battleship.navalcombat.domain.enums.GameState;

import java.util.List;
import java.util.UUID;

/**
 * Game state as seen by one player.
 *
 * @param yourFleet the requesting player's own ships including positions, empty without a player id
 * @param yourTurn {@code true} if the requesting player may fire now
 * @param recentLog last battle log lines, oldest first
 */
public record GameStateDto(
        String gameCode,
        String eraId,
        GameState state,
        int rows,
        int cols,
        int turnNumber,
        UUID currentPlayerId,
        String currentPlayerName,
        String winnerAllianceId,
        List<PlayerDto> players,
        List<AllianceDto> alliances,
        List<ShipDto> yourFleet,
        boolean yourTurn,
        List<String> recentLog
) {
    public record AllianceDto(
            String allianceId,
            String name,
            String displayName,
            List<UUID> memberIds
    ) {}
}
