package ch.battleship.navalcombat.web.api.dto;

import ch.battleship.navalcombat.domain.enums.GameState;
import ch.battleship.navalcombat.domain.enums.PlayerType;

import java.util.UUID;

public record JoinGameResponseDto(
        String gameCode,
        UUID playerId,
        String playerName,
        PlayerType type,
        String allianceId,
        GameState state
) {}
