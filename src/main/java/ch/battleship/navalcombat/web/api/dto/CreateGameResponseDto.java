package ch.battleship.navalcombat.web.api.dto;

import ch.battleship.navalcombat.domain.enums.GameState;

import java.util.List;

/**
 * DTO returned after creating a new game.
 *
 * @param gameCode unique public identifier of the created game
 * @param eraId era the game was created from
 * @param state initial state (SETUP)
 * @param alliances alliance names players can join
 */
public record CreateGameResponseDto(
        String gameCode,
        String eraId,
        GameState state,
        List<String> alliances
) {}
