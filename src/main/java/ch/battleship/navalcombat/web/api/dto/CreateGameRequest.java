package ch.battleship.navalcombat.web.api.dto;

/**
 * Request DTO used to create a new game.
 *
 * @param eraId built-in era id ({@code traditional}, {@code coastal}, {@code pirates});
 *              {@code null} selects the traditional era
 */
public record CreateGameRequest(
        String eraId
) {}
