package ch.battleship.navalcombat.web.api.dto;

import ch.battleship.navalcombat.domain.enums.AiStrategy;
import ch.battleship.navalcombat.domain.enums.PlayerType;

/**
 * Request DTO used to add a player to a game in SETUP.
 *
 * <p>The backend generates the {@code playerId} and returns it in the join response.
 *
 * @param playerName display name, unique within the game
 * @param type HUMAN or AI; {@code null} means HUMAN
 * @param allianceName alliance to join (humans only when the era allows choosing; AIs always)
 * @param strategy AI search pattern, ignored for humans
 * @param difficulty AI difficulty, ignored for humans
 */
public record JoinGameRequest(
        String playerName,
        PlayerType type,
        String allianceName,
        AiStrategy strategy,
        Double difficulty
) {}
