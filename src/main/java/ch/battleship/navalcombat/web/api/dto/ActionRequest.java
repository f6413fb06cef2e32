package ch.battleship.navalcombat.web.api.dto;

import ch.battleship.navalcombat.domain.enums.ActionType;
import ch.battleship.navalcombat.domain.enums.MunitionType;

import java.util.UUID;

/**
 * Generic action request, mapped one-to-one onto a domain action.
 *
 * <p>Validation (phase, turn, target, munitions) is handled by the game.
 */
public record ActionRequest(
        ActionType type,
        UUID playerId,
        Integer row,
        Integer col,
        MunitionType munition,
        Integer shipId,
        int rowDelta,
        int colDelta
) {}
