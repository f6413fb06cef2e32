package ch.battleship.navalcombat.web.api.dto;

import ch.battleship.navalcombat.domain.ActionResult;
import ch.battleship.navalcombat.domain.EventLogEntry;
import ch.battleship.navalcombat.domain.enums.ActionType;
import ch.battleship.navalcombat.domain.enums.GameState;
import ch.battleship.navalcombat.domain.enums.MunitionType;
import ch.battleship.navalcombat.domain.enums.ShotResult;

import java.util.List;
import java.util.UUID;

/**
 * Response DTO for a processed action.
 *
 * @param hit {@code true} if the action damaged at least one ship
 * @param shipSunk {@code true} if the action sank at least one ship
 * @param log battle log lines appended by this action
 */
public record ActionResultDto(
        ActionType type,
        UUID playerId,
        MunitionType munition,
        ShotResult result,
        boolean hit,
        boolean shipSunk,
        List<CellDto> cells,
        List<String> log,
        GameState state,
        UUID currentPlayerId,
        boolean turnChanged,
        String winnerAllianceId
) {
    public static ActionResultDto from(ActionResult result) {
        return new ActionResultDto(
                result.type(),
                result.playerId(),
                result.munition(),
                result.result(),
                result.isHit(),
                result.result() == ShotResult.SUNK,
                result.cells().stream().map(CellDto::from).toList(),
                result.logEntries().stream().map(EventLogEntry::message).toList(),
                result.state(),
                result.currentPlayerId(),
                result.turnChanged(),
                result.winnerAllianceId()
        );
    }
}
