package ch.battleship.navalcombat.domain;

import ch.battleship.navalcombat.domain.enums.ActionType;
import ch.battleship.navalcombat.domain.enums.GameState;
import ch.battleship.navalcombat.domain.enums.MunitionType;
import ch.battleship.navalcombat.domain.enums.ShotResult;

import java.util.List;
import java.util.UUID;

/**
 * Returned for every completed action and passed to the registered action listener.
 *
 * @param type action kind
 * @param playerId acting player
 * @param munition munition fired, {@code null} for placement actions
 * @param result overall outcome of a FIRE action, {@code null} for placement actions
 * @param cells affected cells
 * @param logEntries battle log lines appended by this action
 * @param state game state after the action
 * @param currentPlayerId player whose turn it is after the action, {@code null} when not playing
 * @param turnChanged whether the turn moved to another player
 * @param winnerAllianceId winning alliance once finished, {@code null} otherwise (also on a draw)
 */
public record ActionResult(
        ActionType type,
        UUID playerId,
        MunitionType munition,
        ShotResult result,
        List<CellOutcome> cells,
        List<EventLogEntry> logEntries,
        GameState state,
        UUID currentPlayerId,
        boolean turnChanged,
        String winnerAllianceId
) {

    public ActionResult {
        cells = List.copyOf(cells);
        logEntries = List.copyOf(logEntries);
    }

    /**
     * Overall outcome of a set of cell outcomes: SUNK beats HIT beats ALREADY_HIT beats
     * REVEALED beats MISS.
     */
    public static ShotResult summarize(List<CellOutcome> cells) {
        ShotResult best = ShotResult.MISS;
        for (CellOutcome cell : cells) {
            if (cell.result() != null && rank(cell.result()) > rank(best)) {
                best = cell.result();
            }
        }
        return best;
    }

    private static int rank(ShotResult result) {
        return switch (result) {
            case MISS -> 0;
            case REVEALED -> 1;
            case ALREADY_HIT -> 2;
            case HIT -> 3;
            case SUNK -> 4;
        };
    }

    public boolean isHit() {
        return result != null && result.isHit();
    }
}
