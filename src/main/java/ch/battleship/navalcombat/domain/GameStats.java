package ch.battleship.navalcombat.domain;

import ch.battleship.navalcombat.domain.enums.GameState;

import java.time.Duration;
import java.util.List;

/**
 * Snapshot of match statistics.
 *
 * @param duration time since the battle started (until it finished), zero before the battle
 * @param totalTurns turns played so far
 * @param winnerAllianceId winning alliance, {@code null} while running or on a draw
 * @param winnerName display name of the winner, {@code null} while running or on a draw
 */
public record GameStats(
        GameState state,
        Duration duration,
        int totalTurns,
        String winnerAllianceId,
        String winnerName,
        List<PlayerStats> players
) {

    public GameStats {
        players = List.copyOf(players);
    }
}
