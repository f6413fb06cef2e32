package ch.battleship.navalcombat.web.api.dto;

import ch.battleship.navalcombat.domain.GameStats;
import ch.battleship.navalcombat.domain.PlayerMatchResult;
import ch.battleship.navalcombat.domain.PlayerStats;
import ch.battleship.navalcombat.domain.enums.GameState;

import java.util.List;

public record GameStatsDto(
        GameState state,
        long durationMillis,
        int totalTurns,
        String winnerAllianceId,
        String winnerName,
        List<PlayerStats> players,
        List<PlayerMatchResult> matchResults
) {
    public static GameStatsDto from(GameStats stats, List<PlayerMatchResult> matchResults) {
        return new GameStatsDto(
                stats.state(),
                stats.duration().toMillis(),
                stats.totalTurns(),
                stats.winnerAllianceId(),
                stats.winnerName(),
                stats.players(),
                matchResults
        );
    }
}
