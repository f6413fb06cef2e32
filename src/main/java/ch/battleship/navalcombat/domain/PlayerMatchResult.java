package ch.battleship.navalcombat.domain;

import java.util.UUID;

/**
 * Result payload for one human player, produced once the match is finished. Consumed by an
 * external statistics collaborator; the engine does not store it anywhere else.
 */
public record PlayerMatchResult(
        UUID playerId,
        String name,
        String eraId,
        int shots,
        int hits,
        int misses,
        int shipsSunk,
        double accuracy,
        int score,
        boolean won
) {
}
