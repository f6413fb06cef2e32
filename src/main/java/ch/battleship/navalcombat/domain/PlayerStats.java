package ch.battleship.navalcombat.domain;

import ch.battleship.navalcombat.domain.enums.PlayerType;

import java.util.UUID;

/**
 * Per-player part of {@link GameStats}.
 */
public record PlayerStats(
        UUID playerId,
        String name,
        PlayerType type,
        String allianceId,
        int shots,
        int hits,
        int misses,
        int sunk,
        double accuracy,
        int score,
        double hitsDamage,
        int shipsRemaining,
        boolean eliminated
) {

    public static PlayerStats of(Player player) {
        return new PlayerStats(
                player.getId(),
                player.getName(),
                player.getType(),
                player.getAllianceId(),
                player.getShots(),
                player.getHits(),
                player.getMisses(),
                player.getSunk(),
                player.getAccuracy(),
                player.getScore(),
                player.getHitsDamage(),
                player.getFleet().remainingShips().size(),
                player.isEliminated()
        );
    }
}
