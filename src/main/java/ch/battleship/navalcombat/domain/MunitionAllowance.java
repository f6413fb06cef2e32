package ch.battleship.navalcombat.domain;

import ch.battleship.navalcombat.domain.enums.MunitionType;

/**
 * Starting balance of a player-wide munition.
 *
 * @param type munition
 * @param base balance against a single opponent
 * @param boostPerOpponent extra balance for every opponent beyond the first
 */
public record MunitionAllowance(MunitionType type, int base, int boostPerOpponent) {

    public int balanceFor(int opponents) {
        return base + boostPerOpponent * Math.max(0, opponents - 1);
    }
}
