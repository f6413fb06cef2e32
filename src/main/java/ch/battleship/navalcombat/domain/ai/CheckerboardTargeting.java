package ch.battleship.navalcombat.domain.ai;

import ch.battleship.navalcombat.domain.Board;
import ch.battleship.navalcombat.domain.Coordinate;

import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.UUID;

/**
 * Fires at every other cell first. Any ship of size two or more covers at least one
 * checkerboard cell, so the pattern finds every ship before falling back to the rest.
 */
public class CheckerboardTargeting implements TargetingStrategy {

    static boolean isCheckerboardCell(Coordinate c) {
        return (c.getRow() + c.getCol()) % 2 == 0;
    }

    @Override
    public Optional<Coordinate> selectTarget(Board board, Set<Coordinate> dontShoot, UUID attackerId, Random random) {
        return TargetingStrategies.pickByTiers(
                TargetingStrategies.freshTargets(board, dontShoot, attackerId),
                random,
                CheckerboardTargeting::isCheckerboardCell);
    }
}
