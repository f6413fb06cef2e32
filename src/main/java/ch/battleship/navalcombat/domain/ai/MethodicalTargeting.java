package ch.battleship.navalcombat.domain.ai;

import ch.battleship.navalcombat.domain.Board;
import ch.battleship.navalcombat.domain.Coordinate;

import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.UUID;

/**
 * Sparse grid (every fourth row and column) first to find large ships, then the checkerboard,
 * then whatever is left.
 */
public class MethodicalTargeting implements TargetingStrategy {

    static boolean isSparseGridCell(Coordinate c) {
        return c.getRow() % 4 == 0 && c.getCol() % 4 == 0;
    }

    @Override
    public Optional<Coordinate> selectTarget(Board board, Set<Coordinate> dontShoot, UUID attackerId, Random random) {
        return pick(TargetingStrategies.freshTargets(board, dontShoot, attackerId), random);
    }

    Optional<Coordinate> pick(List<Coordinate> candidates, Random random) {
        return TargetingStrategies.pickByTiers(
                candidates,
                random,
                MethodicalTargeting::isSparseGridCell,
                CheckerboardTargeting::isCheckerboardCell);
    }
}
