package ch.battleship.navalcombat.domain.ai;

import ch.battleship.navalcombat.domain.Board;
import ch.battleship.navalcombat.domain.Coordinate;

import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.UUID;

/**
 * Uniformly random choice among all remaining targets.
 */
public class RandomTargeting implements TargetingStrategy {

    @Override
    public Optional<Coordinate> selectTarget(Board board, Set<Coordinate> dontShoot, UUID attackerId, Random random) {
        return TargetingStrategies.pickRandom(TargetingStrategies.freshTargets(board, dontShoot, attackerId), random);
    }
}
