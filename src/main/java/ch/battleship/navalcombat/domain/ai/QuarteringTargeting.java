package ch.battleship.navalcombat.domain.ai;

import ch.battleship.navalcombat.domain.Board;
import ch.battleship.navalcombat.domain.Coordinate;

import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.UUID;

/**
 * Searches the board one quadrant at a time (top-left, top-right, bottom-left, bottom-right),
 * using the methodical pattern inside the quadrant.
 *
 * <p>The active quadrant is the first one that still has a target left, so the search position
 * is read from the board and the dont-shoot set alone.
 */
public class QuarteringTargeting implements TargetingStrategy {

    private final MethodicalTargeting methodical = new MethodicalTargeting();

    @Override
    public Optional<Coordinate> selectTarget(Board board, Set<Coordinate> dontShoot, UUID attackerId, Random random) {
        List<Coordinate> candidates = TargetingStrategies.freshTargets(board, dontShoot, attackerId);
        for (int quadrant = 0; quadrant < 4; quadrant++) {
            int q = quadrant;
            List<Coordinate> inQuadrant = candidates.stream()
                    .filter(c -> quadrantOf(board, c) == q)
                    .toList();
            if (!inQuadrant.isEmpty()) {
                return methodical.pick(inQuadrant, random);
            }
        }
        return Optional.empty();
    }

    /**
     * @return 0 top-left, 1 top-right, 2 bottom-left, 3 bottom-right
     */
    static int quadrantOf(Board board, Coordinate c) {
        int bottom = c.getRow() >= board.getRows() / 2 ? 2 : 0;
        int right = c.getCol() >= board.getCols() / 2 ? 1 : 0;
        return bottom + right;
    }
}
