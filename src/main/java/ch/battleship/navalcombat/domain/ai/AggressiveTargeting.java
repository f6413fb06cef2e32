package ch.battleship.navalcombat.domain.ai;

import ch.battleship.navalcombat.domain.Board;
import ch.battleship.navalcombat.domain.Coordinate;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.UUID;

/**
 * Scores every remaining target and picks randomly among the best three.
 *
 * <p>Cells near the board centre score higher, and every orthogonal neighbour that is an open hit
 * of the attacker adds {@value #ADJACENT_HIT_BONUS}.
 */
public class AggressiveTargeting implements TargetingStrategy {

    static final int CENTER_BONUS = 10;
    static final int ADJACENT_HIT_BONUS = 20;
    static final int TOP_CANDIDATES = 3;

    @Override
    public Optional<Coordinate> selectTarget(Board board, Set<Coordinate> dontShoot, UUID attackerId, Random random) {
        Set<Coordinate> openHits = HuntTargeting.openHits(board, dontShoot, attackerId);
        List<Coordinate> ranked = TargetingStrategies.freshTargets(board, dontShoot, attackerId).stream()
                .sorted(Comparator.comparingDouble((Coordinate c) -> score(board, openHits, c)).reversed())
                .limit(TOP_CANDIDATES)
                .toList();
        return TargetingStrategies.pickRandom(ranked, random);
    }

    static double score(Board board, Set<Coordinate> openHits, Coordinate c) {
        double centerRow = board.getRows() / 2.0;
        double centerCol = board.getCols() / 2.0;
        double distance = Math.abs(c.getRow() - centerRow) + Math.abs(c.getCol() - centerCol);
        double score = 1 + Math.max(0, CENTER_BONUS - distance);
        for (int[] step : new int[][]{{-1, 0}, {1, 0}, {0, -1}, {0, 1}}) {
            if (openHits.contains(c.offset(step[0], step[1]))) {
                score += ADJACENT_HIT_BONUS;
            }
        }
        return score;
    }
}
