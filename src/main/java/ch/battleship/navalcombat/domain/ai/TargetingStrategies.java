package ch.battleship.navalcombat.domain.ai;

import ch.battleship.navalcombat.domain.Board;
import ch.battleship.navalcombat.domain.Coordinate;
import ch.battleship.navalcombat.domain.ShotRecord;
import ch.battleship.navalcombat.domain.enums.AiStrategy;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.UUID;
import java.util.function.Predicate;

/**
 * Factory and shared helpers for {@link TargetingStrategy} implementations.
 */
public final class TargetingStrategies {

    /**
     * Difficulty above which an AI hunts around its own unresolved hits.
     */
    public static final double HUNT_DIFFICULTY_THRESHOLD = 1.0;

    private TargetingStrategies() {
    }

    /**
     * Builds the targeting strategy for an AI player.
     *
     * @param strategy base search pattern
     * @param difficulty difficulty scalar, above {@link #HUNT_DIFFICULTY_THRESHOLD} enables hunting
     */
    public static TargetingStrategy forPlayer(AiStrategy strategy, double difficulty) {
        TargetingStrategy base = switch (strategy) {
            case RANDOM -> new RandomTargeting();
            case CHECKERBOARD -> new CheckerboardTargeting();
            case METHODICAL -> new MethodicalTargeting();
            case QUARTERING -> new QuarteringTargeting();
            case AGGRESSIVE -> new AggressiveTargeting();
        };
        return difficulty > HUNT_DIFFICULTY_THRESHOLD ? new HuntTargeting(base) : base;
    }

    /**
     * All valid attack targets that are not in the dont-shoot set, in row-major order.
     */
    public static List<Coordinate> availableTargets(Board board, Set<Coordinate> dontShoot) {
        List<Coordinate> targets = new ArrayList<>();
        for (int row = 0; row < board.getRows(); row++) {
            for (int col = 0; col < board.getCols(); col++) {
                Coordinate c = Coordinate.of(row, col);
                if (board.isValidAttackTarget(row, col) && !dontShoot.contains(c)) {
                    targets.add(c);
                }
            }
        }
        return targets;
    }

    /**
     * Available targets minus cells the attacker already hit. Falls back to
     * {@link #availableTargets(Board, Set)} when only already-hit cells remain.
     */
    public static List<Coordinate> freshTargets(Board board, Set<Coordinate> dontShoot, UUID attackerId) {
        List<Coordinate> available = availableTargets(board, dontShoot);
        Set<Coordinate> ownHits = new HashSet<>();
        for (ShotRecord shot : board.getShotHistory()) {
            if (attackerId.equals(shot.getAttackerId()) && shot.getResult().isHit()) {
                ownHits.add(shot.getCoordinate());
            }
        }
        List<Coordinate> fresh = available.stream().filter(c -> !ownHits.contains(c)).toList();
        return fresh.isEmpty() ? available : fresh;
    }

    static Optional<Coordinate> pickRandom(List<Coordinate> candidates, Random random) {
        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(candidates.get(random.nextInt(candidates.size())));
    }

    /**
     * Picks randomly from the first non-empty tier; the last tier is always "everything".
     */
    @SafeVarargs
    static Optional<Coordinate> pickByTiers(List<Coordinate> candidates, Random random,
                                            Predicate<Coordinate>... tiers) {
        for (Predicate<Coordinate> tier : tiers) {
            List<Coordinate> matching = candidates.stream().filter(tier).toList();
            if (!matching.isEmpty()) {
                return pickRandom(matching, random);
            }
        }
        return pickRandom(candidates, random);
    }
}
