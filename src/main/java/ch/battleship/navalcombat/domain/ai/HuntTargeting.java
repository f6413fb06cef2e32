package ch.battleship.navalcombat.domain.ai;

import ch.battleship.navalcombat.domain.Board;
import ch.battleship.navalcombat.domain.Coordinate;
import ch.battleship.navalcombat.domain.ShotRecord;
import ch.battleship.navalcombat.domain.enums.ShotResult;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.UUID;

/**
 * Hunt-after-hit biasing on top of a base search pattern.
 *
 * <p>An "open hit" is a cell the attacker hit that is not in its dont-shoot set. Cells of sunk
 * ships are added to the dont-shoot set, so open hits belong to ships that are still afloat.
 * Neighbours that continue a line of two open hits are tried first, then any neighbour of an
 * open hit. Without open hits the base strategy decides.
 */
public class HuntTargeting implements TargetingStrategy {

    private final TargetingStrategy base;

    public HuntTargeting(TargetingStrategy base) {
        this.base = base;
    }

    @Override
    public Optional<Coordinate> selectTarget(Board board, Set<Coordinate> dontShoot, UUID attackerId, Random random) {
        Set<Coordinate> openHits = openHits(board, dontShoot, attackerId);
        if (openHits.isEmpty()) {
            return base.selectTarget(board, dontShoot, attackerId, random);
        }

        Set<Coordinate> available = new LinkedHashSet<>(TargetingStrategies.freshTargets(board, dontShoot, attackerId));
        Set<Coordinate> inLine = new LinkedHashSet<>();
        Set<Coordinate> adjacent = new LinkedHashSet<>();

        for (Coordinate hit : openHits) {
            for (int[] step : new int[][]{{-1, 0}, {1, 0}, {0, -1}, {0, 1}}) {
                Coordinate next = hit.offset(step[0], step[1]);
                if (!available.contains(next) || wasHitBy(board, attackerId, next)) {
                    continue;
                }
                adjacent.add(next);
                if (openHits.contains(hit.offset(-step[0], -step[1]))) {
                    inLine.add(next);
                }
            }
        }

        if (!inLine.isEmpty()) {
            return TargetingStrategies.pickRandom(List.copyOf(inLine), random);
        }
        if (!adjacent.isEmpty()) {
            return TargetingStrategies.pickRandom(List.copyOf(adjacent), random);
        }
        return base.selectTarget(board, dontShoot, attackerId, random);
    }

    static Set<Coordinate> openHits(Board board, Set<Coordinate> dontShoot, UUID attackerId) {
        Set<Coordinate> hits = new LinkedHashSet<>();
        for (ShotRecord shot : board.getShotHistory()) {
            if (attackerId.equals(shot.getAttackerId())
                    && shot.getResult() == ShotResult.HIT
                    && !dontShoot.contains(shot.getCoordinate())) {
                hits.add(shot.getCoordinate());
            }
        }
        return hits;
    }

    private static boolean wasHitBy(Board board, UUID attackerId, Coordinate c) {
        return board.shotsAt(c.getRow(), c.getCol()).stream()
                .anyMatch(s -> attackerId.equals(s.getAttackerId()) && s.getResult().isHit());
    }
}
