package ch.battleship.navalcombat.domain.ai;

import ch.battleship.navalcombat.domain.Board;
import ch.battleship.navalcombat.domain.Coordinate;

import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.UUID;

/**
 * Target selection of an AI player.
 *
 * <p>Implementations are pure: they only read the board and the dont-shoot set and return a
 * single coordinate, or an empty result when no valid target is left.
 */
public interface TargetingStrategy {

    /**
     * @param board shared match board
     * @param dontShoot coordinates the attacker must not target again
     * @param attackerId id of the selecting player (used to read its own shot history)
     * @param random randomness source
     * @return selected target or empty when nothing is left to shoot at
     */
    Optional<Coordinate> selectTarget(Board board, Set<Coordinate> dontShoot, UUID attackerId, Random random);
}
