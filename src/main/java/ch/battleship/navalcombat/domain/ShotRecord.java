package ch.battleship.navalcombat.domain;

import ch.battleship.navalcombat.domain.enums.MunitionType;
import ch.battleship.navalcombat.domain.enums.ShotResult;
import lombok.Getter;

import java.time.Instant;
import java.util.UUID;

/**
 * Represents a single resolved attack on one cell.
 *
 * <p>A shot record stores the target coordinate, the computed result, the attacker and the
 * munition used. Records are append-only; the shot history is used to answer
 * "was this cell attacked" and to drive hunt-after-hit AI targeting.
 */
@Getter
public class ShotRecord {

    /**
     * Target coordinate (0-based).
     */
    private final Coordinate coordinate;

    /**
     * Player who fired.
     */
    private final UUID attackerId;

    private final MunitionType munition;

    /**
     * Outcome on this cell (MISS, HIT, SUNK, ALREADY_HIT).
     */
    private final ShotResult result;

    private final Instant timestamp;

    /**
     * Creates a new shot entry.
     *
     * @param coordinate target coordinate
     * @param attackerId player who fired the shot
     * @param munition munition used
     * @param result computed shot result
     */
    public ShotRecord(Coordinate coordinate, UUID attackerId, MunitionType munition, ShotResult result) {
        this.coordinate = coordinate;
        this.attackerId = attackerId;
        this.munition = munition;
        this.result = result;
        this.timestamp = Instant.now();
    }
}
