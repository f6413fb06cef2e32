package ch.battleship.navalcombat.domain;

import ch.battleship.navalcombat.domain.enums.MunitionType;
import ch.battleship.navalcombat.domain.enums.PlayerType;
import ch.battleship.navalcombat.domain.enums.ShotResult;
import ch.battleship.navalcombat.domain.exception.ResourceExhaustedException;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * A turn participant: owns a fleet, shot statistics, munition balances and the dont-shoot set.
 *
 * <p>The dont-shoot set only grows within a match. It holds confirmed misses and every cell of
 * a ship the player has sunk.
 */
@Getter
public abstract class Player {

    private final UUID id;

    private final String name;

    @Setter
    private String allianceId;

    private final Fleet fleet;

    private int hits;

    private int misses;

    /**
     * Number of enemy ships sunk by this player.
     */
    private int sunk;

    private int score;

    /**
     * Cumulative damage dealt.
     */
    private double hitsDamage;

    private boolean eliminated;

    @Getter(AccessLevel.NONE)
    private final Set<Coordinate> dontShoot = new LinkedHashSet<>();

    @Getter(AccessLevel.NONE)
    private final Map<MunitionType, Integer> munitions = new EnumMap<>(MunitionType.class);

    protected Player(UUID id, String name) {
        this.id = id;
        this.name = name;
        this.fleet = new Fleet(id);
    }

    public abstract PlayerType getType();

    public int getShots() {
        return hits + misses;
    }

    /**
     * @return hit percentage, 0 when no shot was fired
     */
    public double getAccuracy() {
        int shots = getShots();
        return shots == 0 ? 0.0 : (hits * 100.0) / shots;
    }

    public Set<Coordinate> getDontShoot() {
        return Collections.unmodifiableSet(dontShoot);
    }

    /**
     * A cell may be targeted if it is a valid attack target and not in the dont-shoot set.
     */
    public boolean canShootAt(Board board, int row, int col) {
        return board.isValidAttackTarget(row, col) && !dontShoot.contains(Coordinate.of(row, col));
    }

    public void markUnshootable(Coordinate coordinate) {
        dontShoot.add(coordinate);
    }

    /**
     * Updates shot statistics for one resolved cell.
     *
     * <p>HIT and SUNK count as hits, MISS and ALREADY_HIT as misses. REVEALED is not a shot.
     * Sunk ships are counted separately by {@link #recordSinking(int)}.
     *
     * @param result cell outcome
     * @param damage damage dealt on this cell
     * @param points score awarded for this cell
     */
    public void recordShotOutcome(ShotResult result, double damage, int points) {
        switch (result) {
            case HIT, SUNK -> hits++;
            case MISS, ALREADY_HIT -> misses++;
            case REVEALED -> {
                return;
            }
        }
        hitsDamage += damage;
        score += points;
    }

    /**
     * Counts one enemy ship sunk by this player.
     */
    public void recordSinking(int points) {
        sunk++;
        score += points;
    }

    public int getMunitions(MunitionType type) {
        return munitions.getOrDefault(type, 0);
    }

    public void setMunitions(MunitionType type, int amount) {
        munitions.put(type, Math.max(0, amount));
    }

    /**
     * Consumes one unit of a limited player-wide munition.
     *
     * @throws ResourceExhaustedException if the balance is zero
     */
    public void consumeMunition(MunitionType type) {
        int balance = getMunitions(type);
        if (balance <= 0) {
            throw new ResourceExhaustedException(name + " has no " + type.getDisplayName() + " left");
        }
        munitions.put(type, balance - 1);
    }

    public void eliminate() {
        this.eliminated = true;
    }

    /**
     * Clears statistics, the dont-shoot set and munitions for a new match.
     */
    void resetForNewMatch() {
        hits = 0;
        misses = 0;
        sunk = 0;
        score = 0;
        hitsDamage = 0.0;
        eliminated = false;
        dontShoot.clear();
        munitions.clear();
        fleet.reset();
    }
}
