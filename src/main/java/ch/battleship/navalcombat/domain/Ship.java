package ch.battleship.navalcombat.domain;

import ch.battleship.navalcombat.domain.enums.RevealLevel;
import ch.battleship.navalcombat.domain.enums.ShipClass;
import ch.battleship.navalcombat.domain.enums.ShotResult;
import ch.battleship.navalcombat.domain.enums.SizeCategory;
import ch.battleship.navalcombat.domain.enums.TerrainType;
import ch.battleship.navalcombat.domain.exception.GameValidationException;
import ch.battleship.navalcombat.domain.exception.ResourceExhaustedException;
import lombok.AccessLevel;
import lombok.Getter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Represents a ship instance of one fleet.
 *
 * <p>The ship is the single owner of its placement data: the ordered cell run and the per-cell
 * health. The board only indexes it by {@link #getId()}, which is a stable index into the
 * game's ship arena.
 *
 * <p>Health starts at {@code 1.0} per cell, is clamped at zero and never becomes negative.
 * {@link #isSunk()} is derived from health only.
 */
@Getter
public class Ship {

    /**
     * Stable arena index inside the owning game.
     */
    private final int id;

    private final String name;

    private final ShipClass shipClass;

    /**
     * Number of board cells occupied by this ship.
     */
    private final int size;

    @Getter(AccessLevel.NONE)
    private final Set<TerrainType> allowedTerrain;

    @Getter(AccessLevel.NONE)
    private final List<Coordinate> cells = new ArrayList<>();

    @Getter(AccessLevel.NONE)
    private final double[] health;

    private boolean placed;

    /**
     * Time the last cell was destroyed, {@code null} while afloat.
     */
    private Instant sunkAt;

    /**
     * Remaining torpedoes carried by this ship (submarines only).
     */
    private int torpedoes;

    @Getter(AccessLevel.NONE)
    private final int initialTorpedoes;

    /**
     * Creates a new, unplaced ship.
     *
     * @param id arena index
     * @param name display name (e.g. "Destroyer")
     * @param shipClass ship class
     * @param size number of cells, at least 1
     * @param allowedTerrain terrain the ship may occupy
     * @param torpedoes initial torpedo supply, 0 for ships without torpedoes
     */
    public Ship(int id, String name, ShipClass shipClass, int size, Set<TerrainType> allowedTerrain, int torpedoes) {
        if (size < 1) {
            throw new IllegalArgumentException("Ship size must be at least 1");
        }
        if (allowedTerrain == null || allowedTerrain.isEmpty()) {
            throw new IllegalArgumentException("Ship must allow at least one terrain type");
        }
        this.id = id;
        this.name = name;
        this.shipClass = shipClass;
        this.size = size;
        this.allowedTerrain = Collections.unmodifiableSet(EnumSet.copyOf(allowedTerrain));
        this.health = new double[size];
        this.initialTorpedoes = Math.max(0, torpedoes);
        reset();
    }

    public Set<TerrainType> getAllowedTerrain() {
        return allowedTerrain;
    }

    /**
     * Ordered placement run; empty while unplaced.
     */
    public List<Coordinate> getCells() {
        return Collections.unmodifiableList(cells);
    }

    public double getCellHealth(int cellIndex) {
        return health[cellIndex];
    }

    /**
     * Marks the ship as placed on the given run.
     *
     * @throws GameValidationException if the run length does not match the ship size
     */
    public void place(List<Coordinate> run) {
        if (run == null || run.size() != size) {
            throw new GameValidationException(name + " needs exactly " + size + " cells");
        }
        cells.clear();
        cells.addAll(run);
        placed = true;
    }

    /**
     * Clears the placement run, restores full health and the initial torpedo supply.
     * The board keeps its occupant entries; {@link PlacementEngine#clear(Fleet)} removes both.
     */
    void reset() {
        cells.clear();
        Arrays.fill(health, 1.0);
        placed = false;
        sunkAt = null;
        torpedoes = initialTorpedoes;
    }

    public ShotResult hit(int cellIndex) {
        return hit(cellIndex, 1.0);
    }

    /**
     * Applies damage to a single cell.
     *
     * <p>Hitting a cell whose health is already zero is a no-op and returns
     * {@link ShotResult#ALREADY_HIT}.
     *
     * @param cellIndex index into the placement run
     * @param damage damage to subtract, health is clamped at zero
     * @return HIT, SUNK (this hit destroyed the last cell) or ALREADY_HIT
     */
    public ShotResult hit(int cellIndex, double damage) {
        if (cellIndex < 0 || cellIndex >= size) {
            throw new IndexOutOfBoundsException("Cell index " + cellIndex + " outside ship of size " + size);
        }
        if (health[cellIndex] <= 0) {
            return ShotResult.ALREADY_HIT;
        }
        health[cellIndex] = Math.max(0.0, health[cellIndex] - damage);
        if (isSunk()) {
            if (sunkAt == null) {
                sunkAt = Instant.now();
            }
            return ShotResult.SUNK;
        }
        return ShotResult.HIT;
    }

    public boolean isSunk() {
        for (double h : health) {
            if (h > 0) {
                return false;
            }
        }
        return true;
    }

    public boolean isCellDestroyed(int cellIndex) {
        return health[cellIndex] <= 0;
    }

    /**
     * @return remaining health as a fraction of full health, between 0 and 1
     */
    public double getHealthRatio() {
        double total = 0;
        for (double h : health) {
            total += h;
        }
        return total / size;
    }

    public RevealLevel getRevealLevel() {
        double destroyed = 1.0 - getHealthRatio();
        if (destroyed <= 0) {
            return RevealLevel.HIDDEN;
        }
        if (destroyed >= 0.75) {
            return RevealLevel.CRITICAL;
        }
        if (destroyed >= 0.5) {
            return RevealLevel.SIZE_HINT;
        }
        return RevealLevel.HIT;
    }

    public SizeCategory getSizeCategory() {
        return SizeCategory.ofSize(size);
    }

    public boolean canFireTorpedo() {
        return shipClass == ShipClass.SUBMARINE && !isSunk() && torpedoes > 0;
    }

    /**
     * Consumes one torpedo from this ship.
     *
     * @throws ResourceExhaustedException if the ship cannot fire a torpedo
     */
    public void useTorpedo() {
        if (!canFireTorpedo()) {
            throw new ResourceExhaustedException(name + " has no torpedoes available");
        }
        torpedoes--;
    }

    /**
     * @return index of the coordinate in the placement run, or -1
     */
    public int cellIndexOf(Coordinate coordinate) {
        return cells.indexOf(coordinate);
    }
}
