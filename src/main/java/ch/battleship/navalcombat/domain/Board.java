package ch.battleship.navalcombat.domain;

import ch.battleship.navalcombat.domain.enums.MunitionType;
import ch.battleship.navalcombat.domain.enums.ShotResult;
import ch.battleship.navalcombat.domain.enums.TerrainType;
import ch.battleship.navalcombat.domain.exception.GameValidationException;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * The shared match board: a terrain grid plus a sparse occupant index and the shot history.
 *
 * <p>The board is purely a lookup index. Ships own their placement data; the board only stores
 * {@link Occupant} entries (ship index + cell index) per coordinate. It never references players
 * or the game, and it is mutated only through placement and attack operations.
 *
 * <p>Index and history access is synchronized on the board, and the collection views returned
 * to callers are snapshots.
 */
public class Board {

    @Getter
    private final TerrainGrid terrain;

    private final Map<Coordinate, List<Occupant>> occupants = new HashMap<>();

    private final List<ShotRecord> shotHistory = new ArrayList<>();

    public Board(TerrainGrid terrain) {
        this.terrain = terrain;
    }

    public int getRows() {
        return terrain.getRows();
    }

    public int getCols() {
        return terrain.getCols();
    }

    public boolean isValidCoordinate(int row, int col) {
        return terrain.contains(row, col);
    }

    public TerrainType terrainAt(int row, int col) {
        return terrain.terrainAt(row, col);
    }

    public boolean isExcluded(int row, int col) {
        return isValidCoordinate(row, col) && terrain.terrainAt(row, col) == TerrainType.EXCLUDED;
    }

    /**
     * Checks whether a run of cells may host a ship with the given allowed terrain.
     *
     * <p>Validation rules (fail fast, in this order):
     * <ul>
     *   <li>Every cell must be inside the grid.</li>
     *   <li>No cell may be excluded terrain.</li>
     *   <li>Every cell's terrain must be in {@code allowedTerrain}.</li>
     * </ul>
     * Existing occupancy is not checked here; overlap is a placement rule.
     *
     * @param cells candidate placement run
     * @param allowedTerrain terrain the ship may occupy
     * @return {@code true} if the run is valid, otherwise {@code false}
     */
    public boolean canPlace(List<Coordinate> cells, Set<TerrainType> allowedTerrain) {
        return rejectionReason(cells, allowedTerrain) == null;
    }

    /**
     * Same checks as {@link #canPlace(List, Set)}, returning a description of the first failed
     * rule or {@code null} if the run is valid.
     */
    public String rejectionReason(List<Coordinate> cells, Set<TerrainType> allowedTerrain) {
        if (cells == null || cells.isEmpty()) {
            return "Placement run is empty";
        }
        for (Coordinate c : cells) {
            if (!isValidCoordinate(c.getRow(), c.getCol())) {
                return "Cell " + c + " is out of bounds";
            }
        }
        for (Coordinate c : cells) {
            if (isExcluded(c.getRow(), c.getCol())) {
                return "Cell " + c.toCellName() + " is excluded terrain";
            }
        }
        for (Coordinate c : cells) {
            TerrainType type = terrainAt(c.getRow(), c.getCol());
            if (!allowedTerrain.contains(type)) {
                return "Cell " + c.toCellName() + " is " + type + ", ship requires " + allowedTerrain;
            }
        }
        return null;
    }

    /**
     * Adds the occupant entries for a placed ship.
     *
     * <p>Idempotent per ship id: a ship that is already registered is first removed, so
     * re-registering replaces its previous run.
     *
     * @param shipId ship arena index
     * @param cells ordered placement run
     * @param allowedTerrain terrain the ship may occupy
     * @throws GameValidationException if the run violates {@link #canPlace(List, Set)};
     *                                 nothing is registered in that case
     */
    public synchronized void registerPlacement(int shipId, List<Coordinate> cells, Set<TerrainType> allowedTerrain) {
        String reason = rejectionReason(cells, allowedTerrain);
        if (reason != null) {
            throw new GameValidationException("Cannot place ship: " + reason);
        }
        unregister(shipId);
        for (int i = 0; i < cells.size(); i++) {
            occupants.computeIfAbsent(cells.get(i), k -> new ArrayList<>()).add(new Occupant(shipId, i));
        }
    }

    /**
     * Removes every occupant entry of the given ship.
     *
     * @return {@code true} if any entry was removed
     */
    public synchronized boolean unregister(int shipId) {
        boolean removed = false;
        Iterator<Map.Entry<Coordinate, List<Occupant>>> it = occupants.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<Coordinate, List<Occupant>> entry = it.next();
            removed |= entry.getValue().removeIf(o -> o.shipId() == shipId);
            if (entry.getValue().isEmpty()) {
                it.remove();
            }
        }
        return removed;
    }

    public synchronized List<Occupant> occupantsAt(int row, int col) {
        List<Occupant> list = occupants.get(Coordinate.of(row, col));
        return list == null ? List.of() : List.copyOf(list);
    }

    public boolean isOccupied(int row, int col) {
        return !occupantsAt(row, col).isEmpty();
    }

    /**
     * @return {@code true} if the coordinate is inside the grid and not excluded
     */
    public boolean isValidAttackTarget(int row, int col) {
        return isValidCoordinate(row, col) && !isExcluded(row, col);
    }

    /**
     * Appends a shot to the history. Prior entries are never modified.
     */
    public synchronized ShotRecord recordShot(Coordinate coordinate, UUID attackerId, MunitionType munition, ShotResult result) {
        ShotRecord shot = new ShotRecord(coordinate, attackerId, munition, result);
        shotHistory.add(shot);
        return shot;
    }

    public synchronized List<ShotRecord> shotsAt(int row, int col) {
        Coordinate target = Coordinate.of(row, col);
        return shotHistory.stream()
                .filter(s -> s.getCoordinate().equals(target))
                .toList();
    }

    public synchronized boolean wasAttacked(int row, int col) {
        Coordinate target = Coordinate.of(row, col);
        return shotHistory.stream().anyMatch(s -> s.getCoordinate().equals(target));
    }

    public synchronized List<ShotRecord> getShotHistory() {
        return List.copyOf(shotHistory);
    }

    /**
     * Coordinates that currently hold at least one occupant.
     */
    public synchronized Collection<Coordinate> occupiedCoordinates() {
        return Set.copyOf(occupants.keySet());
    }

    /**
     * Clears the occupant index and the shot history (new match on the same terrain).
     */
    public synchronized void clear() {
        occupants.clear();
        shotHistory.clear();
    }
}
