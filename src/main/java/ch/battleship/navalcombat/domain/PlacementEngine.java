package ch.battleship.navalcombat.domain;

import ch.battleship.navalcombat.domain.enums.Orientation;
import ch.battleship.navalcombat.domain.enums.OverlapRule;
import ch.battleship.navalcombat.domain.exception.GameValidationException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Validates and commits ship placements onto the shared board.
 *
 * <p>Validation order (fail fast): bounds, terrain exclusion, terrain type, placement zone,
 * overlap rule. A rejected placement never registers anything on the board.
 */
@Slf4j
public class PlacementEngine {

    private static final Orientation[] RANDOM_ORIENTATIONS = {Orientation.EAST, Orientation.SOUTH};

    private final Board board;
    private final OverlapRule overlapRule;
    private final int attempts;
    private final Random random;

    public PlacementEngine(Board board, OverlapRule overlapRule, int attempts, Random random) {
        this.board = board;
        this.overlapRule = overlapRule;
        this.attempts = attempts;
        this.random = random;
    }

    /**
     * Computes the placement run of a ship.
     *
     * @param start start cell
     * @param size ship size
     * @param orientation direction the run extends to
     * @return ordered run of {@code size} cells (not bounds-checked)
     */
    public static List<Coordinate> computeRun(Coordinate start, int size, Orientation orientation) {
        List<Coordinate> run = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            run.add(start.offset(orientation.getRowStep() * i, orientation.getColStep() * i));
        }
        return run;
    }

    /**
     * Places a ship from a start cell and a drag delta (manual placement).
     *
     * @throws GameValidationException if the resulting run is rejected
     */
    public List<Coordinate> placeManual(Fleet fleet, PlacementZone zone, Ship ship,
                                        Coordinate start, int rowDelta, int colDelta) {
        Orientation orientation = Orientation.fromDrag(rowDelta, colDelta);
        List<Coordinate> run = computeRun(start, ship.getSize(), orientation);
        place(fleet, zone, ship, run);
        return run;
    }

    /**
     * Validates and commits a run for a ship of the given fleet.
     *
     * @throws GameValidationException if the run is rejected
     */
    public void place(Fleet fleet, PlacementZone zone, Ship ship, List<Coordinate> run) {
        String reason = validate(fleet, zone, ship, run);
        if (reason != null) {
            throw new GameValidationException("Cannot place " + ship.getName() + ": " + reason);
        }
        board.registerPlacement(ship.getId(), run, ship.getAllowedTerrain());
        ship.place(run);
    }

    public boolean canPlace(Fleet fleet, PlacementZone zone, Ship ship, List<Coordinate> run) {
        return validate(fleet, zone, ship, run) == null;
    }

    /**
     * @return description of the first violated rule, {@code null} if the run is valid
     */
    public String validate(Fleet fleet, PlacementZone zone, Ship ship, List<Coordinate> run) {
        if (run.size() != ship.getSize()) {
            return "run has " + run.size() + " cells, ship needs " + ship.getSize();
        }
        String reason = board.rejectionReason(run, ship.getAllowedTerrain());
        if (reason != null) {
            return reason;
        }
        if (zone != null) {
            for (Coordinate c : run) {
                if (!zone.contains(c)) {
                    return "cell " + c.toCellName() + " is outside the placement zone";
                }
            }
        }
        for (Coordinate c : run) {
            if (overlaps(fleet, ship, c)) {
                return "cell " + c.toCellName() + " is already occupied";
            }
        }
        return null;
    }

    private boolean overlaps(Fleet fleet, Ship ship, Coordinate c) {
        if (overlapRule == OverlapRule.NONE) {
            return false;
        }
        for (Occupant occupant : board.occupantsAt(c.getRow(), c.getCol())) {
            if (occupant.shipId() == ship.getId()) {
                continue;
            }
            if (overlapRule == OverlapRule.ALL || fleet.getShip(occupant.shipId()).isPresent()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Places every unplaced ship of a fleet at random positions.
     *
     * <p>Each ship gets up to the configured number of random start/orientation tries. Ships
     * placed before a failing ship stay placed.
     *
     * @throws GameValidationException naming the first ship that could not be placed
     */
    public void autoPlace(Fleet fleet, PlacementZone zone) {
        Ship ship;
        while ((ship = fleet.nextUnplaced()) != null) {
            if (!tryPlaceRandomly(fleet, zone, ship)) {
                throw new GameValidationException(String.format(
                        "Could not place %s after %d attempts on board %dx%d",
                        ship.getName(), attempts, board.getRows(), board.getCols()));
            }
        }
    }

    private boolean tryPlaceRandomly(Fleet fleet, PlacementZone zone, Ship ship) {
        int minRow = zone == null ? 0 : Math.max(0, zone.minRow());
        int maxRow = zone == null ? board.getRows() - 1 : Math.min(board.getRows() - 1, zone.maxRow());
        int minCol = zone == null ? 0 : Math.max(0, zone.minCol());
        int maxCol = zone == null ? board.getCols() - 1 : Math.min(board.getCols() - 1, zone.maxCol());
        if (minRow > maxRow || minCol > maxCol) {
            return false;
        }

        for (int attempt = 0; attempt < attempts; attempt++) {
            int row = minRow + random.nextInt(maxRow - minRow + 1);
            int col = minCol + random.nextInt(maxCol - minCol + 1);
            Orientation orientation = RANDOM_ORIENTATIONS[random.nextInt(RANDOM_ORIENTATIONS.length)];
            List<Coordinate> run = computeRun(Coordinate.of(row, col), ship.getSize(), orientation);

            if (canPlace(fleet, zone, ship, run)) {
                place(fleet, zone, ship, run);
                log.debug("Auto-placed {} at {} {} after {} attempt(s)",
                        ship.getName(), run.get(0).toCellName(), orientation, attempt + 1);
                return true;
            }
        }
        return false;
    }

    /**
     * Unplaces every ship of the fleet and removes it from the board index.
     */
    public void clear(Fleet fleet) {
        for (Ship ship : fleet.getShips()) {
            board.unregister(ship.getId());
            ship.reset();
        }
    }
}
