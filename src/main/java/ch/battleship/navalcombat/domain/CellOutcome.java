package ch.battleship.navalcombat.domain;

import ch.battleship.navalcombat.domain.enums.ShotResult;

import java.util.List;

/**
 * Result of an action on one affected cell.
 *
 * @param coordinate affected cell
 * @param result cell outcome, {@code null} for cells covered by a placement action
 * @param occupied whether an enemy ship covers the cell (known to the attacker after this action)
 * @param shipIds enemy ships damaged on this cell
 * @param sunkShipIds subset of {@code shipIds} sunk by this action
 */
public record CellOutcome(
        Coordinate coordinate,
        ShotResult result,
        boolean occupied,
        List<Integer> shipIds,
        List<Integer> sunkShipIds
) {

    public CellOutcome {
        shipIds = List.copyOf(shipIds);
        sunkShipIds = List.copyOf(sunkShipIds);
    }

    public static CellOutcome miss(Coordinate coordinate) {
        return new CellOutcome(coordinate, ShotResult.MISS, false, List.of(), List.of());
    }

    public static CellOutcome placed(Coordinate coordinate) {
        return new CellOutcome(coordinate, null, true, List.of(), List.of());
    }

    public static CellOutcome revealed(Coordinate coordinate, boolean occupied) {
        return new CellOutcome(coordinate, ShotResult.REVEALED, occupied, List.of(), List.of());
    }
}
