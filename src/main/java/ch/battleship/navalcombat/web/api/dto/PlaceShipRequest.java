package ch.battleship.navalcombat.web.api.dto;

import java.util.UUID;

/**
 * Manual placement of one ship: a start cell plus the drag delta that picks the direction.
 *
 * @param playerId owner of the ship
 * @param row start row (0-based)
 * @param col start column (0-based)
 * @param rowDelta rows dragged (positive = down)
 * @param colDelta columns dragged (positive = right)
 */
public record PlaceShipRequest(
        UUID playerId,
        int row,
        int col,
        int rowDelta,
        int colDelta
) {}
