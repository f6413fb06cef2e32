package ch.battleship.navalcombat.domain;

/**
 * Rectangular area (inclusive bounds) an alliance must place its ships in.
 */
public record PlacementZone(int minRow, int maxRow, int minCol, int maxCol) {

    public PlacementZone {
        if (minRow > maxRow || minCol > maxCol) {
            throw new IllegalArgumentException("Placement zone bounds are inverted");
        }
    }

    public boolean contains(Coordinate c) {
        return c.getRow() >= minRow && c.getRow() <= maxRow
                && c.getCol() >= minCol && c.getCol() <= maxCol;
    }
}
