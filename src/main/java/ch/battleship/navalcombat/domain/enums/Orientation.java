package ch.battleship.navalcombat.domain.enums;

/**
 * Direction in which a placement run extends from its start cell.
 *
 * <p>{@link #WEST} and {@link #NORTH} cover the "extend left/up" drag case.
 */
public enum Orientation {
    EAST(0, 1),
    SOUTH(1, 0),
    WEST(0, -1),
    NORTH(-1, 0);

    private final int rowStep;
    private final int colStep;

    Orientation(int rowStep, int colStep) {
        this.rowStep = rowStep;
        this.colStep = colStep;
    }

    public int getRowStep() {
        return rowStep;
    }

    public int getColStep() {
        return colStep;
    }

    public boolean isHorizontal() {
        return rowStep == 0;
    }

    /**
     * Derives an orientation from a drag delta.
     *
     * <p>The dominant axis wins; ties go to the horizontal axis. The sign of the delta selects
     * the direction. A zero delta yields {@link #EAST}.
     *
     * @param rowDelta rows dragged (positive = down)
     * @param colDelta columns dragged (positive = right)
     * @return resulting orientation
     */
    public static Orientation fromDrag(int rowDelta, int colDelta) {
        if (Math.abs(colDelta) >= Math.abs(rowDelta)) {
            return colDelta < 0 ? WEST : EAST;
        }
        return rowDelta < 0 ? NORTH : SOUTH;
    }
}
