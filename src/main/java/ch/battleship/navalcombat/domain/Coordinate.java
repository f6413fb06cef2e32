package ch.battleship.navalcombat.domain;

import lombok.Getter;

import java.util.List;

/**
 * Immutable value object representing a cell on the game board.
 *
 * <p>Coordinates are 0-based (row: 0..rows-1, col: 0..cols-1) and are used for placement runs,
 * the occupant index and targeting. Implements {@link #equals(Object)} and {@link #hashCode()}
 * to support set operations (e.g. the dont-shoot set).
 */
@Getter
public final class Coordinate {

    /**
     * 0-based row index.
     */
    private final int row;

    /**
     * 0-based column index.
     */
    private final int col;

    /**
     * Creates a coordinate with 0-based indices.
     *
     * @param row 0-based row
     * @param col 0-based column
     */
    public Coordinate(int row, int col) {
        this.row = row;
        this.col = col;
    }

    public static Coordinate of(int row, int col) {
        return new Coordinate(row, col);
    }

    /**
     * Returns the coordinate shifted by the given offsets (may lie outside any board).
     */
    public Coordinate offset(int rowDelta, int colDelta) {
        return new Coordinate(row + rowDelta, col + colDelta);
    }

    /**
     * Returns the four orthogonal neighbours in north, south, west, east order.
     * Neighbours are not bounds-checked.
     */
    public List<Coordinate> orthogonalNeighbours() {
        return List.of(offset(-1, 0), offset(1, 0), offset(0, -1), offset(0, 1));
    }

    /**
     * Human-readable cell name as used in the battle log: column letters followed by the
     * 1-based row, e.g. {@code (2,3)} renders as {@code D3}. Columns past {@code Z} continue
     * with {@code AA}, {@code AB} and so on.
     */
    public String toCellName() {
        return columnName(col) + (row + 1);
    }

    static String columnName(int col) {
        StringBuilder name = new StringBuilder();
        for (int n = col + 1; n > 0; n = (n - 1) / 26) {
            name.insert(0, (char) ('A' + (n - 1) % 26));
        }
        return name.toString();
    }

    /**
     * Value-object equality based on row/col.
     *
     * @param o other object
     * @return {@code true} if both coordinates share the same row/col values
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Coordinate other)) return false;
        return row == other.row && col == other.col;
    }

    /**
     * Hash code consistent with {@link #equals(Object)} to allow usage in hash-based collections.
     *
     * @return hash code based on row/col
     */
    @Override
    public int hashCode() {
        return 31 * row + col;
    }

    @Override
    public String toString() {
        return "(" + row + "," + col + ")";
    }
}
