package ch.battleship.navalcombat.domain;

import ch.battleship.navalcombat.domain.enums.TerrainType;
import lombok.AccessLevel;
import lombok.Getter;

import java.util.Arrays;
import java.util.List;

/**
 * Static per-cell terrain classification for one match.
 *
 * <p>The grid is immutable once created and carries no ship or shot data.
 */
@Getter
public final class TerrainGrid {

    private final int rows;
    private final int cols;

    @Getter(AccessLevel.NONE)
    private final TerrainType[][] cells;

    /**
     * Creates a grid from a terrain matrix. The matrix is copied.
     *
     * @param terrain matrix indexed {@code [row][col]}
     * @throws IllegalArgumentException if the matrix is empty or ragged
     */
    public TerrainGrid(TerrainType[][] terrain) {
        if (terrain == null || terrain.length == 0 || terrain[0].length == 0) {
            throw new IllegalArgumentException("Terrain matrix must not be empty");
        }
        this.rows = terrain.length;
        this.cols = terrain[0].length;
        this.cells = new TerrainType[rows][];
        for (int r = 0; r < rows; r++) {
            if (terrain[r] == null || terrain[r].length != cols) {
                throw new IllegalArgumentException("Terrain matrix must match rows x cols dimensions");
            }
            for (TerrainType type : terrain[r]) {
                if (type == null) {
                    throw new IllegalArgumentException("Terrain matrix must not contain null cells");
                }
            }
            this.cells[r] = Arrays.copyOf(terrain[r], cols);
        }
    }

    /**
     * Creates a grid where every cell has the same terrain.
     */
    public static TerrainGrid uniform(int rows, int cols, TerrainType type) {
        TerrainType[][] terrain = new TerrainType[rows][cols];
        for (TerrainType[] row : terrain) {
            Arrays.fill(row, type);
        }
        return new TerrainGrid(terrain);
    }

    /**
     * Parses a grid from text rows of terrain symbols (see {@link TerrainType#getSymbol()}).
     *
     * @param mapRows one string per row, all of equal length
     */
    public static TerrainGrid parse(List<String> mapRows) {
        TerrainType[][] terrain = new TerrainType[mapRows.size()][];
        for (int r = 0; r < mapRows.size(); r++) {
            String line = mapRows.get(r);
            terrain[r] = new TerrainType[line.length()];
            for (int c = 0; c < line.length(); c++) {
                terrain[r][c] = TerrainType.fromSymbol(line.charAt(c));
            }
        }
        return new TerrainGrid(terrain);
    }

    public boolean contains(int row, int col) {
        return row >= 0 && row < rows && col >= 0 && col < cols;
    }

    /**
     * @throws IndexOutOfBoundsException if the coordinate is outside the grid
     */
    public TerrainType terrainAt(int row, int col) {
        if (!contains(row, col)) {
            throw new IndexOutOfBoundsException("Coordinate (" + row + "," + col + ") outside " + rows + "x" + cols);
        }
        return cells[row][col];
    }
}
