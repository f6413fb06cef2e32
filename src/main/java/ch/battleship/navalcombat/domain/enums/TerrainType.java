package ch.battleship.navalcombat.domain.enums;

import java.util.EnumSet;
import java.util.Set;

/**
 * Static terrain classification of a single board cell.
 *
 * <p>{@link #EXCLUDED} marks cells that lie inside the rectangular grid but are not part of the
 * playable board (irregular coastlines).
 */
public enum TerrainType {
    DEEP('D'),
    SHALLOW('S'),
    SHOAL('H'),
    MARSH('M'),
    LAND('L'),
    ROCK('R'),
    EXCLUDED('X');

    private final char symbol;

    TerrainType(char symbol) {
        this.symbol = symbol;
    }

    public char getSymbol() {
        return symbol;
    }

    /**
     * Returns {@code true} for water a submarine torpedo can travel through.
     */
    public boolean isNavigableWater() {
        return this == DEEP || this == SHALLOW;
    }

    /**
     * Resolves a terrain type from its single-character map symbol (case-insensitive).
     *
     * @param symbol map symbol, e.g. {@code 'D'} for deep water
     * @return matching terrain type
     * @throws IllegalArgumentException if the symbol is unknown
     */
    public static TerrainType fromSymbol(char symbol) {
        char upper = Character.toUpperCase(symbol);
        for (TerrainType type : values()) {
            if (type.symbol == upper) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown terrain symbol: " + symbol);
    }

    /**
     * Terrain a regular surface vessel may occupy.
     */
    public static Set<TerrainType> surfaceWater() {
        return EnumSet.of(DEEP, SHALLOW);
    }
}
