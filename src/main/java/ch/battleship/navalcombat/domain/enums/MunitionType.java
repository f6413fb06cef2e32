package ch.battleship.navalcombat.domain.enums;

/**
 * Categories of attack action, each with its own footprint and resource cost.
 */
public enum MunitionType {

    /**
     * Single-cell attack with unlimited supply.
     */
    SHOT(false, "Shot"),

    /**
     * Illuminates an area and reveals occupancy without damaging anything.
     */
    STAR_SHELL(true, "Star Shell"),

    /**
     * Attacks the target and its four orthogonal neighbours.
     */
    SCATTER_SHOT(true, "Scatter Shot"),

    /**
     * Submarine-launched single-cell attack; consumes a torpedo from a specific submarine.
     */
    TORPEDO(true, "Torpedo");

    private final boolean limited;
    private final String displayName;

    MunitionType(boolean limited, String displayName) {
        this.limited = limited;
        this.displayName = displayName;
    }

    /**
     * @return {@code true} if firing this munition consumes a finite resource
     */
    public boolean isLimited() {
        return limited;
    }

    public String getDisplayName() {
        return displayName;
    }
}
