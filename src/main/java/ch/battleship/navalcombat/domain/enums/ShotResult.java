package ch.battleship.navalcombat.domain.enums;

/**
 * Represents the outcome of an attack on a single board cell.
 */
public enum ShotResult {
    /**
     * No enemy ship occupies the cell.
     */
    MISS,

    /**
     * An enemy ship was damaged but is still afloat.
     */
    HIT,

    /**
     * An enemy ship was hit and every one of its cells is now destroyed.
     */
    SUNK,

    /**
     * Every enemy ship cell at the coordinate was already destroyed; nothing was damaged.
     */
    ALREADY_HIT,

    /**
     * A star shell illuminated the cell; occupancy was revealed, nothing was damaged.
     */
    REVEALED;

    public boolean isHit() {
        return this == HIT || this == SUNK;
    }
}
