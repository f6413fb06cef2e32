package ch.battleship.navalcombat.domain.enums;

/**
 * Which existing placements a new placement run may not overlap.
 */
public enum OverlapRule {
    /**
     * Any overlap is allowed; only bounds and terrain are checked.
     */
    NONE,
    /**
     * A ship may not overlap a ship of the same fleet; different fleets share the board freely.
     */
    SAME_FLEET,
    /**
     * No two ships may share a cell.
     */
    ALL
}
