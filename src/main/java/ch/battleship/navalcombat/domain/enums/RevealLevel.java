package ch.battleship.navalcombat.domain.enums;

/**
 * How much an attacker learns about a damaged ship (progressive fog of war).
 */
public enum RevealLevel {
    /**
     * Undamaged; nothing known.
     */
    HIDDEN,
    /**
     * Damaged; only the hit itself is known.
     */
    HIT,
    /**
     * At least half destroyed; the size category is disclosed.
     */
    SIZE_HINT,
    /**
     * Three quarters destroyed or more; class and name are disclosed.
     */
    CRITICAL
}
