package ch.battleship.navalcombat.domain.enums;

/**
 * Lifecycle phase of a match. Transitions are monotonic; only an explicit reset returns to
 * {@link #SETUP}.
 */
public enum GameState {
    /**
     * Players and alliances are being assembled. No ships can be placed yet.
     */
    SETUP,
    /**
     * Fleets are being placed. Firing is NOT allowed.
     */
    PLACEMENT,
    PLAYING,
    FINISHED
}
