package ch.battleship.navalcombat.domain.exception;

/**
 * Thrown when a placement or attack is rejected by board rules (bounds, excluded terrain,
 * terrain mismatch, overlap, already-excluded target).
 *
 * <p>A rejected action never mutates the game.
 */
public class GameValidationException extends IllegalArgumentException {

    public GameValidationException(String message) {
        super(message);
    }
}
