package ch.battleship.navalcombat.domain.exception;

/**
 * Thrown when an action is attempted outside its valid phase, out of turn, or while another
 * action is still being processed. Fatal to that action only, never to the match.
 */
public class GameStateException extends IllegalStateException {

    public GameStateException(String message) {
        super(message);
    }
}
