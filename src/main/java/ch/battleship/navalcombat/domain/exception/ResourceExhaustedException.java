package ch.battleship.navalcombat.domain.exception;

/**
 * Thrown when an action needs a resource that is used up: munitions, torpedoes or
 * remaining AI targets.
 */
public class ResourceExhaustedException extends IllegalStateException {

    public ResourceExhaustedException(String message) {
        super(message);
    }
}
