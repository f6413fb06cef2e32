package ch.battleship.navalcombat.domain.exception;

/**
 * Completes a pending human target request that was cancelled (disconnect, explicit cancel,
 * new match).
 */
public class TargetRequestCancelledException extends RuntimeException {

    public TargetRequestCancelledException(String message) {
        super(message);
    }
}
