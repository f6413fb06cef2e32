package ch.battleship.navalcombat.domain;

import ch.battleship.navalcombat.domain.enums.PlayerType;
import ch.battleship.navalcombat.domain.exception.TargetRequestCancelledException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Human turn participant. Targets are supplied from outside (UI, REST) through a cancelable
 * request.
 *
 * <p>A request resolves at most once: by {@link #supplyTarget(Coordinate)}, by
 * {@link #cancelPendingRequest(String)} or by its timeout. Resolving a request never touches the
 * game; the caller submits the coordinate as a regular fire action.
 */
@Slf4j
public class HumanPlayer extends Player {

    private CompletableFuture<Coordinate> pendingRequest;

    public HumanPlayer(UUID id, String name) {
        super(id, name);
    }

    @Override
    public PlayerType getType() {
        return PlayerType.HUMAN;
    }

    /**
     * Opens a target request. An open request is returned as-is instead of creating a second one.
     *
     * @param timeout time after which the request fails with a
     *                {@link java.util.concurrent.TimeoutException}
     * @return future completed with the chosen coordinate
     */
    public synchronized CompletableFuture<Coordinate> requestTarget(Duration timeout) {
        if (hasPendingRequest()) {
            return pendingRequest;
        }
        pendingRequest = new CompletableFuture<Coordinate>()
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
        log.debug("Target requested from {} (timeout {} ms)", getName(), timeout.toMillis());
        return pendingRequest;
    }

    /**
     * Resolves the open request with a coordinate.
     *
     * @return {@code true} if a request was open and is now resolved by this call
     */
    public boolean supplyTarget(Coordinate target) {
        CompletableFuture<Coordinate> request = currentRequest();
        return request != null && request.complete(target);
    }

    /**
     * Rejects the open request with a {@link TargetRequestCancelledException}.
     *
     * @return {@code true} if a request was open and is now rejected by this call
     */
    public boolean cancelPendingRequest(String reason) {
        CompletableFuture<Coordinate> request = currentRequest();
        if (request == null) {
            return false;
        }
        boolean cancelled = request.completeExceptionally(new TargetRequestCancelledException(reason));
        if (cancelled) {
            log.debug("Target request of {} cancelled: {}", getName(), reason);
        }
        return cancelled;
    }

    // completion runs callbacks, so it happens outside this lock
    private synchronized CompletableFuture<Coordinate> currentRequest() {
        return pendingRequest;
    }

    public synchronized boolean hasPendingRequest() {
        return pendingRequest != null && !pendingRequest.isDone();
    }
}
