package ch.battleship.navalcombat.service;

import ch.battleship.navalcombat.domain.ActionResult;
import ch.battleship.navalcombat.domain.Game;
import ch.battleship.navalcombat.domain.exception.GameStateException;
import ch.battleship.navalcombat.domain.exception.ResourceExhaustedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.function.Consumer;

/**
 * Plays AI moves with a short delay after the previous action, so clients can render feedback
 * before the next shot arrives. The delay is presentation sequencing only; each move goes
 * through {@link Game#processAction} like any other action.
 */
@Component
@Slf4j
public class AiTurnScheduler {

    private final TaskScheduler taskScheduler;

    /**
     * Delay before an AI move in milliseconds.
     */
    private final long turnDelayMs;

    public AiTurnScheduler(TaskScheduler taskScheduler,
                           @Value("${naval.ai.turn-delay-ms:800}") long turnDelayMs) {
        this.taskScheduler = taskScheduler;
        this.turnDelayMs = turnDelayMs;
    }

    /**
     * Schedules the next AI move of the game.
     *
     * <p>Turn-based games play the current AI's move; in simultaneous mode every active AI fires
     * once. {@code afterTurn} receives the results of the turn, empty when no AI was due.
     *
     * @param game running game
     * @param afterTurn called once with the results of the AI turn
     */
    public void scheduleNextTurn(Game game, Consumer<List<ActionResult>> afterTurn) {
        taskScheduler.schedule(() -> playTurn(game, afterTurn), Instant.now().plusMillis(turnDelayMs));
        log.debug("Scheduled AI turn for game {} in {}ms", game.getGameCode(), turnDelayMs);
    }

    void playTurn(Game game, Consumer<List<ActionResult>> afterTurn) {
        List<ActionResult> results;
        try {
            results = game.getRules().simultaneousFire()
                    ? game.advanceAiTurns()
                    : game.advanceOneAiTurn().map(List::of).orElse(List.of());
        } catch (ResourceExhaustedException e) {
            log.warn("AI turn in game {} aborted: {}", game.getGameCode(), e.getMessage());
            return;
        } catch (GameStateException e) {
            log.debug("Game {} busy ({}), retrying AI turn", game.getGameCode(), e.getMessage());
            scheduleNextTurn(game, afterTurn);
            return;
        }
        afterTurn.accept(results);
    }
}
