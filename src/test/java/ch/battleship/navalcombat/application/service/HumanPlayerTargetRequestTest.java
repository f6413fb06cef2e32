package ch.battleship.navalcombat.application.service;

import ch.battleship.navalcombat.domain.Coordinate;
import ch.battleship.navalcombat.domain.EraConfiguration;
import ch.battleship.navalcombat.domain.Game;
import ch.battleship.navalcombat.domain.HumanPlayer;
import ch.battleship.navalcombat.domain.enums.AiStrategy;
import ch.battleship.navalcombat.domain.enums.MunitionType;
import ch.battleship.navalcombat.domain.exception.GameStateException;
import ch.battleship.navalcombat.domain.exception.GameValidationException;
import ch.battleship.navalcombat.domain.exception.TargetRequestCancelledException;
import ch.battleship.navalcombat.testutil.GameFixtures;
import ch.battleship.navalcombat.testutil.GameFixtures.Duel;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for cancelable human target requests.
 *
 * <p>A request resolves at most once (target, cancel or timeout) and never mutates the game.
 */
class HumanPlayerTargetRequestTest {

    private static final Duration LONG = Duration.ofMinutes(1);

    @Test
    void supplyTarget_shouldCompleteOpenRequest() throws Exception {
        // Arrange
        HumanPlayer alice = new HumanPlayer(UUID.randomUUID(), "Alice");
        CompletableFuture<Coordinate> request = alice.requestTarget(LONG);

        // Act
        boolean supplied = alice.supplyTarget(Coordinate.of(2, 3));

        // Assert
        assertThat(supplied).isTrue();
        assertThat(request.get(1, TimeUnit.SECONDS)).isEqualTo(Coordinate.of(2, 3));
        assertThat(alice.hasPendingRequest()).isFalse();
    }

    @Test
    void supplyTarget_shouldResolveOnlyOnce() {
        // Arrange
        HumanPlayer alice = new HumanPlayer(UUID.randomUUID(), "Alice");
        CompletableFuture<Coordinate> request = alice.requestTarget(LONG);
        alice.supplyTarget(Coordinate.of(1, 1));

        // Act
        boolean second = alice.supplyTarget(Coordinate.of(5, 5));
        boolean cancelled = alice.cancelPendingRequest("too late");

        // Assert
        assertThat(second).isFalse();
        assertThat(cancelled).isFalse();
        assertThat(request.join()).isEqualTo(Coordinate.of(1, 1));
    }

    @Test
    void supplyTarget_shouldReturnFalse_withoutRequest() {
        HumanPlayer alice = new HumanPlayer(UUID.randomUUID(), "Alice");

        assertThat(alice.supplyTarget(Coordinate.of(0, 0))).isFalse();
        assertThat(alice.cancelPendingRequest("nothing open")).isFalse();
    }

    @Test
    void requestTarget_shouldReturnSameFuture_whileRequestIsOpen() {
        HumanPlayer alice = new HumanPlayer(UUID.randomUUID(), "Alice");

        CompletableFuture<Coordinate> first = alice.requestTarget(LONG);
        CompletableFuture<Coordinate> second = alice.requestTarget(LONG);

        assertThat(second).isSameAs(first);
    }

    @Test
    void cancelPendingRequest_shouldFailRequestWithCancellation() {
        // Arrange
        HumanPlayer alice = new HumanPlayer(UUID.randomUUID(), "Alice");
        CompletableFuture<Coordinate> request = alice.requestTarget(LONG);

        // Act
        boolean cancelled = alice.cancelPendingRequest("Game finished");

        // Assert
        assertThat(cancelled).isTrue();
        assertThatThrownBy(() -> request.get(1, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(TargetRequestCancelledException.class)
                .hasMessageContaining("Game finished");
    }

    @Test
    void requestTarget_shouldFailWithTimeout_whenNoTargetArrives() {
        // Arrange
        HumanPlayer alice = new HumanPlayer(UUID.randomUUID(), "Alice");

        // Act
        CompletableFuture<Coordinate> request = alice.requestTarget(Duration.ofMillis(50));

        // Assert
        assertThatThrownBy(() -> request.get(5, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(TimeoutException.class);
        assertThat(alice.hasPendingRequest()).isFalse();
    }

    @Test
    void requestHumanTarget_shouldNotChangeGame_whenResolved() {
        // Arrange
        Duel duel = GameFixtures.destroyerDuel(GameFixtures.keepTurnRules());
        Game game = duel.game();
        CompletableFuture<Coordinate> request = game.requestHumanTarget(duel.alice().getId(), LONG);

        // Act
        boolean supplied = game.supplyHumanTarget(duel.alice().getId(), Coordinate.of(3, 3));

        // Assert
        assertThat(supplied).isTrue();
        assertThat(request.join()).isEqualTo(Coordinate.of(3, 3));
        assertThat(game.getBoard().getShotHistory()).isEmpty();
        assertThat(game.getTurnNumber()).isEqualTo(1);
    }

    @Test
    void requestHumanTarget_shouldRejectAiPlayer_andWrongPhase() {
        // Arrange
        Duel duel = GameFixtures.destroyerDuel(GameFixtures.keepTurnRules());
        Game setupGame = GameFixtures.newGame(EraConfiguration.traditional());
        HumanPlayer carol = setupGame.addHumanPlayer("Carol", null);
        setupGame.addAiPlayer("Dave", AiStrategy.RANDOM, 1.0, null);

        // Act + Assert
        assertThatThrownBy(() -> duel.game().requestHumanTarget(duel.bob().getId(), LONG))
                .isInstanceOf(GameValidationException.class);
        assertThatThrownBy(() -> setupGame.requestHumanTarget(carol.getId(), LONG))
                .isInstanceOf(GameStateException.class);
    }

    @Test
    void finishingGame_shouldCancelOpenRequest() {
        // Arrange
        Duel duel = GameFixtures.destroyerDuel(GameFixtures.keepTurnRules());
        Game game = duel.game();
        game.fire(duel.alice().getId(), Coordinate.of(3, 3), MunitionType.SHOT);
        CompletableFuture<Coordinate> request = game.requestHumanTarget(duel.alice().getId(), LONG);

        // Act
        game.fire(duel.alice().getId(), Coordinate.of(3, 4), MunitionType.SHOT);

        // Assert
        assertThat(request).isCompletedExceptionally();
    }
}
