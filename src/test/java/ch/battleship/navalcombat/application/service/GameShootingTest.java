package ch.battleship.navalcombat.application.service;

import ch.battleship.navalcombat.domain.ActionResult;
import ch.battleship.navalcombat.domain.AiPlayer;
import ch.battleship.navalcombat.domain.Coordinate;
import ch.battleship.navalcombat.domain.EraConfiguration;
import ch.battleship.navalcombat.domain.EventLogEntry;
import ch.battleship.navalcombat.domain.Game;
import ch.battleship.navalcombat.domain.GameAction;
import ch.battleship.navalcombat.domain.GameRules;
import ch.battleship.navalcombat.domain.HumanPlayer;
import ch.battleship.navalcombat.domain.ShipDefinition;
import ch.battleship.navalcombat.domain.ShotRecord;
import ch.battleship.navalcombat.domain.TerrainGrid;
import ch.battleship.navalcombat.domain.enums.ActionType;
import ch.battleship.navalcombat.domain.enums.AiStrategy;
import ch.battleship.navalcombat.domain.enums.MunitionType;
import ch.battleship.navalcombat.domain.enums.ShipClass;
import ch.battleship.navalcombat.domain.enums.ShotResult;
import ch.battleship.navalcombat.domain.exception.GameValidationException;
import ch.battleship.navalcombat.testutil.GameFixtures;
import ch.battleship.navalcombat.testutil.GameFixtures.Duel;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for plain shots resolved by {@link Game#fire}.
 *
 * <p>Scope:
 * <ul>
 *   <li>MISS / HIT / ALREADY_HIT / SUNK outcomes</li>
 *   <li>Dont-shoot bookkeeping and target validation</li>
 *   <li>Score and shot statistics</li>
 * </ul>
 *
 * <p>Out of scope:
 * <ul>
 *   <li>Special munitions (see {@link MunitionsTest})</li>
 *   <li>Turn order and winner detection (see {@link GameLifecycleTest})</li>
 * </ul>
 */
class GameShootingTest {

    private static final Coordinate BOW = Coordinate.of(3, 3);
    private static final Coordinate STERN = Coordinate.of(3, 4);

    @Test
    void fire_shouldReturnMiss_whenNoShipAtCoordinate() {
        // Arrange
        Duel duel = GameFixtures.destroyerDuel(GameFixtures.keepTurnRules());
        Game game = duel.game();

        // Act
        ActionResult result = game.fire(duel.alice().getId(), Coordinate.of(7, 7), MunitionType.SHOT);

        // Assert
        assertThat(result.result()).isEqualTo(ShotResult.MISS);
        assertThat(duel.alice().getDontShoot()).containsExactly(Coordinate.of(7, 7));
        assertThat(duel.alice().getMisses()).isEqualTo(1);
        assertThat(game.getBoard().shotsAt(7, 7)).hasSize(1);
        assertThat(result.logEntries()).extracting(EventLogEntry::message)
                .containsExactly("t1-Miss at H8 by Alice");
    }

    @Test
    void fire_shouldHitThenReportAlreadyHitThenSink_destroyerScenario() {
        // Arrange
        Duel duel = GameFixtures.destroyerDuel(GameFixtures.keepTurnRules());
        Game game = duel.game();

        // Act
        ActionResult first = game.fire(duel.alice().getId(), BOW, MunitionType.SHOT);
        ActionResult second = game.fire(duel.alice().getId(), BOW, MunitionType.SHOT);
        ActionResult third = game.fire(duel.alice().getId(), STERN, MunitionType.SHOT);

        // Assert
        assertThat(first.result()).isEqualTo(ShotResult.HIT);
        assertThat(second.result()).isEqualTo(ShotResult.ALREADY_HIT);
        assertThat(third.result()).isEqualTo(ShotResult.SUNK);

        assertThat(duel.alice().getDontShoot()).containsExactlyInAnyOrder(BOW, STERN);
        assertThat(duel.bob().getFleet().getShips().get(0).isSunk()).isTrue();
        assertThat(game.getBoard().shotsAt(3, 3)).extracting(ShotRecord::getResult)
                .containsExactly(ShotResult.HIT, ShotResult.ALREADY_HIT);
    }

    @Test
    void fire_shouldNotAddHitCellToDontShoot_untilShipIsSunk() {
        // Arrange
        Duel duel = GameFixtures.destroyerDuel(GameFixtures.keepTurnRules());

        // Act
        duel.game().fire(duel.alice().getId(), BOW, MunitionType.SHOT);

        // Assert
        assertThat(duel.alice().getDontShoot()).isEmpty();
        assertThat(duel.game().isValidAttack(duel.alice().getId(), 3, 3)).isTrue();
    }

    @Test
    void fire_shouldThrowAndRecordNothing_whenTargetIsExcluded() {
        // Arrange
        List<String> rows = new ArrayList<>();
        for (int r = 0; r < 9; r++) {
            rows.add("DDDDDDDDDD");
        }
        rows.add("DDDDDDDDDX");
        EraConfiguration era = GameFixtures.era(TerrainGrid.parse(rows), GameFixtures.keepTurnRules(),
                GameFixtures.destroyerOnly(), List.of());
        Duel duel = GameFixtures.destroyerDuel(era);
        Game game = duel.game();

        // Act + Assert
        assertThatThrownBy(() -> game.fire(duel.alice().getId(), Coordinate.of(9, 9), MunitionType.SHOT))
                .isInstanceOf(GameValidationException.class);

        assertThat(game.getBoard().getShotHistory()).isEmpty();
        assertThat(duel.alice().getShots()).isZero();
        assertThat(game.getTurnNumber()).isEqualTo(1);
    }

    @Test
    void fire_shouldThrow_whenTargetIsOutsideBoard() {
        // Arrange
        Duel duel = GameFixtures.destroyerDuel(GameFixtures.keepTurnRules());

        // Act + Assert
        assertThatThrownBy(() -> duel.game().fire(duel.alice().getId(), Coordinate.of(10, 0), MunitionType.SHOT))
                .isInstanceOf(GameValidationException.class);
        assertThat(duel.game().getBoard().getShotHistory()).isEmpty();
    }

    @Test
    void processAction_shouldRejectFireWithoutTarget_withoutMutation() {
        // Arrange
        Duel duel = GameFixtures.destroyerDuel(GameFixtures.keepTurnRules());
        Game game = duel.game();
        GameAction noTarget = new GameAction(ActionType.FIRE, duel.alice().getId(), null, null, null, 0, 0);

        // Act + Assert
        assertThatThrownBy(() -> game.processAction(noTarget))
                .isInstanceOf(GameValidationException.class)
                .hasMessage("Target is required");

        assertThat(game.getBoard().getShotHistory()).isEmpty();
        assertThat(duel.alice().getShots()).isZero();
        assertThat(game.getCurrentPlayer()).isSameAs(duel.alice());
        assertThat(game.getTurnNumber()).isEqualTo(1);
    }

    @Test
    void fire_shouldRejectRepeatedMiss_withoutChangingStatistics() {
        // Arrange
        Duel duel = GameFixtures.destroyerDuel(GameFixtures.keepTurnRules());
        Game game = duel.game();
        game.fire(duel.alice().getId(), Coordinate.of(5, 5), MunitionType.SHOT);

        // Act + Assert
        assertThatThrownBy(() -> game.fire(duel.alice().getId(), Coordinate.of(5, 5), MunitionType.SHOT))
                .isInstanceOf(GameValidationException.class);

        assertThat(duel.alice().getMisses()).isEqualTo(1);
        assertThat(game.getBoard().getShotHistory()).hasSize(1);
        assertThat(game.isValidAttack(duel.alice().getId(), 5, 5)).isFalse();
    }

    @Test
    void fire_shouldAwardHitAndSinkPoints_atDifficultyOne() {
        // Arrange
        Duel duel = GameFixtures.destroyerDuel(GameFixtures.keepTurnRules());

        // Act
        duel.game().fire(duel.alice().getId(), BOW, MunitionType.SHOT);
        duel.game().fire(duel.alice().getId(), STERN, MunitionType.SHOT);

        // Assert
        assertThat(duel.alice().getHits()).isEqualTo(2);
        assertThat(duel.alice().getSunk()).isEqualTo(1);
        assertThat(duel.alice().getScore()).isEqualTo(1 + 10 + 1);
        assertThat(duel.alice().getAccuracy()).isEqualTo(100.0);
    }

    @Test
    void fire_shouldScaleHumanScore_byAiDifficulty() {
        // Arrange
        GameRules rules = GameFixtures.keepTurnRules();
        Game game = GameFixtures.newGame(GameFixtures.deepSea(rules, GameFixtures.destroyerOnly()));
        HumanPlayer alice = game.addHumanPlayer("Alice", null);
        AiPlayer bob = game.addAiPlayer("Bob", AiStrategy.RANDOM, 2.0, null, new Random(1));
        game.beginPlacement();
        game.placeShip(alice.getId(), GameFixtures.firstShipId(alice), Coordinate.of(0, 0), 0, 1);
        game.placeShip(bob.getId(), GameFixtures.firstShipId(bob), BOW, 0, 1);
        game.startBattle();

        // Act
        game.fire(alice.getId(), BOW, MunitionType.SHOT);

        // Assert
        assertThat(alice.getScore()).isEqualTo(2);
    }

    @Test
    void fire_shouldDescribeDamagedShipProgressively() {
        // Arrange
        Game game = GameFixtures.newGame(GameFixtures.deepSea(GameFixtures.keepTurnRules(),
                List.of(ShipDefinition.of(ShipClass.BATTLESHIP))));
        HumanPlayer alice = game.addHumanPlayer("Alice", null);
        AiPlayer bob = game.addAiPlayer("Bob", AiStrategy.RANDOM, 1.0, null, new Random(1));
        game.beginPlacement();
        game.placeShip(alice.getId(), GameFixtures.firstShipId(alice), Coordinate.of(0, 0), 0, 1);
        game.placeShip(bob.getId(), GameFixtures.firstShipId(bob), Coordinate.of(5, 0), 0, 1);
        game.startBattle();

        // Act
        String first = game.fire(alice.getId(), Coordinate.of(5, 0), MunitionType.SHOT).logEntries().get(0).message();
        String second = game.fire(alice.getId(), Coordinate.of(5, 1), MunitionType.SHOT).logEntries().get(0).message();
        String third = game.fire(alice.getId(), Coordinate.of(5, 2), MunitionType.SHOT).logEntries().get(0).message();

        // Assert
        assertThat(first).isEqualTo("t1-HIT: unknown ship (Bob) at A6 by Alice [hit]");
        assertThat(second).isEqualTo("t2-HIT: large ship (Bob) at B6 by Alice [size-hint]");
        assertThat(third).isEqualTo("t3-HIT: Battleship (Bob) at C6 by Alice [critical]");
    }
}
