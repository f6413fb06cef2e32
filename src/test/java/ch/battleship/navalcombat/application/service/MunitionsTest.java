package ch.battleship.navalcombat.application.service;

import ch.battleship.navalcombat.domain.ActionResult;
import ch.battleship.navalcombat.domain.AiPlayer;
import ch.battleship.navalcombat.domain.CellOutcome;
import ch.battleship.navalcombat.domain.Coordinate;
import ch.battleship.navalcombat.domain.EraConfiguration;
import ch.battleship.navalcombat.domain.Game;
import ch.battleship.navalcombat.domain.GameAction;
import ch.battleship.navalcombat.domain.GameRules;
import ch.battleship.navalcombat.domain.HumanPlayer;
import ch.battleship.navalcombat.domain.MunitionAllowance;
import ch.battleship.navalcombat.domain.Ship;
import ch.battleship.navalcombat.domain.ShipDefinition;
import ch.battleship.navalcombat.domain.TerrainGrid;
import ch.battleship.navalcombat.domain.enums.AiStrategy;
import ch.battleship.navalcombat.domain.enums.MunitionType;
import ch.battleship.navalcombat.domain.enums.ShipClass;
import ch.battleship.navalcombat.domain.enums.ShotResult;
import ch.battleship.navalcombat.domain.enums.TerrainType;
import ch.battleship.navalcombat.domain.exception.GameValidationException;
import ch.battleship.navalcombat.domain.exception.ResourceExhaustedException;
import ch.battleship.navalcombat.testutil.GameFixtures;
import ch.battleship.navalcombat.testutil.GameFixtures.Duel;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for star shells, scatter shots and torpedoes.
 *
 * <p>Scope:
 * <ul>
 *   <li>Footprints and outcomes of each munition</li>
 *   <li>Balance consumption and exhaustion</li>
 *   <li>Rejected actions leave the game unchanged</li>
 * </ul>
 */
class MunitionsTest {

    private static Duel duelWith(GameRules rules, List<MunitionAllowance> munitions) {
        return GameFixtures.destroyerDuel(GameFixtures.era(TerrainGrid.uniform(10, 10, TerrainType.DEEP),
                rules, GameFixtures.destroyerOnly(), munitions));
    }

    // ----------------- star shell -----------------

    @Test
    void starShell_shouldRevealContacts_withoutDamageOrHistory() {
        // Arrange
        Duel duel = duelWith(GameFixtures.keepTurnRules(), List.of(new MunitionAllowance(MunitionType.STAR_SHELL, 2, 1)));
        Game game = duel.game();

        // Act
        ActionResult result = game.fire(duel.alice().getId(), Coordinate.of(3, 3), MunitionType.STAR_SHELL);

        // Assert
        assertThat(result.result()).isEqualTo(ShotResult.REVEALED);
        assertThat(result.cells()).hasSize(9);
        assertThat(result.cells()).filteredOn(CellOutcome::occupied)
                .extracting(CellOutcome::coordinate)
                .containsExactlyInAnyOrder(Coordinate.of(3, 3), Coordinate.of(3, 4));
        assertThat(result.logEntries().get(0).message()).isEqualTo("t1-Star Shell over D4 by Alice: 2 contact(s)");

        assertThat(duel.alice().getMunitions(MunitionType.STAR_SHELL)).isEqualTo(1);
        assertThat(duel.alice().getShots()).isZero();
        assertThat(duel.alice().getDontShoot()).isEmpty();
        assertThat(game.getBoard().getShotHistory()).isEmpty();
        assertThat(duel.bob().getFleet().getHealth()).isEqualTo(1.0);
    }

    @Test
    void starShell_shouldClipLargePatternAtBoardEdge() {
        // Arrange
        GameRules rules = GameFixtures.keepTurnRules().toBuilder().starShellSize(5).build();
        Duel duel = duelWith(rules, List.of(new MunitionAllowance(MunitionType.STAR_SHELL, 1, 0)));

        // Act
        ActionResult result = duel.game().fire(duel.alice().getId(), Coordinate.of(0, 0), MunitionType.STAR_SHELL);

        // Assert
        assertThat(result.cells()).hasSize(9);
        assertThat(result.cells()).noneMatch(CellOutcome::occupied);
    }

    @Test
    void starShell_shouldThrowAndChangeNothing_whenBalanceIsZero() {
        // Arrange
        Duel duel = duelWith(GameFixtures.keepTurnRules(), List.of());
        Game game = duel.game();

        // Act + Assert
        assertThatThrownBy(() -> game.fire(duel.alice().getId(), Coordinate.of(3, 3), MunitionType.STAR_SHELL))
                .isInstanceOf(ResourceExhaustedException.class);
        assertThat(game.getTurnNumber()).isEqualTo(1);
        assertThat(game.getCurrentPlayer()).isSameAs(duel.alice());
    }

    // ----------------- scatter shot -----------------

    @Test
    void scatterShot_shouldHitTargetAndShootableNeighbours() {
        // Arrange
        Duel duel = duelWith(GameFixtures.keepTurnRules(), List.of(new MunitionAllowance(MunitionType.SCATTER_SHOT, 1, 0)));
        Game game = duel.game();
        game.fire(duel.alice().getId(), Coordinate.of(2, 3), MunitionType.SHOT);

        // Act
        ActionResult result = game.fire(duel.alice().getId(), Coordinate.of(3, 3), MunitionType.SCATTER_SHOT);

        // Assert
        assertThat(result.result()).isEqualTo(ShotResult.SUNK);
        assertThat(result.cells()).extracting(CellOutcome::coordinate)
                .containsExactlyInAnyOrder(Coordinate.of(3, 3), Coordinate.of(4, 3), Coordinate.of(3, 2), Coordinate.of(3, 4));
        assertThat(result.cells()).filteredOn(c -> c.result() == ShotResult.MISS).hasSize(2);
        assertThat(duel.alice().getMunitions(MunitionType.SCATTER_SHOT)).isZero();
        assertThat(duel.bob().getFleet().isDefeated()).isTrue();
    }

    @Test
    void scatterShot_shouldThrow_whenBalanceIsExhausted() {
        // Arrange
        Duel duel = duelWith(GameFixtures.keepTurnRules(), List.of(new MunitionAllowance(MunitionType.SCATTER_SHOT, 1, 0)));
        Game game = duel.game();
        game.fire(duel.alice().getId(), Coordinate.of(7, 7), MunitionType.SCATTER_SHOT);
        int historySize = game.getBoard().getShotHistory().size();

        // Act + Assert
        assertThatThrownBy(() -> game.fire(duel.alice().getId(), Coordinate.of(0, 7), MunitionType.SCATTER_SHOT))
                .isInstanceOf(ResourceExhaustedException.class);
        assertThat(game.getBoard().getShotHistory()).hasSize(historySize);
    }

    // ----------------- torpedo -----------------

    private static final class SubmarineDuel {
        final Game game;
        final HumanPlayer alice;
        final AiPlayer bob;
        final Ship aliceSub;

        SubmarineDuel(GameRules rules, TerrainGrid terrain) {
            List<ShipDefinition> fleet = List.of(ShipDefinition.submarine(1), ShipDefinition.of(ShipClass.DESTROYER));
            game = GameFixtures.newGame(GameFixtures.era(terrain, rules, fleet, List.of()));
            alice = game.addHumanPlayer("Alice", null);
            bob = game.addAiPlayer("Bob", AiStrategy.RANDOM, 1.0, null, new Random(3));
            game.beginPlacement();
            aliceSub = alice.getFleet().getShips().get(0);
            game.placeShip(alice.getId(), aliceSub.getId(), Coordinate.of(0, 0), 0, 1);
            game.placeShip(alice.getId(), alice.getFleet().getShips().get(1).getId(), Coordinate.of(1, 0), 0, 1);
            game.placeShip(bob.getId(), bob.getFleet().getShips().get(0).getId(), Coordinate.of(5, 0), 0, 1);
            game.placeShip(bob.getId(), bob.getFleet().getShips().get(1).getId(), Coordinate.of(3, 3), 0, 1);
            game.startBattle();
        }
    }

    @Test
    void torpedo_shouldConsumeTorpedoOfChosenSubmarine() {
        // Arrange
        SubmarineDuel duel = new SubmarineDuel(GameFixtures.keepTurnRules(), TerrainGrid.uniform(10, 10, TerrainType.DEEP));

        // Act
        ActionResult result = duel.game.processAction(
                GameAction.torpedo(duel.alice.getId(), Coordinate.of(3, 3), duel.aliceSub.getId()));

        // Assert
        assertThat(result.result()).isEqualTo(ShotResult.HIT);
        assertThat(duel.aliceSub.getTorpedoes()).isZero();
        assertThat(result.logEntries().get(0).message()).isEqualTo("t1-Torpedo launched from Submarine by Alice (0 left)");
    }

    @Test
    void torpedo_shouldThrow_whenSubmarineHasNoTorpedoLeft() {
        // Arrange
        SubmarineDuel duel = new SubmarineDuel(GameFixtures.keepTurnRules(), TerrainGrid.uniform(10, 10, TerrainType.DEEP));
        duel.game.processAction(GameAction.torpedo(duel.alice.getId(), Coordinate.of(8, 8), duel.aliceSub.getId()));

        // Act + Assert
        assertThatThrownBy(() -> duel.game.processAction(
                GameAction.torpedo(duel.alice.getId(), Coordinate.of(3, 3), duel.aliceSub.getId())))
                .isInstanceOf(ResourceExhaustedException.class);
        assertThat(duel.bob.getFleet().getHealth()).isEqualTo(1.0);
    }

    @Test
    void torpedo_shouldApplyConfiguredDamage_clampedAtZero() {
        // Arrange
        GameRules rules = GameFixtures.keepTurnRules().toBuilder().torpedoDamage(2.5).build();
        SubmarineDuel duel = new SubmarineDuel(rules, TerrainGrid.uniform(10, 10, TerrainType.DEEP));
        Ship destroyer = duel.bob.getFleet().getShips().get(1);

        // Act
        duel.game.processAction(GameAction.torpedo(duel.alice.getId(), Coordinate.of(3, 3), null));

        // Assert
        assertThat(destroyer.getCellHealth(0)).isZero();
        assertThat(destroyer.isSunk()).isFalse();
        assertThat(duel.alice.getHitsDamage()).isEqualTo(1.0);
    }

    @Test
    void torpedo_shouldBeRejected_onNonNavigableTerrain() {
        // Arrange
        List<String> rows = new ArrayList<>();
        for (int r = 0; r < 10; r++) {
            rows.add(r == 6 ? "DDDDDDHDDD" : "DDDDDDDDDD");
        }
        SubmarineDuel duel = new SubmarineDuel(GameFixtures.keepTurnRules(), TerrainGrid.parse(rows));

        // Act + Assert
        assertThatThrownBy(() -> duel.game.processAction(
                GameAction.torpedo(duel.alice.getId(), Coordinate.of(6, 6), duel.aliceSub.getId())))
                .isInstanceOf(GameValidationException.class);
        assertThat(duel.aliceSub.getTorpedoes()).isEqualTo(1);
    }

    @Test
    void torpedo_shouldThrow_whenAttackerHasNoSubmarine() {
        // Arrange
        Duel duel = GameFixtures.destroyerDuel(GameFixtures.keepTurnRules());

        // Act + Assert
        assertThatThrownBy(() -> duel.game().fire(duel.alice().getId(), Coordinate.of(3, 3), MunitionType.TORPEDO))
                .isInstanceOf(ResourceExhaustedException.class);
    }

    // ----------------- balances -----------------

    @Test
    void startBattle_shouldBoostBalances_perExtraOpponent() {
        // Arrange
        EraConfiguration era = GameFixtures.era(TerrainGrid.uniform(10, 10, TerrainType.DEEP), GameRules.standard(),
                GameFixtures.destroyerOnly(), List.of(new MunitionAllowance(MunitionType.STAR_SHELL, 2, 1)));
        Game game = GameFixtures.newGame(era);
        HumanPlayer alice = game.addHumanPlayer("Alice", null);
        AiPlayer bob = game.addAiPlayer("Bob", AiStrategy.RANDOM, 1.0, null, new Random(1));
        AiPlayer carol = game.addAiPlayer("Carol", AiStrategy.RANDOM, 1.0, null, new Random(2));
        game.beginPlacement();
        game.placeShip(alice.getId(), GameFixtures.firstShipId(alice), Coordinate.of(0, 0), 0, 1);

        // Act
        game.startBattle();

        // Assert
        assertThat(alice.getMunitions(MunitionType.STAR_SHELL)).isEqualTo(3);
        assertThat(bob.getMunitions(MunitionType.STAR_SHELL)).isEqualTo(2);
        assertThat(carol.getMunitions(MunitionType.STAR_SHELL)).isEqualTo(2);
    }
}
