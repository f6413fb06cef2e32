package ch.battleship.navalcombat.application.service;

import ch.battleship.navalcombat.domain.Board;
import ch.battleship.navalcombat.domain.Coordinate;
import ch.battleship.navalcombat.domain.Fleet;
import ch.battleship.navalcombat.domain.PlacementEngine;
import ch.battleship.navalcombat.domain.Ship;
import ch.battleship.navalcombat.domain.TerrainGrid;
import ch.battleship.navalcombat.domain.enums.OverlapRule;
import ch.battleship.navalcombat.domain.enums.RevealLevel;
import ch.battleship.navalcombat.domain.enums.ShipClass;
import ch.battleship.navalcombat.domain.enums.ShotResult;
import ch.battleship.navalcombat.domain.enums.SizeCategory;
import ch.battleship.navalcombat.domain.enums.TerrainType;
import ch.battleship.navalcombat.domain.exception.GameValidationException;
import ch.battleship.navalcombat.domain.exception.ResourceExhaustedException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;
import java.util.UUID;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.offset;

/**
 * Unit tests for {@link Ship} damage handling and {@link Fleet} aggregates.
 */
class ShipTest {

    private static Ship ship(int id, ShipClass shipClass, int torpedoes) {
        return new Ship(id, shipClass.getDisplayName(), shipClass, shipClass.getDefaultSize(),
                TerrainType.surfaceWater(), torpedoes);
    }

    private static List<Coordinate> row(int row, int fromCol, int size) {
        return IntStream.range(fromCol, fromCol + size)
                .mapToObj(c -> Coordinate.of(row, c))
                .toList();
    }

    @Test
    void hit_shouldReturnHitThenAlreadyHitThenSunk() {
        Ship destroyer = ship(0, ShipClass.DESTROYER, 0);
        destroyer.place(row(0, 0, 2));

        assertThat(destroyer.hit(0)).isEqualTo(ShotResult.HIT);
        assertThat(destroyer.hit(0)).isEqualTo(ShotResult.ALREADY_HIT);
        assertThat(destroyer.isSunk()).isFalse();
        assertThat(destroyer.hit(1)).isEqualTo(ShotResult.SUNK);
        assertThat(destroyer.isSunk()).isTrue();
        assertThat(destroyer.getSunkAt()).isNotNull();
    }

    @Test
    void hit_shouldClampHealthAtZero() {
        Ship cruiser = ship(0, ShipClass.CRUISER, 0);
        cruiser.place(row(0, 0, 3));

        cruiser.hit(1, 0.4);
        cruiser.hit(1, 5.0);

        assertThat(cruiser.getCellHealth(1)).isZero();
        assertThat(cruiser.getHealthRatio()).isCloseTo(2.0 / 3.0, offset(1e-9));
    }

    @Test
    void hit_shouldStaySunk_whenHitAgain() {
        Ship destroyer = ship(0, ShipClass.DESTROYER, 0);
        destroyer.place(row(0, 0, 2));
        destroyer.hit(0);
        destroyer.hit(1);

        assertThat(destroyer.hit(1)).isEqualTo(ShotResult.ALREADY_HIT);
        assertThat(destroyer.isSunk()).isTrue();
    }

    @Test
    void getRevealLevel_shouldGrowWithDestroyedFraction() {
        Ship battleship = ship(0, ShipClass.BATTLESHIP, 0);
        battleship.place(row(2, 0, 4));

        assertThat(battleship.getRevealLevel()).isEqualTo(RevealLevel.HIDDEN);
        battleship.hit(0);
        assertThat(battleship.getRevealLevel()).isEqualTo(RevealLevel.HIT);
        battleship.hit(1);
        assertThat(battleship.getRevealLevel()).isEqualTo(RevealLevel.SIZE_HINT);
        battleship.hit(2);
        assertThat(battleship.getRevealLevel()).isEqualTo(RevealLevel.CRITICAL);
        assertThat(battleship.getSizeCategory()).isEqualTo(SizeCategory.LARGE);
    }

    @Test
    void place_shouldRejectRunOfWrongLength() {
        Ship cruiser = ship(0, ShipClass.CRUISER, 0);

        assertThatThrownBy(() -> cruiser.place(row(0, 0, 2))).isInstanceOf(GameValidationException.class);
        assertThat(cruiser.isPlaced()).isFalse();
    }

    @Test
    void clear_shouldRestoreHealthAndTorpedoes_andRemoveOccupants() {
        // Arrange
        Board board = new Board(TerrainGrid.uniform(5, 5, TerrainType.DEEP));
        PlacementEngine engine = new PlacementEngine(board, OverlapRule.SAME_FLEET, 100, new Random(3));
        Fleet fleet = new Fleet(UUID.randomUUID());
        Ship submarine = ship(0, ShipClass.SUBMARINE, 2);
        fleet.addShip(submarine);
        engine.place(fleet, null, submarine, row(0, 0, 3));
        submarine.hit(0);
        submarine.useTorpedo();

        // Act
        engine.clear(fleet);

        // Assert
        assertThat(submarine.getHealthRatio()).isEqualTo(1.0);
        assertThat(submarine.getTorpedoes()).isEqualTo(2);
        assertThat(submarine.isPlaced()).isFalse();
        assertThat(submarine.getCells()).isEmpty();
        assertThat(board.occupantsAt(0, 0)).isEmpty();
        assertThat(board.occupiedCoordinates()).isEmpty();
    }

    @Test
    void useTorpedo_shouldThrow_whenSupplyIsExhausted() {
        Ship submarine = ship(0, ShipClass.SUBMARINE, 1);
        submarine.place(row(0, 0, 3));

        submarine.useTorpedo();

        assertThat(submarine.canFireTorpedo()).isFalse();
        assertThatThrownBy(submarine::useTorpedo).isInstanceOf(ResourceExhaustedException.class);
    }

    @Test
    void canFireTorpedo_shouldBeFalse_forSunkSubmarineAndOtherClasses() {
        Ship submarine = ship(0, ShipClass.SUBMARINE, 2);
        submarine.place(row(0, 0, 3));
        submarine.hit(0);
        submarine.hit(1);
        submarine.hit(2);

        assertThat(submarine.canFireTorpedo()).isFalse();
        assertThat(ship(1, ShipClass.CRUISER, 2).canFireTorpedo()).isFalse();
    }

    @Test
    void fleet_shouldTrackCompletionAndDefeat() {
        Fleet fleet = new Fleet(UUID.randomUUID());
        Ship destroyer = ship(0, ShipClass.DESTROYER, 0);
        Ship cruiser = ship(1, ShipClass.CRUISER, 0);
        fleet.addShip(destroyer);
        fleet.addShip(cruiser);

        assertThat(fleet.isComplete()).isFalse();
        assertThat(fleet.nextUnplaced()).isSameAs(destroyer);

        destroyer.place(row(0, 0, 2));
        cruiser.place(row(1, 0, 3));
        assertThat(fleet.isComplete()).isTrue();
        assertThat(fleet.nextUnplaced()).isNull();

        destroyer.hit(0);
        destroyer.hit(1);
        assertThat(fleet.isDefeated()).isFalse();
        assertThat(fleet.remainingShips()).containsExactly(cruiser);
        assertThat(fleet.getHealth()).isEqualTo(0.5);
        assertThat(fleet.getShip(1)).contains(cruiser);
        assertThat(fleet.getShip(9)).isEmpty();
    }
}
