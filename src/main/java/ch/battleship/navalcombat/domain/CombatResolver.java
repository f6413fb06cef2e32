package ch.battleship.navalcombat.domain;

import ch.battleship.navalcombat.domain.enums.MunitionType;
import ch.battleship.navalcombat.domain.enums.PlayerType;
import ch.battleship.navalcombat.domain.enums.ShotResult;
import ch.battleship.navalcombat.domain.exception.GameValidationException;
import ch.battleship.navalcombat.domain.exception.ResourceExhaustedException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Resolves FIRE actions against the shared board.
 *
 * <p>All checks (target, footprint, munition balance) run before the first mutation, so a
 * rejected attack leaves board, ships and players untouched.
 */
@Slf4j
class CombatResolver {

    static final int HIT_POINTS = 1;
    static final int SUNK_POINTS = 10;

    private final Game game;

    CombatResolver(Game game) {
        this.game = game;
    }

    record Resolution(List<CellOutcome> cells, List<String> messages) {
    }

    Resolution resolve(Player attacker, Coordinate target, MunitionType munition, Integer submarineId, int turn) {
        Objects.requireNonNull(target, "target must not be null");
        Board board = game.getBoard();

        return switch (munition) {
            case SHOT -> {
                requireShootable(attacker, target);
                yield attack(attacker, List.of(target), munition, 1.0, turn, new ArrayList<>());
            }
            case SCATTER_SHOT -> {
                requireShootable(attacker, target);
                List<Coordinate> footprint = new ArrayList<>();
                footprint.add(target);
                for (Coordinate n : target.orthogonalNeighbours()) {
                    if (attacker.canShootAt(board, n.getRow(), n.getCol())) {
                        footprint.add(n);
                    }
                }
                attacker.consumeMunition(munition);
                yield attack(attacker, footprint, munition, 1.0, turn, new ArrayList<>());
            }
            case TORPEDO -> {
                requireShootable(attacker, target);
                if (!board.terrainAt(target.getRow(), target.getCol()).isNavigableWater()) {
                    throw new GameValidationException("Torpedoes need deep or shallow water at " + target.toCellName());
                }
                Ship submarine = findSubmarine(attacker, submarineId);
                submarine.useTorpedo();
                List<String> messages = new ArrayList<>();
                messages.add(String.format("t%d-Torpedo launched from %s by %s (%d left)",
                        turn, submarine.getName(), attacker.getName(), submarine.getTorpedoes()));
                yield attack(attacker, List.of(target), munition, game.getRules().torpedoDamage(), turn, messages);
            }
            case STAR_SHELL -> {
                if (!board.isValidAttackTarget(target.getRow(), target.getCol())) {
                    throw new GameValidationException("Invalid target " + target + ": outside the board or excluded");
                }
                attacker.consumeMunition(munition);
                yield illuminate(attacker, target, turn);
            }
        };
    }

    private void requireShootable(Player attacker, Coordinate target) {
        Board board = game.getBoard();
        if (!board.isValidAttackTarget(target.getRow(), target.getCol())) {
            throw new GameValidationException("Invalid target " + target + ": outside the board or excluded");
        }
        if (!attacker.canShootAt(board, target.getRow(), target.getCol())) {
            throw new GameValidationException(attacker.getName() + " may not target " + target.toCellName() + " again");
        }
    }

    private Ship findSubmarine(Player attacker, Integer submarineId) {
        if (submarineId != null) {
            Ship ship = attacker.getFleet().getShip(submarineId)
                    .orElseThrow(() -> new GameValidationException("Ship " + submarineId + " does not belong to " + attacker.getName()));
            if (!ship.canFireTorpedo()) {
                throw new ResourceExhaustedException(ship.getName() + " cannot fire a torpedo");
            }
            return ship;
        }
        return attacker.getFleet().getShips().stream()
                .filter(Ship::canFireTorpedo)
                .findFirst()
                .orElseThrow(() -> new ResourceExhaustedException(attacker.getName() + " has no submarine with torpedoes"));
    }

    private Resolution attack(Player attacker, List<Coordinate> footprint, MunitionType munition,
                              double damage, int turn, List<String> messages) {
        List<CellOutcome> outcomes = new ArrayList<>();
        for (Coordinate cell : footprint) {
            outcomes.add(attackCell(attacker, cell, munition, damage, turn, messages));
        }
        return new Resolution(outcomes, messages);
    }

    private CellOutcome attackCell(Player attacker, Coordinate cell, MunitionType munition,
                                   double damage, int turn, List<String> messages) {
        Board board = game.getBoard();
        String cellName = cell.toCellName();
        List<Occupant> enemies = enemyOccupants(attacker, cell);

        if (enemies.isEmpty()) {
            attacker.markUnshootable(cell);
            attacker.recordShotOutcome(ShotResult.MISS, 0.0, 0);
            board.recordShot(cell, attacker.getId(), munition, ShotResult.MISS);
            messages.add(String.format("t%d-Miss at %s by %s", turn, cellName, attacker.getName()));
            return CellOutcome.miss(cell);
        }

        List<Occupant> live = enemies.stream()
                .filter(o -> !game.shipById(o.shipId()).isCellDestroyed(o.cellIndex()))
                .toList();

        if (live.isEmpty()) {
            attacker.recordShotOutcome(ShotResult.ALREADY_HIT, 0.0, 0);
            board.recordShot(cell, attacker.getId(), munition, ShotResult.ALREADY_HIT);
            messages.add(String.format("t%d-Already destroyed at %s by %s", turn, cellName, attacker.getName()));
            return new CellOutcome(cell, ShotResult.ALREADY_HIT, true, List.of(), List.of());
        }

        List<Integer> damaged = new ArrayList<>();
        List<Integer> sunk = new ArrayList<>();
        double dealt = 0.0;

        for (Occupant occupant : live) {
            Ship ship = game.shipById(occupant.shipId());
            Player owner = game.ownerOfShip(occupant.shipId());
            double before = ship.getCellHealth(occupant.cellIndex());
            ShotResult shipResult = ship.hit(occupant.cellIndex(), damage);
            dealt += before - ship.getCellHealth(occupant.cellIndex());
            damaged.add(ship.getId());

            if (shipResult == ShotResult.SUNK) {
                sunk.add(ship.getId());
                attacker.recordSinking(points(SUNK_POINTS, attacker, owner));
                ship.getCells().forEach(attacker::markUnshootable);
                messages.add(String.format("t%d-SUNK: %s (%s) at %s by %s",
                        turn, ship.getName(), owner.getName(), cellName, attacker.getName()));
                log.debug("{} sunk {}'s {} at {}", attacker.getName(), owner.getName(), ship.getName(), cellName);
            } else {
                messages.add(String.format("t%d-HIT: %s (%s) at %s by %s [%s]",
                        turn, describe(ship), owner.getName(), cellName, attacker.getName(),
                        ship.getRevealLevel().name().toLowerCase(Locale.ROOT).replace('_', '-')));
            }
        }

        Player firstOwner = game.ownerOfShip(live.get(0).shipId());
        ShotResult result = sunk.isEmpty() ? ShotResult.HIT : ShotResult.SUNK;
        attacker.recordShotOutcome(result, dealt, points(HIT_POINTS, attacker, firstOwner));
        board.recordShot(cell, attacker.getId(), munition, result);
        return new CellOutcome(cell, result, true, damaged, sunk);
    }

    /**
     * Progressive fog of war: the ship is named only once it is critically damaged.
     */
    private static String describe(Ship ship) {
        return switch (ship.getRevealLevel()) {
            case CRITICAL -> ship.getName();
            case SIZE_HINT -> ship.getSizeCategory().name().toLowerCase(Locale.ROOT) + " ship";
            default -> "unknown ship";
        };
    }

    private Resolution illuminate(Player attacker, Coordinate center, int turn) {
        Board board = game.getBoard();
        int radius = game.getRules().starShellSize() / 2;
        List<CellOutcome> outcomes = new ArrayList<>();
        int contacts = 0;

        for (int dr = -radius; dr <= radius; dr++) {
            for (int dc = -radius; dc <= radius; dc++) {
                Coordinate cell = center.offset(dr, dc);
                if (!board.isValidAttackTarget(cell.getRow(), cell.getCol())) {
                    continue;
                }
                boolean occupied = enemyOccupants(attacker, cell).stream()
                        .anyMatch(o -> !game.shipById(o.shipId()).isCellDestroyed(o.cellIndex()));
                if (occupied) {
                    contacts++;
                }
                outcomes.add(CellOutcome.revealed(cell, occupied));
            }
        }

        String message = String.format("t%d-Star Shell over %s by %s: %d contact(s)",
                turn, center.toCellName(), attacker.getName(), contacts);
        return new Resolution(outcomes, List.of(message));
    }

    private List<Occupant> enemyOccupants(Player attacker, Coordinate cell) {
        return game.getBoard().occupantsAt(cell.getRow(), cell.getCol()).stream()
                .filter(o -> !Objects.equals(game.ownerOfShip(o.shipId()).getAllianceId(), attacker.getAllianceId()))
                .toList();
    }

    /**
     * Humans attacking an AI earn points scaled by the AI's difficulty.
     */
    static int points(int base, Player attacker, Player defender) {
        double multiplier = 1.0;
        if (attacker.getType() == PlayerType.HUMAN && defender instanceof AiPlayer ai) {
            multiplier = ai.getDifficulty();
        }
        return (int) Math.round(base * multiplier);
    }
}
