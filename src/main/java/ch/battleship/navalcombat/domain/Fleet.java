package ch.battleship.navalcombat.domain;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Ordered collection of ships belonging to one player.
 */
public class Fleet {

    @Getter
    private final UUID ownerId;

    private final List<Ship> ships = new ArrayList<>();

    public Fleet(UUID ownerId) {
        this.ownerId = ownerId;
    }

    public void addShip(Ship ship) {
        ships.add(ship);
    }

    public List<Ship> getShips() {
        return Collections.unmodifiableList(ships);
    }

    public Optional<Ship> getShip(int shipId) {
        return ships.stream().filter(s -> s.getId() == shipId).findFirst();
    }

    /**
     * @return first ship that is not placed yet, or {@code null} when all are placed
     */
    public Ship nextUnplaced() {
        return ships.stream().filter(s -> !s.isPlaced()).findFirst().orElse(null);
    }

    /**
     * A fleet is complete when it has at least one ship and every ship is placed.
     */
    public boolean isComplete() {
        return !ships.isEmpty() && ships.stream().allMatch(Ship::isPlaced);
    }

    /**
     * A fleet is defeated when it is empty or every ship is sunk.
     */
    public boolean isDefeated() {
        return ships.stream().allMatch(Ship::isSunk);
    }

    /**
     * @return mean health ratio over all ships, 0 for an empty fleet
     */
    public double getHealth() {
        return ships.stream().mapToDouble(Ship::getHealthRatio).average().orElse(0.0);
    }

    public List<Ship> remainingShips() {
        return ships.stream().filter(s -> !s.isSunk()).toList();
    }

    void reset() {
        ships.forEach(Ship::reset);
    }
}
