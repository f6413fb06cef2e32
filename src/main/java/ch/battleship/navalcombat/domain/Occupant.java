package ch.battleship.navalcombat.domain;

/**
 * Entry of the board's occupant index: which ship (by arena index) covers a cell and at which
 * position of its placement run.
 *
 * @param shipId stable ship index inside the owning game
 * @param cellIndex index into the ship's cell run and health array
 */
public record Occupant(int shipId, int cellIndex) {
}
