package ch.battleship.navalcombat.domain.enums;

/**
 * Closed set of discrete actions the turn engine accepts.
 */
public enum ActionType {
    PLACE_SHIP,
    AUTO_PLACE,
    FIRE
}
