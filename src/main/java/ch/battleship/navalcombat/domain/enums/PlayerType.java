package ch.battleship.navalcombat.domain.enums;

public enum PlayerType {
    HUMAN,
    AI
}
