package ch.battleship.navalcombat.domain.enums;

public enum GameEventType
{
    PLAYER_JOINED,
    PLACEMENT_STARTED,
    SHIP_PLACED,
    FLEET_PLACED,
    GAME_STARTED,
    ACTION_RESOLVED,
    TURN_CHANGED,
    TARGET_REQUESTED,
    TARGET_TIMEOUT,
    GAME_FINISHED,
    GAME_RESET
}
