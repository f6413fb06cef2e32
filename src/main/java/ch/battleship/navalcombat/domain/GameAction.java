package ch.battleship.navalcombat.domain;

import ch.battleship.navalcombat.domain.enums.ActionType;
import ch.battleship.navalcombat.domain.enums.MunitionType;

import java.util.UUID;

/**
 * A discrete action submitted to {@link Game#processAction(GameAction)}.
 *
 * @param type action kind
 * @param playerId acting player
 * @param target fire target or placement start cell
 * @param munition munition for FIRE, {@code null} means a plain shot
 * @param shipId ship to place (PLACE_SHIP) or submarine to launch from (TORPEDO), optional
 * @param rowDelta drag delta in rows (PLACE_SHIP)
 * @param colDelta drag delta in columns (PLACE_SHIP)
 */
public record GameAction(
        ActionType type,
        UUID playerId,
        Coordinate target,
        MunitionType munition,
        Integer shipId,
        int rowDelta,
        int colDelta
) {

    public static GameAction fire(UUID playerId, Coordinate target) {
        return fire(playerId, target, MunitionType.SHOT);
    }

    public static GameAction fire(UUID playerId, Coordinate target, MunitionType munition) {
        return new GameAction(ActionType.FIRE, playerId, target, munition, null, 0, 0);
    }

    public static GameAction torpedo(UUID playerId, Coordinate target, Integer submarineId) {
        return new GameAction(ActionType.FIRE, playerId, target, MunitionType.TORPEDO, submarineId, 0, 0);
    }

    public static GameAction placeShip(UUID playerId, int shipId, Coordinate start, int rowDelta, int colDelta) {
        return new GameAction(ActionType.PLACE_SHIP, playerId, start, null, shipId, rowDelta, colDelta);
    }

    public static GameAction autoPlace(UUID playerId) {
        return new GameAction(ActionType.AUTO_PLACE, playerId, null, null, null, 0, 0);
    }

    public MunitionType munitionOrShot() {
        return munition == null ? MunitionType.SHOT : munition;
    }
}
