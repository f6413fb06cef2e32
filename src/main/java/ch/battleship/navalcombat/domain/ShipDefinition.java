package ch.battleship.navalcombat.domain;

import ch.battleship.navalcombat.domain.enums.ShipClass;
import ch.battleship.navalcombat.domain.enums.TerrainType;

import java.util.Set;

/**
 * Fleet entry of an era configuration.
 */
public record ShipDefinition(String name, ShipClass shipClass, int size, Set<TerrainType> allowedTerrain, int torpedoes) {

    public static ShipDefinition of(ShipClass shipClass) {
        return new ShipDefinition(shipClass.getDisplayName(), shipClass, shipClass.getDefaultSize(),
                TerrainType.surfaceWater(), 0);
    }

    public static ShipDefinition submarine(int torpedoes) {
        return new ShipDefinition(ShipClass.SUBMARINE.getDisplayName(), ShipClass.SUBMARINE,
                ShipClass.SUBMARINE.getDefaultSize(), TerrainType.surfaceWater(), torpedoes);
    }
}
