package ch.battleship.navalcombat.domain;

import ch.battleship.navalcombat.domain.enums.MunitionType;
import ch.battleship.navalcombat.domain.enums.ShipClass;
import ch.battleship.navalcombat.domain.enums.TerrainType;

import java.util.List;

/**
 * Everything a match needs from its era: terrain, alliances with their fleets, rules and
 * munition allowances.
 *
 * <p>Alliance order matters: the first alliance is the default home of humans, the first
 * alliance with a different name is the default opponent.
 */
public record EraConfiguration(
        String id,
        String name,
        TerrainGrid terrain,
        List<AllianceDefinition> alliances,
        GameRules rules,
        List<MunitionAllowance> munitions
) {

    public EraConfiguration {
        if (alliances == null || alliances.size() < 2) {
            throw new IllegalArgumentException("An era needs at least two alliances");
        }
        alliances = List.copyOf(alliances);
        munitions = munitions == null ? List.of() : List.copyOf(munitions);
    }

    public EraConfiguration withRules(GameRules newRules) {
        return new EraConfiguration(id, name, terrain, alliances, newRules, munitions);
    }

    /**
     * Returns the classic configuration: 10x10 open sea, five ships per side, two alliances.
     */
    public static EraConfiguration traditional() {
        List<ShipDefinition> fleet = List.of(
                ShipDefinition.of(ShipClass.CARRIER),
                ShipDefinition.of(ShipClass.BATTLESHIP),
                ShipDefinition.of(ShipClass.CRUISER),
                ShipDefinition.submarine(2),
                ShipDefinition.of(ShipClass.DESTROYER)
        );
        return new EraConfiguration(
                "traditional",
                "Traditional Battleship",
                TerrainGrid.uniform(10, 10, TerrainType.DEEP),
                List.of(new AllianceDefinition("Blue Fleet", fleet), new AllianceDefinition("Red Fleet", fleet)),
                GameRules.standard(),
                List.of(
                        new MunitionAllowance(MunitionType.STAR_SHELL, 2, 1),
                        new MunitionAllowance(MunitionType.SCATTER_SHOT, 1, 1)
                )
        );
    }
}
