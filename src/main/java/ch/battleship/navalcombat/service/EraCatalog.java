package ch.battleship.navalcombat.service;

import ch.battleship.navalcombat.domain.AllianceDefinition;
import ch.battleship.navalcombat.domain.EraConfiguration;
import ch.battleship.navalcombat.domain.GameRules;
import ch.battleship.navalcombat.domain.MunitionAllowance;
import ch.battleship.navalcombat.domain.PlacementZone;
import ch.battleship.navalcombat.domain.ShipDefinition;
import ch.battleship.navalcombat.domain.TerrainGrid;
import ch.battleship.navalcombat.domain.enums.MunitionType;
import ch.battleship.navalcombat.domain.enums.OverlapRule;
import ch.battleship.navalcombat.domain.enums.ShipClass;
import ch.battleship.navalcombat.domain.enums.TerrainType;
import ch.battleship.navalcombat.domain.exception.GameValidationException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Built-in era configurations, looked up by id.
 *
 * <p>Eras: {@code traditional} (open sea, two fleets), {@code coastal} (terrain-restricted
 * ships and placement zones) and {@code pirates} (one navy against several pirate captains).
 */
@Component
public class EraCatalog {

    public static final String DEFAULT_ERA = "traditional";

    private final Map<String, EraConfiguration> eras = new LinkedHashMap<>();

    public EraCatalog(@Value("${naval.placement.max-attempts:100}") int placementAttempts) {
        register(EraConfiguration.traditional(), placementAttempts);
        register(coastal(), placementAttempts);
        register(pirates(), placementAttempts);
    }

    private void register(EraConfiguration era, int placementAttempts) {
        GameRules rules = era.rules().toBuilder().placementAttempts(placementAttempts).build();
        eras.put(era.id(), era.withRules(rules));
    }

    public Optional<EraConfiguration> find(String eraId) {
        return Optional.ofNullable(eras.get(eraId));
    }

    /**
     * @throws GameValidationException if the era is unknown
     */
    public EraConfiguration get(String eraId) {
        return find(eraId).orElseThrow(() -> new GameValidationException("Unknown era: " + eraId));
    }

    public Collection<EraConfiguration> all() {
        return List.copyOf(eras.values());
    }

    static EraConfiguration coastal() {
        TerrainGrid terrain = TerrainGrid.parse(List.of(
                "XXDDDDDDDDXX",
                "XDDDDDDDDDDX",
                "DDDDDDDDDDDD",
                "DDDDRRDDDDDD",
                "DDDDDDDDDDDD",
                "DDDDDDDDSSSS",
                "DDDDDDDSSHHH",
                "SSSSDDSSHHML",
                "SSHHSSSHHMLL",
                "SHHMMHHMMLLL",
                "HHMMLLMMLLLL",
                "XLLLLLLLLLLX"
        ));
        EnumSet<TerrainType> coastalWater = EnumSet.of(TerrainType.SHALLOW, TerrainType.SHOAL, TerrainType.MARSH);
        EnumSet<TerrainType> deepOnly = EnumSet.of(TerrainType.DEEP);

        List<ShipDefinition> coastGuard = List.of(
                new ShipDefinition("Frigate", ShipClass.FRIGATE, 3, TerrainType.surfaceWater(), 0),
                ShipDefinition.of(ShipClass.DESTROYER),
                new ShipDefinition("PT Boat Alpha", ShipClass.PT_BOAT, 2, coastalWater, 0),
                new ShipDefinition("PT Boat Bravo", ShipClass.PT_BOAT, 2, coastalWater, 0)
        );
        List<ShipDefinition> raiders = List.of(
                new ShipDefinition("Cruiser", ShipClass.CRUISER, 3, deepOnly, 0),
                new ShipDefinition("Submarine", ShipClass.SUBMARINE, 3, deepOnly, 3),
                ShipDefinition.of(ShipClass.DESTROYER)
        );

        GameRules rules = GameRules.standard().toBuilder()
                .turnOnHit(true)
                .starShellSize(5)
                .build();

        return new EraConfiguration(
                "coastal",
                "Coastal Patrol",
                terrain,
                List.of(
                        new AllianceDefinition("Coast Guard", coastGuard, new PlacementZone(5, 11, 0, 11)),
                        new AllianceDefinition("Raiders", raiders, new PlacementZone(0, 4, 0, 11))
                ),
                rules,
                List.of(
                        new MunitionAllowance(MunitionType.STAR_SHELL, 2, 0),
                        new MunitionAllowance(MunitionType.SCATTER_SHOT, 1, 0)
                )
        );
    }

    static EraConfiguration pirates() {
        TerrainGrid terrain = TerrainGrid.parse(List.of(
                "DDDDDDDDDDDDDD",
                "DDDDDDDDDDDDDD",
                "DDDRRDDDDDDDDD",
                "DDDRDDDDDDSSDD",
                "DDDDDDDDDSLLSD",
                "DDDDDDDDDSLLSD",
                "DDDDDDDDDDSSDD",
                "DDDDDDDDDDDDDD",
                "DDSSDDDDDDDDDD",
                "DSLLSDDDDDRDDD",
                "DDSSDDDDDDRRDD",
                "DDDDDDDDDDDDDD",
                "DDDDDDDDDDDDDD",
                "DDDDDDDDDDDDDD"
        ));
        List<ShipDefinition> navy = List.of(
                ShipDefinition.of(ShipClass.BATTLESHIP),
                new ShipDefinition("Frigate", ShipClass.FRIGATE, 3, TerrainType.surfaceWater(), 0),
                ShipDefinition.submarine(2),
                ShipDefinition.of(ShipClass.DESTROYER)
        );
        List<ShipDefinition> pirates = List.of(
                new ShipDefinition("Galleon", ShipClass.GALLEON, 4, TerrainType.surfaceWater(), 0),
                new ShipDefinition("Sloop", ShipClass.SLOOP, 2, TerrainType.surfaceWater(), 0)
        );

        GameRules rules = GameRules.standard().toBuilder()
                .chooseAlliance(true)
                .overlapRule(OverlapRule.SAME_FLEET)
                .build();

        return new EraConfiguration(
                "pirates",
                "Pirates of the Gulf",
                terrain,
                List.of(
                        new AllianceDefinition("Navy", navy),
                        new AllianceDefinition("Pirates", pirates)
                ),
                rules,
                List.of(
                        new MunitionAllowance(MunitionType.STAR_SHELL, 1, 1),
                        new MunitionAllowance(MunitionType.SCATTER_SHOT, 1, 1)
                )
        );
    }
}
