package ch.battleship.navalcombat.domain;

import java.util.List;

/**
 * Alliance entry of an era configuration: its name, the fleet every member receives and an
 * optional placement zone.
 */
public record AllianceDefinition(String name, List<ShipDefinition> fleet, PlacementZone placementZone) {

    public AllianceDefinition {
        fleet = List.copyOf(fleet);
    }

    public AllianceDefinition(String name, List<ShipDefinition> fleet) {
        this(name, fleet, null);
    }
}
