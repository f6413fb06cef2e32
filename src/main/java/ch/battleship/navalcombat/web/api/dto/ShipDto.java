package ch.battleship.navalcombat.web.api.dto;

import ch.battleship.navalcombat.domain.Coordinate;
import ch.battleship.navalcombat.domain.Ship;
import ch.battleship.navalcombat.domain.enums.ShipClass;

import java.util.List;

public record ShipDto(
        int shipId,
        String name,
        ShipClass shipClass,
        int size,
        boolean placed,
        boolean sunk,
        double health,
        int torpedoes,
        List<String> cells
) {
    public static ShipDto from(Ship ship) {
        return new ShipDto(
                ship.getId(),
                ship.getName(),
                ship.getShipClass(),
                ship.getSize(),
                ship.isPlaced(),
                ship.isSunk(),
                ship.getHealthRatio(),
                ship.getTorpedoes(),
                ship.getCells().stream().map(Coordinate::toCellName).toList()
        );
    }
}
