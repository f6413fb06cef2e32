package ch.battleship.navalcombat.web.api.dto;

import ch.battleship.navalcombat.domain.CellOutcome;
import ch.battleship.navalcombat.domain.enums.ShotResult;

public record CellDto(
        int row,
        int col,
        String cell,
        ShotResult result,
        boolean occupied,
        boolean shipSunk
) {
    public static CellDto from(CellOutcome outcome) {
        return new CellDto(
                outcome.coordinate().getRow(),
                outcome.coordinate().getCol(),
                outcome.coordinate().toCellName(),
                outcome.result(),
                outcome.occupied(),
                !outcome.sunkShipIds().isEmpty()
        );
    }
}
