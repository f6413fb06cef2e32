package ch.battleship.navalcombat.web.api.dto;

import ch.battleship.navalcombat.domain.Player;
import ch.battleship.navalcombat.domain.enums.MunitionType;
import ch.battleship.navalcombat.domain.enums.PlayerType;

import java.util.UUID;

/**
 * Public view of a player. Fleet positions are not included.
 */
public record PlayerDto(
        UUID playerId,
        String name,
        PlayerType type,
        String allianceId,
        int shipsRemaining,
        double fleetHealth,
        int starShells,
        int scatterShots,
        boolean eliminated
) {
    public static PlayerDto from(Player player) {
        return new PlayerDto(
                player.getId(),
                player.getName(),
                player.getType(),
                player.getAllianceId(),
                player.getFleet().remainingShips().size(),
                player.getFleet().getHealth(),
                player.getMunitions(MunitionType.STAR_SHELL),
                player.getMunitions(MunitionType.SCATTER_SHOT),
                player.isEliminated()
        );
    }
}
