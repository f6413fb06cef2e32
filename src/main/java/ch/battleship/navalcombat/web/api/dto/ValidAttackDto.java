package ch.battleship.navalcombat.web.api.dto;

import java.util.UUID;

public record ValidAttackDto(
        UUID playerId,
        int row,
        int col,
        boolean valid
) {}
