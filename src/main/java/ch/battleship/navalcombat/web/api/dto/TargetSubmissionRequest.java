package ch.battleship.navalcombat.web.api.dto;

import java.util.UUID;

/**
 * Answers a pending target request of a human player.
 */
public record TargetSubmissionRequest(
        UUID playerId,
        int row,
        int col
) {}
