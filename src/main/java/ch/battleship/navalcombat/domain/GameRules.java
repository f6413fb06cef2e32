package ch.battleship.navalcombat.domain;

import ch.battleship.navalcombat.domain.enums.OverlapRule;
import lombok.Builder;

/**
 * Game-mode rule set of a match.
 *
 * @param turnOnHit the attacker keeps the turn after a hit
 * @param turnOnMiss the attacker keeps the turn after a miss
 * @param simultaneousFire every active player may fire at any time; the turn pointer stays put
 * @param chooseAlliance humans pick their alliance when joining
 * @param overlapRule which existing placements a new run may not overlap
 * @param starShellSize edge length of the star shell pattern (3 or 5)
 * @param torpedoDamage damage of a torpedo hit per cell
 * @param placementAttempts random tries per ship during automated placement
 */
@Builder(toBuilder = true)
public record GameRules(
        boolean turnOnHit,
        boolean turnOnMiss,
        boolean simultaneousFire,
        boolean chooseAlliance,
        OverlapRule overlapRule,
        int starShellSize,
        double torpedoDamage,
        int placementAttempts
) {

    public static final int DEFAULT_PLACEMENT_ATTEMPTS = 100;

    public GameRules {
        if (starShellSize != 3 && starShellSize != 5) {
            throw new IllegalArgumentException("Star shell pattern must be 3x3 or 5x5");
        }
        if (placementAttempts < 1) {
            throw new IllegalArgumentException("Placement attempts must be positive");
        }
        if (overlapRule == null) {
            overlapRule = OverlapRule.SAME_FLEET;
        }
    }

    /**
     * Classic alternating turns, 3x3 star shell, no overlap inside a fleet.
     */
    public static GameRules standard() {
        return GameRules.builder()
                .overlapRule(OverlapRule.SAME_FLEET)
                .starShellSize(3)
                .torpedoDamage(1.0)
                .placementAttempts(DEFAULT_PLACEMENT_ATTEMPTS)
                .build();
    }
}
