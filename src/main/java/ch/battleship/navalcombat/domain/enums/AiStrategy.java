package ch.battleship.navalcombat.domain.enums;

/**
 * Base search pattern of an AI player.
 */
public enum AiStrategy {
    /**
     * Uniformly random among all remaining targets.
     */
    RANDOM,
    /**
     * Every other cell first (checkerboard), then the rest.
     */
    CHECKERBOARD,
    /**
     * Every fourth cell first to find large ships, then checkerboard, then the rest.
     */
    METHODICAL,
    /**
     * One quadrant at a time, methodical pattern inside the quadrant.
     */
    QUARTERING,
    /**
     * Best-scored cells first: near the centre and next to open hits.
     */
    AGGRESSIVE
}
