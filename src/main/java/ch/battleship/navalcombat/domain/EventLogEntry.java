package ch.battleship.navalcombat.domain;

import java.time.Instant;

/**
 * Line of the battle log.
 *
 * @param turn turn number the entry belongs to
 * @param message human-readable message, e.g. {@code t3-Miss at C4 by Alice}
 * @param timestamp creation time
 */
public record EventLogEntry(int turn, String message, Instant timestamp) {

    public static EventLogEntry of(int turn, String message) {
        return new EventLogEntry(turn, message, Instant.now());
    }
}
