package org.gudu0.xpbot.progression;

/**
 * Outcome of one {@code addXp} call. {@code prestiged} and {@code leveledUp} are never both true.
 */
public record AddXpResult(boolean leveledUp, int newLevel, boolean prestiged) {

    public static AddXpResult unchanged(int level) {
        return new AddXpResult(false, level, false);
    }
}
