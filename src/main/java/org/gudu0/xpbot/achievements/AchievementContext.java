package org.gudu0.xpbot.achievements;

import org.gudu0.xpbot.progression.UserProgress;

/**
 * Immutable view of one user's metrics at the moment a trigger fires.
 *
 * @param rank leaderboard position, or 0 when not computed for this trigger
 */
public record AchievementContext(long userId, ProgressSnapshot stats, int rank) {

    public record ProgressSnapshot(double xp, int level, int prestige, long messages,
                                   double voiceMinutes, int dailyStreak) {

        public static ProgressSnapshot of(UserProgress p) {
            return new ProgressSnapshot(p.xp, p.level, p.prestige, p.messageCount, p.voiceMinutes, p.dailyStreak);
        }
    }

    public static AchievementContext of(long userId, UserProgress p, int rank) {
        return new AchievementContext(userId, ProgressSnapshot.of(p), rank);
    }
}
