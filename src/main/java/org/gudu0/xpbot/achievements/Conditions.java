package org.gudu0.xpbot.achievements;

public final class Conditions {
    private Conditions() {}

    public static Condition userStatAtLeast(StatKey key, double value) {
        return new UserStatAtLeast(key, value);
    }

    /** Matches only when a rank was computed for the trigger. */
    public static Condition rankAtMost(int rank) {
        return ctx -> ctx.rank() > 0 && ctx.rank() <= rank;
    }

    static double valueOf(StatKey key, AchievementContext ctx) {
        AchievementContext.ProgressSnapshot s = ctx.stats();
        return switch (key) {
            case XP -> s.xp();
            case LEVEL -> s.level();
            case PRESTIGE -> s.prestige();
            case MESSAGES -> s.messages();
            case VOICE_MINUTES -> s.voiceMinutes();
            case DAILY_STREAK -> s.dailyStreak();
        };
    }

    private record UserStatAtLeast(StatKey key, double value) implements Condition {
        @Override public boolean matches(AchievementContext ctx) {
            return valueOf(key, ctx) >= value;
        }
    }
}
