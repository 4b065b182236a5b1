package org.gudu0.xpbot.progression;

import org.gudu0.xpbot.config.ProgressionConfig;

/**
 * XP/level curve.
 * <p>
 * Requirements are precomputed once for levels {@code 0..prestigeThreshold}. The cumulative table
 * ({@link #totalXpForLevel(int)}) is the only definition of "XP needed through level N";
 * {@link #levelFromXp(double)} searches that same table, so the two always agree.
 */
public final class ProgressionCalculator {

    private final int prestigeThreshold;

    // index = level
    private final long[] requirement;
    private final long[] cumulative;

    public ProgressionCalculator(ProgressionConfig cfg) {
        this.prestigeThreshold = cfg.prestigeThreshold;
        this.requirement = new long[prestigeThreshold + 1];
        this.cumulative = new long[prestigeThreshold + 1];

        for (int level = 1; level <= prestigeThreshold; level++) {
            double raw = Math.floor(cfg.baseXpRequirement * Math.pow(cfg.xpMultiplier, level - 1));
            if (raw >= Long.MAX_VALUE) {
                throw new IllegalStateException("Level curve overflows at level " + level
                        + " (base=" + cfg.baseXpRequirement + " multiplier=" + cfg.xpMultiplier + ")");
            }
            requirement[level] = (long) raw;
            try {
                cumulative[level] = Math.addExact(cumulative[level - 1], requirement[level]);
            } catch (ArithmeticException e) {
                throw new IllegalStateException("Cumulative XP overflows at level " + level, e);
            }
        }
    }

    public int prestigeThreshold() {
        return prestigeThreshold;
    }

    /** XP needed to go from {@code level - 1} to {@code level}; 0 for level 0 and past the prestige threshold. */
    public long levelRequirement(int level) {
        if (level <= 0 || level > prestigeThreshold) return 0;
        return requirement[level];
    }

    /** Sum of {@link #levelRequirement(int)} for 1..level. Clamped to the table bounds. */
    public long totalXpForLevel(int level) {
        if (level <= 0) return 0;
        return cumulative[Math.min(level, prestigeThreshold)];
    }

    /** Largest level in [0, prestigeThreshold] whose cumulative requirement is {@code <= xp}. */
    public int levelFromXp(double xp) {
        if (Double.isNaN(xp) || xp < cumulative[1]) return 0;

        int left = 0;
        int right = prestigeThreshold;
        while (left < right) {
            int mid = (left + right + 1) >>> 1;
            if (cumulative[mid] <= xp) {
                left = mid;
            } else {
                right = mid - 1;
            }
        }
        return left;
    }

    /**
     * Progress bar data. {@code requirementForNext == 0} means there is no next level.
     */
    public LevelProgress progressInLevel(double xp, int level) {
        double progress = xp - totalXpForLevel(level);
        long next = levelRequirement(level + 1);
        return new LevelProgress(level, progress, next);
    }
}
