package org.gudu0.xpbot.config;

/**
 * XP, level and leaderboard tuning. Nested under "progression" in config.json.
 */
public class ProgressionConfig {
    // --- XP ---
    public double baseMessageXp = 2;
    public double bonusXpChance = 0.15;
    public int bonusXpMin = 1;
    public int bonusXpMax = 5;
    public double voiceXpPerMinute = 0.3;
    public double dailyBonusMultiplier = 1.5;
    public int streakBonusDays = 7;
    public double streakBonusMultiplier = 2.0;

    /** Minimum seconds between two messages that earn XP for the same user. */
    public int antispamCooldownSeconds = 5;

    // --- Levels ---
    public double baseXpRequirement = 15;
    public double xpMultiplier = 1.4;
    public int prestigeThreshold = 50;

    // --- Leaderboard ---
    public double voiceWeightFactor = 10;

    public void validate() {
        if (baseXpRequirement < 1) throw new IllegalStateException("baseXpRequirement must be >= 1");
        if (xpMultiplier < 1.0) throw new IllegalStateException("xpMultiplier must be >= 1.0");
        if (prestigeThreshold < 1) throw new IllegalStateException("prestigeThreshold must be >= 1");
        if (bonusXpChance < 0 || bonusXpChance > 1) throw new IllegalStateException("bonusXpChance must be within [0, 1]");
        if (bonusXpMin < 0 || bonusXpMax < bonusXpMin) throw new IllegalStateException("bonus XP range is invalid: " + bonusXpMin + ".." + bonusXpMax);
        // rollBonus draws from an int-sized range
        if ((long) bonusXpMax - bonusXpMin + 1 > Integer.MAX_VALUE) throw new IllegalStateException("bonus XP range is too wide: " + bonusXpMin + ".." + bonusXpMax);
        if (baseMessageXp < 0 || voiceXpPerMinute < 0 || voiceWeightFactor < 0) throw new IllegalStateException("XP rates must be >= 0");
        if (dailyBonusMultiplier < 1.0 || streakBonusMultiplier < 1.0) throw new IllegalStateException("bonus multipliers must be >= 1.0");
        if (antispamCooldownSeconds < 0) throw new IllegalStateException("antispamCooldownSeconds must be >= 0");
    }
}
