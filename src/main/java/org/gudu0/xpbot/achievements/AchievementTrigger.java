package org.gudu0.xpbot.achievements;

public enum AchievementTrigger {
    /** An XP-earning message was processed (message count and rank are current). */
    MESSAGE,
    /** XP was added to the user, evaluated before a prestige reset. */
    XP_AWARD
}
