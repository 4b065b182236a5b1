package org.gudu0.xpbot.achievements;

public enum StatKey {
    XP,
    LEVEL,
    PRESTIGE,
    MESSAGES,
    VOICE_MINUTES,
    DAILY_STREAK
}
