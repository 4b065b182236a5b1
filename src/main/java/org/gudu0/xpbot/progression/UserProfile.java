package org.gudu0.xpbot.progression;

import java.util.List;

/**
 * Point-in-time copy of one user's progress, safe to read outside the store lock.
 */
public record UserProfile(long userId,
                          double xp,
                          int level,
                          int prestige,
                          long messages,
                          double voiceMinutes,
                          int dailyStreak,
                          int rank,
                          double score,
                          LevelProgress progress,
                          List<String> achievements) {}
