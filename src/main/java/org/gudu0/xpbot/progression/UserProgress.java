package org.gudu0.xpbot.progression;

import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashSet;
import java.util.Set;

public class UserProgress {
    // since last prestige
    public double xp = 0;
    // always levelFromXp(xp)
    public int level = 0;
    public int prestige = 0;

    public long messageCount = 0;
    public double voiceMinutes = 0;

    // consecutive calendar days with an XP-earning message
    public int dailyStreak = 0;
    public LocalDate lastDailyDate;

    // not persisted; only gates the anti-spam cooldown
    public Instant lastMessageAt;

    public final Set<String> achievements = new LinkedHashSet<>();

    public boolean hasAchievement(String id) {
        return achievements.contains(id);
    }

    /** @return true when the achievement was not held before */
    public boolean unlock(String id) {
        return achievements.add(id);
    }
}
