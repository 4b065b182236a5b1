package org.gudu0.xpbot.stats;

import java.time.LocalDate;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Live counters for the current calendar day. Only ever grows until the next rollover.
 */
public class DailyStats {
    // null until the first day has started
    public LocalDate date;

    public long messages = 0;
    public double xpGained = 0;
    public double voiceMinutes = 0;
    public final Set<Long> activeUsers = new LinkedHashSet<>();
    public int levelUps = 0;
    public int prestiges = 0;
    public int newMembers = 0;

    public static DailyStats forDay(LocalDate date) {
        DailyStats s = new DailyStats();
        s.date = date;
        return s;
    }

    public DailySummary freeze() {
        return new DailySummary(messages, xpGained, voiceMinutes, activeUsers.size(), levelUps, prestiges, newMembers);
    }
}
