package org.gudu0.xpbot.state;

import org.gudu0.xpbot.progression.UserProgress;
import org.gudu0.xpbot.stats.DailyStats;
import org.gudu0.xpbot.stats.DailySummary;

import java.time.Instant;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Everything the engine mutates. Owned by {@link StateStore}; touch only while holding its lock.
 */
public class ProgressionState {
    public static final String DEFAULT_EVENTS_MESSAGE = "No upcoming events.";

    // userId -> progress, insertion order = leaderboard tie order
    public final Map<Long, UserProgress> users = new LinkedHashMap<>();

    // userId -> voice join time; transient
    public final Map<Long, Instant> voiceSessions = new HashMap<>();

    public String eventsMessage = DEFAULT_EVENTS_MESSAGE;
    public long totalServerMessages = 0;

    public DailyStats dailyStats = new DailyStats();
    public final Map<LocalDate, DailySummary> dailyHistory = new TreeMap<>();

    // active users of the day rolled over last, kept for its report
    public LocalDate previousDayDate;
    public final Set<Long> previousDayActiveUsers = new LinkedHashSet<>();

    // last calendar day the periodic report ran for
    public LocalDate lastReportDate;

    /** Creates an entry if missing. Use for mutation. */
    public UserProgress getOrCreate(long userId) {
        return users.computeIfAbsent(userId, k -> new UserProgress());
    }

    /** Existing entry, or a zeroed one that is not stored. */
    public UserProgress getOrDefault(long userId) {
        UserProgress p = users.get(userId);
        return p != null ? p : new UserProgress();
    }
}
