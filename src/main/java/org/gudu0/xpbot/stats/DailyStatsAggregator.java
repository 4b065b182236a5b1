package org.gudu0.xpbot.stats;

import org.gudu0.xpbot.progression.UserProgress;
import org.gudu0.xpbot.state.ProgressionState;
import org.gudu0.xpbot.state.StateStore;
import org.gudu0.xpbot.util.ConsoleLog;
import org.jetbrains.annotations.Nullable;

import java.time.LocalDate;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Per-day activity counters with rollover into {@link ProgressionState#dailyHistory}.
 * <p>
 * The stored day only moves forward. An event stamped before it (a late message, a clock step
 * back) counts toward the current day, so a frozen history entry is always a complete day.
 */
public class DailyStatsAggregator {
    private final StateStore store;

    public DailyStatsAggregator(StateStore store) {
        this.store = store;
    }

    /**
     * Freezes the stored day into history and starts {@code today}, when {@code today} is later.
     * @return true when a rollover happened
     */
    public boolean ensureCurrentDay(LocalDate today) {
        synchronized (store.lock) {
            ProgressionState st = store.state();
            DailyStats current = st.dailyStats;
            if (current.date != null && !today.isAfter(current.date)) {
                if (today.isBefore(current.date)) {
                    ConsoleLog.debug("DailyStats", "Event for " + today + " after rollover to " + current.date + "; counting it in " + current.date);
                }
                return false;
            }

            if (current.date != null) {
                DailySummary frozen = current.freeze();
                st.dailyHistory.put(current.date, frozen);
                st.previousDayDate = current.date;
                st.previousDayActiveUsers.clear();
                st.previousDayActiveUsers.addAll(current.activeUsers);
                ConsoleLog.info("DailyStats", "Rolled over " + current.date + ": messages=" + frozen.messages()
                        + " activeUsers=" + frozen.activeUsers() + " xp=" + Math.round(frozen.xpGained()));
            }

            st.dailyStats = DailyStats.forDay(today);
            store.markDirty();
            return true;
        }
    }

    /**
     * Adds to today's counters. {@code userId} is null for events without a user (member join).
     */
    public void record(@Nullable Long userId, long messages, double xp, double voiceMinutes,
                       boolean levelUp, boolean prestige, boolean newMember, LocalDate today) {
        synchronized (store.lock) {
            ensureCurrentDay(today);
            DailyStats s = store.state().dailyStats;

            s.messages += clamp(messages, "messages");
            s.xpGained += clamp(xp, "xp");
            s.voiceMinutes += clamp(voiceMinutes, "voiceMinutes");
            if (userId != null) s.activeUsers.add(userId);
            if (levelUp) s.levelUps++;
            if (prestige) s.prestiges++;
            if (newMember) s.newMembers++;

            store.markDirty();
        }
    }

    /**
     * {@code day}'s totals (live for the current day) next to the day before. Read-only: a day
     * that has not been rolled over yet is read from the live counters.
     */
    public StatsComparison comparison(LocalDate day) {
        synchronized (store.lock) {
            DailySummary current = summaryFor(day).orElse(DailySummary.EMPTY);
            DailySummary previous = summaryFor(day.minusDays(1)).orElse(null);
            return new StatsComparison(day, current, previous);
        }
    }

    /** A finished day's entry, or today's live totals. */
    public Optional<DailySummary> summaryFor(LocalDate day) {
        synchronized (store.lock) {
            ProgressionState st = store.state();
            if (day.equals(st.dailyStats.date)) return Optional.of(st.dailyStats.freeze());
            return Optional.ofNullable(st.dailyHistory.get(day));
        }
    }

    /**
     * Who was active on {@code day}: the live set for the current day, the kept set for the day
     * rolled over last, empty for anything older.
     */
    public Set<Long> activeUsersOn(LocalDate day) {
        synchronized (store.lock) {
            ProgressionState st = store.state();
            if (day.equals(st.dailyStats.date)) return new LinkedHashSet<>(st.dailyStats.activeUsers);
            if (day.equals(st.previousDayDate)) return new LinkedHashSet<>(st.previousDayActiveUsers);
            return Set.of();
        }
    }

    public ServerTotals serverTotals() {
        synchronized (store.lock) {
            ProgressionState st = store.state();
            double xp = 0;
            double voice = 0;
            long prestiges = 0;
            for (UserProgress p : st.users.values()) {
                xp += p.xp;
                voice += p.voiceMinutes;
                prestiges += p.prestige;
            }
            return new ServerTotals(st.totalServerMessages, xp, voice, prestiges);
        }
    }

    private static long clamp(long v, String what) {
        if (v >= 0) return v;
        ConsoleLog.warn("DailyStats", "Ignoring negative " + what + "=" + v);
        return 0;
    }

    private static double clamp(double v, String what) {
        if (v >= 0) return v;
        ConsoleLog.warn("DailyStats", "Ignoring invalid " + what + "=" + v);
        return 0;
    }
}
