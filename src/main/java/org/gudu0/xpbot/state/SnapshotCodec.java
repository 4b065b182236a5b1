package org.gudu0.xpbot.state;

import org.gudu0.xpbot.progression.ProgressionCalculator;
import org.gudu0.xpbot.progression.UserProgress;
import org.gudu0.xpbot.stats.DailyStats;
import org.gudu0.xpbot.stats.DailySummary;
import org.gudu0.xpbot.util.ConsoleLog;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Map;
import java.util.function.BiConsumer;

/**
 * Converts between the in-memory {@link ProgressionState} and the on-disk {@link BotSnapshot}.
 * Decoding is lenient: bad keys and values are skipped (logged) instead of failing the whole load.
 */
public final class SnapshotCodec {
    private SnapshotCodec() {}

    public static BotSnapshot encode(ProgressionState st) {
        BotSnapshot snap = new BotSnapshot();

        for (Map.Entry<Long, UserProgress> e : st.users.entrySet()) {
            String key = Long.toString(e.getKey());
            UserProgress p = e.getValue();

            snap.userXp.put(key, p.xp);
            snap.userLevel.put(key, p.level);
            snap.userPrestige.put(key, p.prestige);
            snap.userDailyStreak.put(key, p.dailyStreak);
            if (p.lastDailyDate != null) snap.userLastDaily.put(key, p.lastDailyDate.toString());
            snap.userMessageCount.put(key, p.messageCount);
            snap.userVoiceTime.put(key, p.voiceMinutes);
            if (!p.achievements.isEmpty()) snap.userAchievements.put(key, new ArrayList<>(p.achievements));
        }

        snap.eventsMessage = st.eventsMessage;
        snap.totalServerMessages = st.totalServerMessages;

        DailyStats ds = st.dailyStats;
        BotSnapshot.DailyStatsSnapshot dss = new BotSnapshot.DailyStatsSnapshot();
        dss.date = ds.date == null ? "" : ds.date.toString();
        dss.messages = ds.messages;
        dss.xpGained = ds.xpGained;
        dss.voiceTime = ds.voiceMinutes;
        dss.activeUsers = new ArrayList<>(ds.activeUsers);
        dss.levelUps = ds.levelUps;
        dss.prestiges = ds.prestiges;
        dss.newMembers = ds.newMembers;
        snap.dailyStats = dss;

        for (Map.Entry<LocalDate, DailySummary> e : st.dailyHistory.entrySet()) {
            snap.dailyHistory.put(e.getKey().toString(), e.getValue());
        }

        snap.previousDay = st.previousDayDate == null ? "" : st.previousDayDate.toString();
        snap.previousDayActiveUsers = new ArrayList<>(st.previousDayActiveUsers);

        snap.lastReportDate = st.lastReportDate == null ? "" : st.lastReportDate.toString();
        return snap;
    }

    public static ProgressionState decode(BotSnapshot snap, ProgressionCalculator calc) {
        ProgressionState st = new ProgressionState();

        // user_xp first: its order is the leaderboard tie order
        eachUser(snap.userXp, "user_xp", (id, v) -> st.getOrCreate(id).xp = nonNegative(v, "user_xp", id));
        eachUser(snap.userPrestige, "user_prestige", (id, v) -> st.getOrCreate(id).prestige = (int) nonNegative(v, "user_prestige", id));
        eachUser(snap.userDailyStreak, "user_daily_streak", (id, v) -> st.getOrCreate(id).dailyStreak = (int) nonNegative(v, "user_daily_streak", id));
        eachUser(snap.userLastDaily, "user_last_daily", (id, v) -> st.getOrCreate(id).lastDailyDate = parseDate(v, "user_last_daily[" + id + "]"));
        eachUser(snap.userMessageCount, "user_message_count", (id, v) -> st.getOrCreate(id).messageCount = (long) nonNegative(v, "user_message_count", id));
        eachUser(snap.userVoiceTime, "user_voice_time", (id, v) -> st.getOrCreate(id).voiceMinutes = nonNegative(v, "user_voice_time", id));
        eachUser(snap.userAchievements, "user_achievements", (id, v) -> {
            UserProgress p = st.getOrCreate(id);
            for (String a : v) {
                if (a != null && !a.isBlank()) p.achievements.add(a);
            }
        });

        // level is derived; the stored value is only checked
        for (Map.Entry<Long, UserProgress> e : st.users.entrySet()) {
            UserProgress p = e.getValue();
            p.level = calc.levelFromXp(p.xp);
            Integer stored = snap.userLevel == null ? null : snap.userLevel.get(Long.toString(e.getKey()));
            if (stored != null && stored != p.level) {
                ConsoleLog.warn("SnapshotCodec", "userId=" + e.getKey() + " stored level=" + stored
                        + " does not match xp=" + p.xp + "; using level=" + p.level);
            }
        }

        if (snap.eventsMessage != null) st.eventsMessage = snap.eventsMessage;
        st.totalServerMessages = Math.max(0, snap.totalServerMessages);

        if (snap.dailyStats != null) {
            BotSnapshot.DailyStatsSnapshot dss = snap.dailyStats;
            DailyStats ds = new DailyStats();
            ds.date = parseDate(dss.date, "daily_stats.date");
            ds.messages = Math.max(0, dss.messages);
            ds.xpGained = Math.max(0, dss.xpGained);
            ds.voiceMinutes = Math.max(0, dss.voiceTime);
            if (dss.activeUsers != null) {
                for (Long id : dss.activeUsers) {
                    if (id != null) ds.activeUsers.add(id);
                }
            }
            ds.levelUps = Math.max(0, dss.levelUps);
            ds.prestiges = Math.max(0, dss.prestiges);
            ds.newMembers = Math.max(0, dss.newMembers);
            st.dailyStats = ds;
        }

        if (snap.dailyHistory != null) {
            for (Map.Entry<String, DailySummary> e : snap.dailyHistory.entrySet()) {
                LocalDate day = parseDate(e.getKey(), "daily_history key");
                if (day == null || e.getValue() == null) continue;
                st.dailyHistory.put(day, e.getValue());
            }
        }

        st.previousDayDate = parseDate(snap.previousDay, "previous_day");
        if (st.previousDayDate != null && snap.previousDayActiveUsers != null) {
            for (Long id : snap.previousDayActiveUsers) {
                if (id != null) st.previousDayActiveUsers.add(id);
            }
        }

        st.lastReportDate = parseDate(snap.lastReportDate, "last_report_date");
        return st;
    }

    private static <V> void eachUser(Map<String, V> map, String field, BiConsumer<Long, V> apply) {
        if (map == null) return;
        for (Map.Entry<String, V> e : map.entrySet()) {
            if (e.getValue() == null) continue;
            long id;
            try {
                id = Long.parseLong(e.getKey().trim());
            } catch (NumberFormatException ex) {
                ConsoleLog.warn("SnapshotCodec", "Skipping non-numeric user key in " + field + ": " + e.getKey());
                continue;
            }
            apply.accept(id, e.getValue());
        }
    }

    private static double nonNegative(Number v, String field, long userId) {
        double d = v.doubleValue();
        if (Double.isNaN(d) || d < 0) {
            ConsoleLog.warn("SnapshotCodec", "Clamping invalid " + field + "=" + v + " for userId=" + userId + " to 0");
            return 0;
        }
        return d;
    }

    private static LocalDate parseDate(String s, String what) {
        if (s == null || s.isBlank()) return null;
        try {
            return LocalDate.parse(s.trim());
        } catch (DateTimeParseException e) {
            ConsoleLog.warn("SnapshotCodec", "Ignoring unparseable date in " + what + ": " + s);
            return null;
        }
    }
}
