package org.gudu0.xpbot.stats;

import net.dv8tion.jda.api.events.session.ReadyEvent;
import net.dv8tion.jda.api.hooks.ListenerAdapter;
import org.gudu0.xpbot.config.GlobalConfig;
import org.gudu0.xpbot.leaderboard.Leaderboard;
import org.gudu0.xpbot.notifications.ProgressNotifier;
import org.gudu0.xpbot.state.ProgressionState;
import org.gudu0.xpbot.state.StateStore;
import org.gudu0.xpbot.util.ConsoleLog;
import org.jetbrains.annotations.NotNull;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Posts the previous day's stats once per calendar day.
 * <p>
 * Runs on a fixed interval and acts on the first check at or after {@code statsReportHour}, so a
 * late or missed tick only delays the report. {@code lastReportDate} keeps it to one per day,
 * across restarts too.
 */
public class DailyStatsReporter extends ListenerAdapter {

    private final GlobalConfig cfg;
    private final StateStore store;
    private final DailyStatsAggregator daily;
    private final Leaderboard leaderboard;
    private final ProgressNotifier notifier;
    private final ZoneId zone;

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "daily-stats-report");
        t.setDaemon(true);
        return t;
    });

    private volatile boolean started = false;

    public DailyStatsReporter(GlobalConfig cfg, StateStore store, DailyStatsAggregator daily,
                              Leaderboard leaderboard, ProgressNotifier notifier) {
        this.cfg = cfg;
        this.store = store;
        this.daily = daily;
        this.leaderboard = leaderboard;
        this.notifier = notifier;
        this.zone = cfg.zone();
    }

    @Override
    public void onReady(@NotNull ReadyEvent event) {
        // onReady fires again after a full reconnect
        if (started) return;
        started = true;

        scheduler.scheduleAtFixedRate(this::checkSafe, 5, cfg.statsCheckSeconds, TimeUnit.SECONDS);
        Runtime.getRuntime().addShutdownHook(new Thread(scheduler::shutdown));
        ConsoleLog.info("DailyStatsReport", "Scheduled every " + cfg.statsCheckSeconds + "s, report hour=" + cfg.statsReportHour + " zone=" + zone);
    }

    private void checkSafe() {
        try {
            checkAndReport(Instant.now());
        } catch (Exception e) {
            ConsoleLog.error("DailyStatsReport", "Daily check failed: " + e.getMessage(), e);
        }
    }

    /**
     * Rolls the day over if needed and, when due, hands yesterday's summary to the notifier.
     * @return true when a report was sent
     */
    public boolean checkAndReport(Instant now) {
        ZonedDateTime local = now.atZone(zone);
        LocalDate today = local.toLocalDate();

        DailyReport report;
        synchronized (store.lock) {
            daily.ensureCurrentDay(today);

            ProgressionState st = store.state();
            if (today.equals(st.lastReportDate)) return false;
            if (local.getHour() < cfg.statsReportHour) return false;

            LocalDate reportDay = today.minusDays(1);
            st.lastReportDate = today;
            store.markDirty();

            if (daily.summaryFor(reportDay).isEmpty()) {
                ConsoleLog.info("DailyStatsReport", "No stats recorded for " + reportDay + "; nothing to report");
                return false;
            }

            report = new DailyReport(daily.comparison(reportDay),
                    leaderboard.topAmong(daily.activeUsersOn(reportDay), cfg.statsTopCount),
                    daily.serverTotals());
        }

        try {
            notifier.reportDailyStats(report);
        } catch (RuntimeException e) {
            ConsoleLog.error("DailyStatsReport", "Notifier failed for " + report.comparison().date() + ": " + e.getMessage(), e);
        }
        ConsoleLog.info("DailyStatsReport", "Reported " + report.comparison().date()
                + " messages=" + report.comparison().current().messages());

        saveSafely();
        return true;
    }

    private void saveSafely() {
        try {
            store.save();
        } catch (Exception e) {
            ConsoleLog.error("DailyStatsReport", "Failed to save after report: " + e.getMessage(), e);
        }
    }
}
