package org.gudu0.xpbot.stats;

import org.jetbrains.annotations.Nullable;

import java.time.LocalDate;

/**
 * One day's totals next to the day before it. {@code previous} is null when that day was never
 * recorded (bot offline), which only means "no comparison available".
 */
public record StatsComparison(LocalDate date, DailySummary current, @Nullable DailySummary previous) {

    public boolean hasPrevious() {
        return previous != null;
    }

    public long messagesDelta() {
        return previous == null ? 0 : current.messages() - previous.messages();
    }

    public int activeUsersDelta() {
        return previous == null ? 0 : current.activeUsers() - previous.activeUsers();
    }

    public double xpDelta() {
        return previous == null ? 0 : current.xpGained() - previous.xpGained();
    }

    public double voiceMinutesDelta() {
        return previous == null ? 0 : current.voiceMinutes() - previous.voiceMinutes();
    }
}
