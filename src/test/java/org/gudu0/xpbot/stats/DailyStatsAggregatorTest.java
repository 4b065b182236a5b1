package org.gudu0.xpbot.stats;

import org.gudu0.xpbot.config.ProgressionConfig;
import org.gudu0.xpbot.progression.ProgressionCalculator;
import org.gudu0.xpbot.progression.UserProgress;
import org.gudu0.xpbot.state.StateStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.LocalDate;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DailyStatsAggregatorTest {

    private static final LocalDate MON = LocalDate.of(2026, 3, 2);
    private static final LocalDate TUE = MON.plusDays(1);
    private static final LocalDate WED = TUE.plusDays(1);

    @TempDir
    Path dir;

    private StateStore store;
    private DailyStatsAggregator daily;

    @BeforeEach
    void setUp() {
        store = new StateStore(dir.resolve("progress.json"), new ProgressionCalculator(new ProgressionConfig()));
        daily = new DailyStatsAggregator(store);
    }

    @Test
    void firstDayStartsWithoutHistory() {
        assertTrue(daily.ensureCurrentDay(MON));
        assertFalse(daily.ensureCurrentDay(MON));

        synchronized (store.lock) {
            assertEquals(MON, store.state().dailyStats.date);
            assertTrue(store.state().dailyHistory.isEmpty());
        }
    }

    @Test
    void recordAddsUpAndTracksDistinctUsers() {
        daily.record(1L, 1, 3.0, 0, false, false, false, MON);
        daily.record(1L, 1, 2.0, 0, true, false, false, MON);
        daily.record(2L, 0, 1.5, 5, false, true, false, MON);
        daily.record(null, 0, 0, 0, false, false, true, MON);

        DailySummary s = daily.summaryFor(MON).orElseThrow();
        assertEquals(2, s.messages());
        assertEquals(6.5, s.xpGained(), 1e-9);
        assertEquals(5.0, s.voiceMinutes(), 1e-9);
        assertEquals(2, s.activeUsers());
        assertEquals(1, s.levelUps());
        assertEquals(1, s.prestiges());
        assertEquals(1, s.newMembers());
    }

    @Test
    void negativeInputsAreClamped() {
        daily.record(1L, -4, -2.0, Double.NaN, false, false, false, MON);

        DailySummary s = daily.summaryFor(MON).orElseThrow();
        assertEquals(0, s.messages());
        assertEquals(0.0, s.xpGained());
        assertEquals(0.0, s.voiceMinutes());
    }

    @Test
    void rolloverFreezesPreviousDayOnce() {
        daily.record(1L, 3, 9.0, 0, false, false, false, MON);

        assertTrue(daily.ensureCurrentDay(TUE));
        assertFalse(daily.ensureCurrentDay(TUE));

        synchronized (store.lock) {
            assertEquals(1, store.state().dailyHistory.size());
            DailySummary frozen = store.state().dailyHistory.get(MON);
            assertEquals(3, frozen.messages());
            assertEquals(1, frozen.activeUsers());
            assertEquals(0, store.state().dailyStats.messages);
        }
    }

    @Test
    void lateEventCountsTowardTheCurrentDay() {
        daily.record(1L, 3, 0, 0, false, false, false, MON);
        daily.record(2L, 5, 0, 0, false, false, false, TUE);

        // stamped MON but arriving after the rollover
        assertFalse(daily.ensureCurrentDay(MON));
        daily.record(3L, 1, 0, 0, false, false, false, MON);
        daily.record(2L, 2, 0, 0, false, false, false, TUE);

        assertTrue(daily.ensureCurrentDay(WED));

        synchronized (store.lock) {
            assertEquals(3, store.state().dailyHistory.get(MON).messages());
            DailySummary tue = store.state().dailyHistory.get(TUE);
            assertEquals(8, tue.messages());
            assertEquals(2, tue.activeUsers());
            assertEquals(WED, store.state().dailyStats.date);
        }
    }

    @Test
    void rolledOverDayKeepsItsActiveUsers() {
        daily.record(1L, 1, 0, 0, false, false, false, MON);
        daily.record(2L, 1, 0, 0, false, false, false, MON);
        daily.record(3L, 1, 0, 0, false, false, false, TUE);

        assertEquals(Set.of(1L, 2L), daily.activeUsersOn(MON));
        assertEquals(Set.of(3L), daily.activeUsersOn(TUE));

        daily.ensureCurrentDay(WED);
        assertEquals(Set.of(3L), daily.activeUsersOn(TUE));
        assertTrue(daily.activeUsersOn(MON).isEmpty());
    }

    @Test
    void comparisonWithoutPreviousDay() {
        daily.record(1L, 2, 4.0, 0, false, false, false, TUE);

        StatsComparison cmp = daily.comparison(TUE);
        assertFalse(cmp.hasPrevious());
        assertEquals(2, cmp.current().messages());
        assertEquals(0, cmp.messagesDelta());
    }

    @Test
    void comparisonAgainstFrozenPreviousDay() {
        daily.record(1L, 5, 10.0, 0, false, false, false, MON);
        daily.record(2L, 5, 10.0, 0, false, false, false, MON);
        daily.record(1L, 2, 4.0, 0, false, false, false, TUE);

        StatsComparison cmp = daily.comparison(TUE);
        assertTrue(cmp.hasPrevious());
        assertEquals(-8, cmp.messagesDelta());
        assertEquals(-1, cmp.activeUsersDelta());
        assertEquals(-16.0, cmp.xpDelta(), 1e-9);
    }

    @Test
    void comparisonForAnUnknownDayIsEmpty() {
        StatsComparison cmp = daily.comparison(MON);
        assertEquals(DailySummary.EMPTY, cmp.current());
        assertFalse(cmp.hasPrevious());
    }

    @Test
    void serverTotalsSumAllUsers() {
        synchronized (store.lock) {
            UserProgress a = store.user(1L);
            a.xp = 10;
            a.voiceMinutes = 4;
            UserProgress b = store.user(2L);
            b.xp = 5;
            b.prestige = 2;
            store.state().totalServerMessages = 99;
        }

        ServerTotals t = daily.serverTotals();
        assertEquals(99, t.totalMessages());
        assertEquals(15.0, t.totalXp(), 1e-9);
        assertEquals(4.0, t.totalVoiceMinutes(), 1e-9);
        assertEquals(2, t.totalPrestiges());
    }
}
