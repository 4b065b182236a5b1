package org.gudu0.xpbot.leaderboard;

import org.gudu0.xpbot.config.ProgressionConfig;
import org.gudu0.xpbot.progression.ProgressionCalculator;
import org.gudu0.xpbot.progression.UserProgress;
import org.gudu0.xpbot.state.StateStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LeaderboardTest {

    @TempDir
    Path dir;

    private ProgressionCalculator calc;
    private StateStore store;
    private Leaderboard leaderboard;

    @BeforeEach
    void setUp() {
        ProgressionConfig cfg = new ProgressionConfig();
        calc = new ProgressionCalculator(cfg);
        store = new StateStore(dir.resolve("progress.json"), calc);
        leaderboard = new Leaderboard(store, calc, cfg);
    }

    private void put(long userId, double xp, double voiceMinutes, int prestige) {
        synchronized (store.lock) {
            UserProgress p = store.user(userId);
            p.xp = xp;
            p.level = calc.levelFromXp(xp);
            p.voiceMinutes = voiceMinutes;
            p.prestige = prestige;
        }
    }

    @Test
    void scoreWeighsVoiceAndPrestige() {
        put(1, 100, 5, 0);
        put(2, 10, 0, 2);

        assertEquals(150.0, leaderboard.score(1), 1e-9);
        assertEquals(10 + 2.0 * calc.totalXpForLevel(calc.prestigeThreshold()), leaderboard.score(2), 1e-9);
        assertEquals(0.0, leaderboard.score(999));
    }

    @Test
    void sortsDescendingAndKeepsInsertionOrderOnTies() {
        put(10, 50, 0, 0);
        put(20, 80, 0, 0);
        put(30, 50, 0, 0);
        put(40, 0, 5, 0);
        put(50, 0, 0, 0);

        List<LeaderboardEntry> board = leaderboard.sortedLeaderboard();

        assertEquals(List.of(20L, 10L, 30L, 40L), board.stream().map(LeaderboardEntry::userId).toList());
    }

    @Test
    void rankIsConsistentWithBoard() {
        put(10, 5, 0, 0);
        put(20, 500, 0, 0);
        put(30, 50, 1, 0);
        put(40, 0, 0, 1);

        List<LeaderboardEntry> board = leaderboard.sortedLeaderboard();
        for (LeaderboardEntry e : board) {
            int r = leaderboard.rank(e.userId());
            assertEquals(e.userId(), board.get(r - 1).userId());
        }
        assertEquals(1, leaderboard.rank(40));
    }

    @Test
    void emptyBoardRanksEveryoneFirst() {
        assertEquals(1, leaderboard.rank(123));
    }

    @Test
    void unrankedUserComesAfterTheBoard() {
        put(1, 10, 0, 0);
        put(2, 0, 0, 0);

        assertEquals(2, leaderboard.rank(2));
        assertEquals(2, leaderboard.rank(999));
    }

    @Test
    void topLimitsTheBoard() {
        for (int i = 1; i <= 5; i++) put(i, i * 10, 0, 0);

        assertEquals(List.of(5L, 4L), leaderboard.top(2).stream().map(LeaderboardEntry::userId).toList());
        assertEquals(5, leaderboard.top(50).size());
    }

    @Test
    void topAmongRanksOnlyTheGivenUsers() {
        put(1, 100, 0, 0);
        put(2, 300, 0, 0);
        put(3, 200, 0, 0);

        List<RankedUser> top = leaderboard.topAmong(List.of(1L, 3L, 404L), 5);

        assertEquals(2, top.size());
        assertEquals(3L, top.get(0).userId());
        assertEquals(calc.levelFromXp(200), top.get(0).level());
        assertEquals(1L, top.get(1).userId());
        assertEquals(1, leaderboard.topAmong(List.of(1L, 2L, 3L), 1).size());
    }
}
