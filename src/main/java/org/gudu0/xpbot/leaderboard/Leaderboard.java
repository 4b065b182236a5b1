package org.gudu0.xpbot.leaderboard;

import org.gudu0.xpbot.config.ProgressionConfig;
import org.gudu0.xpbot.progression.ProgressionCalculator;
import org.gudu0.xpbot.progression.UserProgress;
import org.gudu0.xpbot.state.ProgressionState;
import org.gudu0.xpbot.state.StateStore;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Composite score ranking. Read-only over the state store.
 * <p>
 * Ties keep user insertion order: the sort is stable and there is no secondary key.
 */
public class Leaderboard {
    private final StateStore store;
    private final ProgressionCalculator calc;
    private final ProgressionConfig cfg;

    public Leaderboard(StateStore store, ProgressionCalculator calc, ProgressionConfig cfg) {
        this.store = store;
        this.calc = calc;
        this.cfg = cfg;
    }

    public double score(long userId) {
        synchronized (store.lock) {
            return score(store.userOrDefault(userId));
        }
    }

    /**
     * Prestiged users keep credit for the full threshold cost of every cycle they completed.
     */
    public double score(UserProgress p) {
        double s = p.xp + p.voiceMinutes * cfg.voiceWeightFactor;
        if (p.prestige > 0) {
            s += p.prestige * (double) calc.totalXpForLevel(calc.prestigeThreshold());
        }
        return s;
    }

    /** Users with a positive score, best first. */
    public List<LeaderboardEntry> sortedLeaderboard() {
        synchronized (store.lock) {
            ProgressionState st = store.state();
            List<LeaderboardEntry> out = new ArrayList<>(st.users.size());
            for (Map.Entry<Long, UserProgress> e : st.users.entrySet()) {
                double s = score(e.getValue());
                if (s > 0) out.add(new LeaderboardEntry(e.getKey(), s));
            }
            // List.sort is a stable merge sort
            out.sort(Comparator.comparingDouble(LeaderboardEntry::score).reversed());
            return out;
        }
    }

    public List<LeaderboardEntry> top(int n) {
        List<LeaderboardEntry> all = sortedLeaderboard();
        return all.size() <= n ? all : List.copyOf(all.subList(0, Math.max(0, n)));
    }

    /**
     * The best {@code n} of the given users, by score. Users without an entry are skipped.
     */
    public List<RankedUser> topAmong(Collection<Long> userIds, int n) {
        synchronized (store.lock) {
            ProgressionState st = store.state();
            List<RankedUser> out = new ArrayList<>();
            for (Long id : userIds) {
                UserProgress p = st.users.get(id);
                if (p == null) continue;
                out.add(new RankedUser(id, score(p), p.level, p.prestige));
            }
            out.sort(Comparator.comparingDouble(RankedUser::score).reversed());
            return out.size() <= n ? out : List.copyOf(out.subList(0, Math.max(0, n)));
        }
    }

    /**
     * 1-based position. 1 when nobody is tracked yet; users not on the board rank just after it.
     */
    public int rank(long userId) {
        synchronized (store.lock) {
            if (store.state().users.isEmpty()) return 1;

            List<LeaderboardEntry> board = sortedLeaderboard();
            for (int i = 0; i < board.size(); i++) {
                if (board.get(i).userId() == userId) return i + 1;
            }
            return board.size() + 1;
        }
    }
}
