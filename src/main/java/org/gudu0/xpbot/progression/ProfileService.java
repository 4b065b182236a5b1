package org.gudu0.xpbot.progression;

import org.gudu0.xpbot.leaderboard.Leaderboard;
import org.gudu0.xpbot.state.StateStore;

import java.util.List;

public class ProfileService {
    private final StateStore store;
    private final ProgressionCalculator calc;
    private final Leaderboard leaderboard;

    public ProfileService(StateStore store, ProgressionCalculator calc, Leaderboard leaderboard) {
        this.store = store;
        this.calc = calc;
        this.leaderboard = leaderboard;
    }

    /** Never creates an entry: unknown users come back zeroed. */
    public UserProfile profile(long userId) {
        synchronized (store.lock) {
            UserProgress p = store.userOrDefault(userId);
            return new UserProfile(
                    userId,
                    p.xp,
                    p.level,
                    p.prestige,
                    p.messageCount,
                    p.voiceMinutes,
                    p.dailyStreak,
                    leaderboard.rank(userId),
                    leaderboard.score(p),
                    calc.progressInLevel(p.xp, p.level),
                    List.copyOf(p.achievements)
            );
        }
    }
}
