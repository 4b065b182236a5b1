package org.gudu0.xpbot.progression;

import org.gudu0.xpbot.config.ProgressionConfig;
import org.gudu0.xpbot.leaderboard.Leaderboard;
import org.gudu0.xpbot.state.StateStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProfileServiceTest {

    @TempDir
    Path dir;

    private StateStore store;
    private ProfileService profiles;

    @BeforeEach
    void setUp() {
        ProgressionConfig cfg = new ProgressionConfig();
        ProgressionCalculator calc = new ProgressionCalculator(cfg);
        store = new StateStore(dir.resolve("progress.json"), calc);
        profiles = new ProfileService(store, calc, new Leaderboard(store, calc, cfg));
    }

    @Test
    void unknownUserReadsAsZeroesWithoutBeingCreated() {
        UserProfile p = profiles.profile(42L);

        assertEquals(0.0, p.xp());
        assertEquals(0, p.level());
        assertEquals(0, p.prestige());
        assertEquals(0, p.messages());
        assertEquals(1, p.rank());
        assertTrue(p.achievements().isEmpty());
        assertEquals(15, p.progress().requirementForNext());

        synchronized (store.lock) {
            assertTrue(store.state().users.isEmpty());
        }
    }

    @Test
    void profileCopiesCurrentProgress() {
        synchronized (store.lock) {
            UserProgress u = store.user(7L);
            u.xp = 20;
            u.level = 1;
            u.messageCount = 9;
            u.voiceMinutes = 3;
            u.unlock("first_message");
        }

        UserProfile p = profiles.profile(7L);

        assertEquals(1, p.level());
        assertEquals(9, p.messages());
        assertEquals(5.0, p.progress().progress(), 1e-9);
        // 20 xp + 3 min * 10
        assertEquals(50.0, p.score(), 1e-9);
        assertEquals(1, p.rank());
        assertEquals(List.of("first_message"), p.achievements());
    }
}
