package org.gudu0.xpbot.achievements;

import org.gudu0.xpbot.logging.LogService;
import org.gudu0.xpbot.progression.UserProgress;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AchievementsServiceTest {

    @Mock
    private LogService logs;

    private AchievementsService achievements;

    @BeforeEach
    void setUp() {
        achievements = new AchievementsService(logs);
    }

    private static List<String> ids(List<AchievementDef> defs) {
        return defs.stream().map(d -> d.id).toList();
    }

    @Test
    void catalogHasUniqueIds() {
        List<String> ids = ids(achievements.defs());
        assertEquals(ids.size(), Set.copyOf(ids).size());
        assertTrue(ids.containsAll(List.of("first_message", "100_xp", "1000_xp", "level_10", "level_25",
                "first_prestige", "10_day_streak", "voice_hour", "top_3")));
    }

    @Test
    void newlyUnlockedMatchesThresholdsAndSkipsHeld() {
        UserProgress p = new UserProgress();
        p.xp = 150;
        p.level = 10;

        AchievementContext ctx = AchievementContext.of(1L, p, 0);

        assertEquals(List.of("100_xp", "level_10"),
                ids(achievements.newlyUnlocked(AchievementTrigger.XP_AWARD, ctx, Set.of())));
        assertEquals(List.of("level_10"),
                ids(achievements.newlyUnlocked(AchievementTrigger.XP_AWARD, ctx, Set.of("100_xp"))));
    }

    @Test
    void evaluateIsIdempotent() {
        UserProgress p = new UserProgress();
        p.xp = 1200;
        p.voiceMinutes = 60;
        p.dailyStreak = 10;

        List<AchievementDef> first = achievements.evaluate(AchievementTrigger.XP_AWARD, 1L, p, 0);
        assertEquals(List.of("100_xp", "1000_xp", "10_day_streak", "voice_hour"), ids(first));

        List<AchievementDef> second = achievements.evaluate(AchievementTrigger.XP_AWARD, 1L, p, 0);
        assertTrue(second.isEmpty());
        assertEquals(4, p.achievements.size());
        verify(logs, times(4)).log(contains("Achievement unlocked"));
    }

    @Test
    void podiumNeedsAComputedRankInTopThree() {
        UserProgress p = new UserProgress();
        p.messageCount = 1;

        assertFalse(ids(achievements.evaluate(AchievementTrigger.MESSAGE, 1L, p, 0)).contains("top_3"));
        assertFalse(ids(achievements.evaluate(AchievementTrigger.MESSAGE, 1L, p, 4)).contains("top_3"));
        assertTrue(ids(achievements.evaluate(AchievementTrigger.MESSAGE, 1L, p, 3)).contains("top_3"));
        assertTrue(p.hasAchievement("first_message"));
    }

    @Test
    void messageTriggerDoesNotEvaluateXpRules() {
        UserProgress p = new UserProgress();
        p.xp = 5000;

        achievements.evaluate(AchievementTrigger.MESSAGE, 1L, p, 0);
        assertFalse(p.hasAchievement("100_xp"));
    }

    @Test
    void unlockByIdOnlyOnceAndOnlyKnownIds() {
        UserProgress p = new UserProgress();

        assertTrue(achievements.unlockById(1L, p, AchievementsCatalog.FIRST_PRESTIGE));
        assertFalse(achievements.unlockById(1L, p, AchievementsCatalog.FIRST_PRESTIGE));
        assertFalse(achievements.unlockById(1L, p, "no_such_achievement"));

        assertEquals(Set.of(AchievementsCatalog.FIRST_PRESTIGE), p.achievements);
        verify(logs, times(1)).log(anyString());
    }
}
