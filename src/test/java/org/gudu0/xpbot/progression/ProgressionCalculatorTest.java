package org.gudu0.xpbot.progression;

import org.gudu0.xpbot.config.ProgressionConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ProgressionCalculatorTest {

    private ProgressionCalculator calc;

    @BeforeEach
    void setUp() {
        calc = new ProgressionCalculator(new ProgressionConfig());
    }

    @Test
    void levelRequirementFollowsFlooredCurve() {
        assertEquals(0, calc.levelRequirement(0));
        assertEquals(15, calc.levelRequirement(1));
        assertEquals(21, calc.levelRequirement(2));
        // 15 * 1.4^2 = 29.4
        assertEquals(29, calc.levelRequirement(3));
    }

    @Test
    void totalXpIsSumOfRequirements() {
        assertEquals(0, calc.totalXpForLevel(0));
        assertEquals(15 + 21 + 29, calc.totalXpForLevel(3));

        long sum = 0;
        for (int level = 1; level <= calc.prestigeThreshold(); level++) {
            sum += calc.levelRequirement(level);
            assertEquals(sum, calc.totalXpForLevel(level), "level " + level);
        }
    }

    @Test
    void levelFromXpAgreesWithTotalsAtEveryBoundary() {
        for (int level = 0; level <= calc.prestigeThreshold(); level++) {
            long total = calc.totalXpForLevel(level);
            assertEquals(level, calc.levelFromXp(total), "exact total for level " + level);
            if (level > 0) {
                assertEquals(level - 1, calc.levelFromXp(total - 0.5), "just below level " + level);
                assertEquals(level - 1, calc.levelFromXp(Math.nextDown((double) total)), "one ulp below level " + level);
            }
        }
    }

    @Test
    void levelFromXpIsBoundedByPrestigeThreshold() {
        assertEquals(calc.prestigeThreshold(), calc.levelFromXp(Double.MAX_VALUE));
        assertEquals(calc.prestigeThreshold(), calc.levelFromXp(Double.POSITIVE_INFINITY));
        assertEquals(0, calc.levelFromXp(-10));
        assertEquals(0, calc.levelFromXp(Double.NaN));
    }

    @Test
    void noNextLevelPastThreshold() {
        int t = calc.prestigeThreshold();
        assertEquals(0, calc.levelRequirement(t + 1));

        LevelProgress atTop = calc.progressInLevel(calc.totalXpForLevel(t), t);
        assertFalse(atTop.hasNextLevel());
        assertEquals(1.0, atTop.ratio());
    }

    @Test
    void progressInLevelMeasuresFromLevelStart() {
        // level 1 starts at 15, level 2 needs 21 more
        LevelProgress p = calc.progressInLevel(25, 1);
        assertEquals(10.0, p.progress(), 1e-9);
        assertEquals(21, p.requirementForNext());
        assertTrue(p.hasNextLevel());
        assertEquals(10.0 / 21.0, p.ratio(), 1e-9);
    }

    @Test
    void customCurveIsRespected() {
        ProgressionConfig cfg = new ProgressionConfig();
        cfg.baseXpRequirement = 10;
        cfg.xpMultiplier = 1.0;
        cfg.prestigeThreshold = 5;
        ProgressionCalculator flat = new ProgressionCalculator(cfg);

        assertEquals(50, flat.totalXpForLevel(5));
        assertEquals(50, flat.totalXpForLevel(99));
        assertEquals(3, flat.levelFromXp(39.9));
        assertEquals(5, flat.levelFromXp(1_000));
    }
}
