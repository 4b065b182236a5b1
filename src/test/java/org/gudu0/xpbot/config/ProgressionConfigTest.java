package org.gudu0.xpbot.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ProgressionConfigTest {

    @Test
    void defaultsAreValid() {
        assertDoesNotThrow(() -> new ProgressionConfig().validate());
        assertDoesNotThrow(() -> new GlobalConfig().validate());
    }

    @Test
    void bonusRangeWiderThanAnIntIsRejected() {
        ProgressionConfig cfg = new ProgressionConfig();
        cfg.bonusXpMin = 0;
        cfg.bonusXpMax = Integer.MAX_VALUE;

        assertThrows(IllegalStateException.class, cfg::validate);

        cfg.bonusXpMin = 1;
        assertDoesNotThrow(cfg::validate);
    }

    @Test
    void invertedBonusRangeIsRejected() {
        ProgressionConfig cfg = new ProgressionConfig();
        cfg.bonusXpMin = 5;
        cfg.bonusXpMax = 4;

        assertThrows(IllegalStateException.class, cfg::validate);
    }

    @Test
    void negativeTopCountIsRejected() {
        GlobalConfig cfg = new GlobalConfig();
        cfg.statsTopCount = -1;

        assertThrows(IllegalStateException.class, cfg::validate);
    }
}
