package org.gudu0.xpbot.commands;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ProfileListenerTest {

    @Test
    void progressBarFillsProportionally() {
        assertEquals("`" + "░".repeat(20) + "` 0.0%", ProfileListener.progressBar(0));
        assertEquals("`" + "█".repeat(10) + "░".repeat(10) + "` 50.0%", ProfileListener.progressBar(0.5));
        assertEquals("`" + "█".repeat(20) + "` 100.0%", ProfileListener.progressBar(1));
    }

    @Test
    void progressBarClampsOutOfRange() {
        assertEquals(ProfileListener.progressBar(1), ProfileListener.progressBar(3));
        assertEquals(ProfileListener.progressBar(0), ProfileListener.progressBar(-1));
    }
}
