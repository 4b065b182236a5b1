package org.gudu0.xpbot.commands;

import org.gudu0.xpbot.stats.ServerTotals;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ServerInfoListenerTest {

    @Test
    void activityLinesShowAllTimeTotals() {
        String text = ServerInfoListener.activityLines(new ServerTotals(12_345, 6_789.4, 1_500.6, 3));

        assertTrue(text.startsWith("📊 **Server Activity:**"));
        assertTrue(text.contains("💬 **Total Messages Tracked:** 12,345"));
        assertTrue(text.contains("⭐ **Total XP Earned:** 6,789"));
        assertTrue(text.contains("🔊 **Total Voice Time:** 1,501 minutes"));
    }
}
