package org.gudu0.xpbot.notifications;

import net.dv8tion.jda.api.entities.MessageEmbed;
import org.gudu0.xpbot.leaderboard.RankedUser;
import org.gudu0.xpbot.progression.XpSource;
import org.gudu0.xpbot.stats.DailySummary;
import org.gudu0.xpbot.stats.ServerTotals;
import org.gudu0.xpbot.stats.StatsComparison;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EmbedsTest {

    private static final EventContext CTX = new EventContext(1L, 2L);

    @Test
    void milestonesFollowThePrestigeThreshold() {
        assertEquals("🎯 First milestone reached!", Embeds.milestone(10, 50));
        assertEquals("🚀 Quarter century!", Embeds.milestone(25, 50));
        assertEquals("⚠️ One level away from Prestige!", Embeds.milestone(49, 50));
        assertEquals("⚠️ One level away from Prestige!", Embeds.milestone(29, 30));
        assertNull(Embeds.milestone(11, 50));
    }

    @Test
    void levelUpMentionsUserAndVoiceSource() {
        ProgressNotification n = new ProgressNotification(NotificationKind.LEVEL_UP, 42L, 10, 0, XpSource.VOICE, CTX);

        MessageEmbed e = Embeds.levelUp(n, 50);

        assertEquals("🎉 Level Up!", e.getTitle());
        assertTrue(e.getDescription().contains("<@42> reached **Level 10** from voice activity"));
        assertTrue(e.getDescription().contains("First milestone"));
    }

    @Test
    void prestigeShowsCountInGold() {
        ProgressNotification n = new ProgressNotification(NotificationKind.PRESTIGE, 42L, 0, 3, XpSource.MESSAGE, CTX);

        MessageEmbed e = Embeds.prestige(n);

        assertTrue(e.getDescription().contains("**Prestige 3**"));
        assertEquals(Embeds.GOLD, e.getColor());
    }

    @Test
    void dailyStatsWithoutPreviousDaySaysSo() {
        DailySummary day = new DailySummary(1234, 500, 30, 6, 2, 0, 1);
        StatsComparison cmp = new StatsComparison(LocalDate.of(2026, 3, 2), day, null);

        MessageEmbed e = Embeds.dailyStats("📊 Stats", cmp, List.of(), new ServerTotals(10_000, 5_000, 300, 1), "footer");

        assertEquals("📊 Stats - March 2, 2026", e.getTitle());
        List<MessageEmbed.Field> fields = e.getFields();
        assertTrue(fields.get(0).getValue().contains("**Messages:** 1,234"));
        assertTrue(fields.get(1).getValue().contains("No data"));
        assertTrue(fields.stream().anyMatch(f -> "🎲 Fun Facts".equals(f.getName())));
        assertTrue(fields.stream().noneMatch(f -> "🏆 Top Active Users".equals(f.getName())));
    }

    @Test
    void topActiveUsersGetMedalsAndPrestigeStars() {
        List<RankedUser> top = List.of(
                new RankedUser(1L, 900, 12, 2),
                new RankedUser(2L, 500, 8, 0),
                new RankedUser(3L, 300, 5, 0),
                new RankedUser(4L, 200, 4, 0),
                new RankedUser(5L, 100, 3, 0),
                new RankedUser(6L, 50, 1, 0));

        List<String> lines = Embeds.topUserLines(top, id -> id == 1L ? "alice" : "user" + id);

        assertEquals("🥇 **alice** - Lv.12⭐2", lines.get(0));
        assertEquals("🥈 **user2** - Lv.8", lines.get(1));
        assertEquals("5️⃣ **user5** - Lv.3", lines.get(4));
        assertEquals("6. **user6** - Lv.1", lines.get(5));
    }

    @Test
    void topActiveUsersFieldSitsBeforeTotals() {
        StatsComparison cmp = new StatsComparison(LocalDate.of(2026, 3, 2), new DailySummary(1, 1, 0, 1, 0, 0, 0), null);

        List<MessageEmbed.Field> fields = Embeds.dailyStats("t", cmp, List.of("🥇 **alice** - Lv.3"),
                new ServerTotals(1, 1, 0, 0), "f").getFields();

        assertEquals("🏆 Top Active Users", fields.get(2).getName());
        assertEquals("🥇 **alice** - Lv.3", fields.get(2).getValue());
        assertEquals("🎯 All-Time Server Stats", fields.get(3).getName());
    }

    @Test
    void displayNameFallsBackToMention() {
        assertEquals("<@42>", Embeds.displayName(null, 42L));
    }

    @Test
    void dailyStatsDeltasCarryArrows() {
        DailySummary prev = new DailySummary(10, 50, 0, 3, 0, 0, 0);
        DailySummary day = new DailySummary(15, 40, 0, 3, 0, 0, 0);
        StatsComparison cmp = new StatsComparison(LocalDate.of(2026, 3, 2), day, prev);

        String deltas = Embeds.dailyStats("t", cmp, List.of(), new ServerTotals(0, 0, 0, 0), "f").getFields().get(1).getValue();

        assertTrue(deltas.contains("📈 **Messages:** +5"));
        assertTrue(deltas.contains("➡️ **Active Users:** +0"));
        assertTrue(deltas.contains("📉 **XP Gained:** -10"));
    }

    @Test
    void funFactsSkipEmptyDays() {
        assertTrue(Embeds.funFacts(DailySummary.EMPTY).isEmpty());
        assertEquals(List.of("💡 Average XP per message: 2.5", "🎤 Average voice time per user: 10m"),
                Embeds.funFacts(new DailySummary(4, 10, 20, 2, 0, 0, 0)));
    }

    @Test
    void activityColorBands() {
        assertNotEquals(Embeds.activityColor(10), Embeds.activityColor(5));
        assertNotEquals(Embeds.activityColor(5), Embeds.activityColor(4));
        assertEquals(Embeds.activityColor(0), Embeds.activityColor(4));
    }
}
