package org.gudu0.xpbot.notifications;

import net.dv8tion.jda.api.EmbedBuilder;
import net.dv8tion.jda.api.entities.Guild;
import net.dv8tion.jda.api.entities.Member;
import net.dv8tion.jda.api.entities.MessageEmbed;
import org.gudu0.xpbot.leaderboard.RankedUser;
import org.gudu0.xpbot.progression.XpSource;
import org.gudu0.xpbot.stats.DailySummary;
import org.gudu0.xpbot.stats.ServerTotals;
import org.gudu0.xpbot.stats.StatsComparison;
import org.jetbrains.annotations.Nullable;

import java.awt.Color;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.LongFunction;

/**
 * Embed layouts shared by announcements, the daily report and slash commands.
 */
public final class Embeds {
    private Embeds() {}

    public static final Color BRAND = new Color(0x5865F2);
    public static final Color GOLD = new Color(0xFFD700);

    private static final Color HIGH_ACTIVITY = new Color(0x00FF00);
    private static final Color MID_ACTIVITY = new Color(0xFFFF00);
    private static final Color LOW_ACTIVITY = new Color(0xFF6600);

    private static final String[] MEDALS = {"🥇", "🥈", "🥉", "4️⃣", "5️⃣"};

    private static final DateTimeFormatter REPORT_DAY = DateTimeFormatter.ofPattern("MMMM d, yyyy", Locale.ENGLISH);

    public static MessageEmbed levelUp(ProgressNotification n, int prestigeThreshold) {
        StringBuilder sb = new StringBuilder()
                .append("<@").append(n.userId()).append("> reached **Level ").append(n.level()).append("**");
        if (n.source() == XpSource.VOICE) sb.append(" from voice activity");
        sb.append("! 🎊");

        String milestone = milestone(n.level(), prestigeThreshold);
        if (milestone != null) sb.append("\n").append(milestone);

        return new EmbedBuilder()
                .setTitle("🎉 Level Up!")
                .setDescription(sb.toString())
                .setColor(BRAND)
                .build();
    }

    public static MessageEmbed prestige(ProgressNotification n) {
        String how = n.source() == XpSource.VOICE ? " from voice activity" : "";
        return new EmbedBuilder()
                .setTitle("🌟 PRESTIGE ACHIEVED! 🌟")
                .setDescription("🎊 <@" + n.userId() + "> has achieved **Prestige " + n.prestige() + "**" + how + "!\n"
                        + "⭐ Your journey begins anew with ultimate bragging rights! ⭐")
                .setColor(GOLD)
                .build();
    }

    static String milestone(int level, int prestigeThreshold) {
        if (level == prestigeThreshold - 1) return "⚠️ One level away from Prestige!";
        return switch (level) {
            case 10 -> "🎯 First milestone reached!";
            case 25 -> "🚀 Quarter century!";
            default -> null;
        };
    }

    /**
     * Day summary with deltas against the day before (when known), the top active users (lines from
     * {@link #topUserLines}; the field is left out when empty) and all-time totals.
     */
    public static MessageEmbed dailyStats(String title, StatsComparison cmp, List<String> topUsers,
                                          ServerTotals totals, String footer) {
        DailySummary day = cmp.current();

        EmbedBuilder eb = new EmbedBuilder()
                .setTitle(title + " - " + cmp.date().format(REPORT_DAY))
                .setColor(activityColor(day.activeUsers()))
                .setFooter(footer);

        eb.addField("📈 Activity",
                "💬 **Messages:** " + String.format(Locale.ENGLISH, "%,d", day.messages()) + "\n"
                        + "👥 **Active Users:** " + day.activeUsers() + "\n"
                        + "⭐ **XP Gained:** " + String.format(Locale.ENGLISH, "%,.0f", day.xpGained()) + "\n"
                        + "🔊 **Voice Time:** " + String.format(Locale.ENGLISH, "%.0f", day.voiceMinutes()) + "m\n"
                        + "📊 **Level Ups:** " + day.levelUps() + "\n"
                        + "🌟 **Prestiges:** " + day.prestiges() + "\n"
                        + "👋 **New Members:** " + day.newMembers(),
                true);

        if (cmp.hasPrevious()) {
            eb.addField("📊 vs Previous Day",
                    arrow(cmp.messagesDelta()) + " **Messages:** " + String.format(Locale.ENGLISH, "%+,d", cmp.messagesDelta()) + "\n"
                            + arrow(cmp.activeUsersDelta()) + " **Active Users:** " + String.format(Locale.ENGLISH, "%+d", cmp.activeUsersDelta()) + "\n"
                            + arrow(cmp.xpDelta()) + " **XP Gained:** " + String.format(Locale.ENGLISH, "%+,.0f", cmp.xpDelta()),
                    true);
        } else {
            eb.addField("📊 vs Previous Day", "_No data for the previous day._", true);
        }

        if (!topUsers.isEmpty()) {
            eb.addField("🏆 Top Active Users", String.join("\n", topUsers), false);
        }

        eb.addField("🎯 All-Time Server Stats",
                "💬 **Total Messages:** " + String.format(Locale.ENGLISH, "%,d", totals.totalMessages()) + "\n"
                        + "⭐ **Total XP:** " + String.format(Locale.ENGLISH, "%,.0f", totals.totalXp()) + "\n"
                        + "🔊 **Total Voice Time:** " + String.format(Locale.ENGLISH, "%,.0f", totals.totalVoiceMinutes()) + "m\n"
                        + "🌟 **Total Prestiges:** " + totals.totalPrestiges(),
                false);

        List<String> facts = funFacts(day);
        if (!facts.isEmpty()) {
            eb.addField("🎲 Fun Facts", String.join("\n", facts), false);
        }
        return eb.build();
    }

    /** One line per user, medals for the first places. */
    public static List<String> topUserLines(List<RankedUser> users, LongFunction<String> displayName) {
        List<String> lines = new ArrayList<>(users.size());
        for (int i = 0; i < users.size(); i++) {
            RankedUser u = users.get(i);
            String medal = i < MEDALS.length ? MEDALS[i] : (i + 1) + ".";
            String prestige = u.prestige() > 0 ? "⭐" + u.prestige() : "";
            lines.add(medal + " **" + displayName.apply(u.userId()) + "** - Lv." + u.level() + prestige);
        }
        return lines;
    }

    /** Cached member name, else a mention (uncached members still render). */
    public static String displayName(@Nullable Guild guild, long userId) {
        Member m = guild == null ? null : guild.getMemberById(userId);
        return m != null ? m.getEffectiveName() : "<@" + userId + ">";
    }

    static List<String> funFacts(DailySummary day) {
        List<String> facts = new ArrayList<>();
        if (day.messages() > 0) {
            facts.add(String.format(Locale.ENGLISH, "💡 Average XP per message: %.1f", day.xpGained() / day.messages()));
        }
        if (day.activeUsers() > 0 && day.voiceMinutes() > 0) {
            facts.add(String.format(Locale.ENGLISH, "🎤 Average voice time per user: %.0fm", day.voiceMinutes() / day.activeUsers()));
        }
        return facts;
    }

    static String arrow(double delta) {
        if (delta > 0) return "📈";
        if (delta < 0) return "📉";
        return "➡️";
    }

    static Color activityColor(int activeUsers) {
        if (activeUsers >= 10) return HIGH_ACTIVITY;
        if (activeUsers >= 5) return MID_ACTIVITY;
        return LOW_ACTIVITY;
    }
}
