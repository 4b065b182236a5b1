package org.gudu0.xpbot.notifications;

import net.dv8tion.jda.api.JDA;
import net.dv8tion.jda.api.entities.Guild;
import net.dv8tion.jda.api.entities.Message;
import net.dv8tion.jda.api.entities.MessageEmbed;
import net.dv8tion.jda.api.entities.channel.concrete.TextChannel;
import net.dv8tion.jda.api.exceptions.ErrorResponseException;
import net.dv8tion.jda.api.requests.ErrorResponse;
import org.gudu0.xpbot.config.GlobalConfig;
import org.gudu0.xpbot.stats.DailyReport;
import org.gudu0.xpbot.util.ConsoleLog;

import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Delivers engine notifications to Discord. Every send is queued; nothing here blocks the caller.
 */
public class DiscordNotifier implements ProgressNotifier {
    private static final long LEVEL_UP_TTL_SECONDS = 10;
    private static final long PRESTIGE_TTL_SECONDS = 15;

    private final GlobalConfig cfg;
    private volatile JDA jda;

    public DiscordNotifier(GlobalConfig cfg) {
        this.cfg = cfg;
    }

    public void attach(JDA jda) {
        this.jda = jda;
    }

    @Override
    public void notifyProgress(ProgressNotification n) {
        if (jda == null) {
            ConsoleLog.warn("Notifier", "JDA not attached; dropping " + n.kind() + " for userId=" + n.userId());
            return;
        }

        Guild guild = jda.getGuildById(n.context().guildId());
        if (guild == null) {
            ConsoleLog.warn("Notifier", "Guild not found for notification: guildId=" + n.context().guildId());
            return;
        }

        TextChannel ch = announceChannel(guild, n.context());
        if (ch == null) {
            ConsoleLog.warn("Notifier", "No channel to announce " + n.kind() + " in guildId=" + guild.getId());
            return;
        }

        MessageEmbed embed;
        long ttl;
        if (n.kind() == NotificationKind.PRESTIGE) {
            embed = Embeds.prestige(n);
            ttl = PRESTIGE_TTL_SECONDS;
        } else {
            embed = Embeds.levelUp(n, cfg.progression.prestigeThreshold);
            ttl = LEVEL_UP_TTL_SECONDS;
        }

        ch.sendMessageEmbeds(embed).queue(
                msg -> deleteLater(msg, ttl),
                err -> ConsoleLog.error("Notifier", "Failed to send " + n.kind() + " in channelId=" + ch.getId() + ": " + err.getMessage(), err)
        );
    }

    @Override
    public void reportDailyStats(DailyReport report) {
        if (jda == null) {
            ConsoleLog.warn("Notifier", "JDA not attached; dropping daily report for " + report.comparison().date());
            return;
        }

        TextChannel ch = null;
        for (Guild g : jda.getGuilds()) {
            ch = firstByName(g, cfg.statsChannelName);
            if (ch != null) break;
        }
        if (ch == null) {
            ConsoleLog.warn("Notifier", "Stats channel '" + cfg.statsChannelName + "' not found in any guild");
            return;
        }
        Guild guild = ch.getGuild();

        MessageEmbed embed = Embeds.dailyStats("📊 Daily Server Statistics",
                report.comparison(), Embeds.topUserLines(report.topUsers(), id -> Embeds.displayName(guild, id)),
                report.totals(), "Use /leaderboard for live rankings");

        TextChannel target = ch;
        target.sendMessageEmbeds(embed).queue(
                ok -> ConsoleLog.info("Notifier", "Posted daily stats to #" + target.getName()),
                err -> ConsoleLog.error("Notifier", "Failed to post daily stats: " + err.getMessage(), err)
        );
    }

    /** Source channel for message events, else the configured announce channel, else the system channel. */
    private TextChannel announceChannel(Guild guild, EventContext ctx) {
        if (ctx.hasChannel()) {
            TextChannel source = guild.getTextChannelById(ctx.channelId());
            if (source != null) return source;
        }
        TextChannel named = firstByName(guild, cfg.announceChannelName);
        return named != null ? named : guild.getSystemChannel();
    }

    static TextChannel firstByName(Guild guild, String name) {
        if (name == null || name.isBlank()) return null;
        List<TextChannel> found = guild.getTextChannelsByName(name, true);
        return found.isEmpty() ? null : found.get(0);
    }

    private static void deleteLater(Message msg, long seconds) {
        msg.delete().queueAfter(seconds, TimeUnit.SECONDS,
                ok -> {},
                err -> {
                    // already removed by a moderator
                    if (err instanceof ErrorResponseException e && e.getErrorResponse() == ErrorResponse.UNKNOWN_MESSAGE) return;
                    ConsoleLog.warn("Notifier", "Failed to delete announcement messageId=" + msg.getId() + ": " + err.getMessage());
                });
    }
}
