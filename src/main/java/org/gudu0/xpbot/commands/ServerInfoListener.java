package org.gudu0.xpbot.commands;

import net.dv8tion.jda.api.EmbedBuilder;
import net.dv8tion.jda.api.entities.Guild;
import net.dv8tion.jda.api.events.interaction.command.SlashCommandInteractionEvent;
import net.dv8tion.jda.api.hooks.ListenerAdapter;
import org.gudu0.xpbot.notifications.Embeds;
import org.gudu0.xpbot.stats.DailyStatsAggregator;
import org.gudu0.xpbot.stats.ServerTotals;
import org.jetbrains.annotations.NotNull;

import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * /info: guild facts from the JDA cache plus the bot's all-time activity totals.
 */
public class ServerInfoListener extends ListenerAdapter implements CommandGuards {
    private static final DateTimeFormatter CREATED = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss", Locale.ENGLISH);

    private final DailyStatsAggregator daily;
    private final ZoneId zone;

    public ServerInfoListener(DailyStatsAggregator daily, ZoneId zone) {
        this.daily = daily;
        this.zone = zone;
    }

    @Override
    public void onSlashCommandInteraction(@NotNull SlashCommandInteractionEvent event) {
        if (!event.getName().equals("info")) return;
        logInvocation(event);

        Guild guild = requireGuild(event);
        if (guild == null) return;

        ServerTotals totals = daily.serverTotals();

        EmbedBuilder eb = new EmbedBuilder()
                .setTitle("ℹ️ Server Info - " + guild.getName())
                .setDescription(guildLines(guild) + "\n\n" + activityLines(totals))
                .setColor(Embeds.BRAND)
                .setThumbnail(guild.getIconUrl())
                .setImage(guild.getBannerUrl());

        event.replyEmbeds(eb.build()).queue();
    }

    private String guildLines(Guild guild) {
        return "👑 **Owner:** <@" + guild.getOwnerId() + ">\n"
                + "👥 **Members:** " + guild.getMemberCount() + "\n"
                + "📅 **Created:** " + guild.getTimeCreated().atZoneSameInstant(zone).format(CREATED) + "\n"
                + "💬 **Text Channels:** " + guild.getTextChannels().size() + "\n"
                + "🔊 **Voice Channels:** " + guild.getVoiceChannels().size() + "\n"
                + "🎭 **Roles:** " + guild.getRoles().size() + "\n"
                + "⚡ **Boost Level:** " + guild.getBoostTier().getKey() + "\n"
                + "💎 **Boosts:** " + guild.getBoostCount();
    }

    static String activityLines(ServerTotals totals) {
        return "📊 **Server Activity:**\n"
                + "💬 **Total Messages Tracked:** " + String.format(Locale.ENGLISH, "%,d", totals.totalMessages()) + "\n"
                + "⭐ **Total XP Earned:** " + String.format(Locale.ENGLISH, "%,.0f", totals.totalXp()) + "\n"
                + "🔊 **Total Voice Time:** " + String.format(Locale.ENGLISH, "%,.0f", totals.totalVoiceMinutes()) + " minutes";
    }
}
