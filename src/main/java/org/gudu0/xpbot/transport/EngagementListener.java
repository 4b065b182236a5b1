package org.gudu0.xpbot.transport;

import net.dv8tion.jda.api.EmbedBuilder;
import net.dv8tion.jda.api.entities.Guild;
import net.dv8tion.jda.api.entities.Member;
import net.dv8tion.jda.api.entities.channel.concrete.TextChannel;
import net.dv8tion.jda.api.events.guild.member.GuildMemberJoinEvent;
import net.dv8tion.jda.api.events.guild.voice.GuildVoiceUpdateEvent;
import net.dv8tion.jda.api.events.message.MessageReceivedEvent;
import net.dv8tion.jda.api.hooks.ListenerAdapter;
import org.gudu0.xpbot.config.GlobalConfig;
import org.gudu0.xpbot.notifications.Embeds;
import org.gudu0.xpbot.notifications.EventContext;
import org.gudu0.xpbot.progression.XpAwardService;
import org.gudu0.xpbot.util.ConsoleLog;
import org.jetbrains.annotations.NotNull;

import java.time.Instant;
import java.util.List;

/**
 * Feeds gateway events into the XP engine: guild messages, voice joins/leaves and member joins.
 */
public class EngagementListener extends ListenerAdapter {
    private final XpAwardService xp;
    private final GlobalConfig cfg;

    public EngagementListener(XpAwardService xp, GlobalConfig cfg) {
        this.xp = xp;
        this.cfg = cfg;
    }

    @Override
    public void onMessageReceived(@NotNull MessageReceivedEvent event) {
        if (!event.isFromGuild()) return;
        if (event.getAuthor().isBot() || event.isWebhookMessage()) return;

        EventContext ctx = new EventContext(event.getGuild().getIdLong(), event.getChannel().getIdLong());
        // receive time, the same clock as voice and the daily report
        xp.onMessage(event.getAuthor().getIdLong(), ctx, Instant.now());
    }

    @Override
    public void onGuildVoiceUpdate(@NotNull GuildVoiceUpdateEvent event) {
        Member member = event.getMember();
        if (member.getUser().isBot()) return;

        long userId = member.getIdLong();
        Instant now = Instant.now();

        // channel moves keep the session running
        if (event.getChannelLeft() == null && event.getChannelJoined() != null) {
            ConsoleLog.debug("Voice", "join userId=" + userId + " channel=" + event.getChannelJoined().getName());
            xp.onVoiceJoin(userId, now);
        } else if (event.getChannelLeft() != null && event.getChannelJoined() == null) {
            ConsoleLog.debug("Voice", "leave userId=" + userId + " channel=" + event.getChannelLeft().getName());
            xp.onVoiceLeave(userId, EventContext.voice(event.getGuild().getIdLong()), now);
        }
    }

    @Override
    public void onGuildMemberJoin(@NotNull GuildMemberJoinEvent event) {
        Guild guild = event.getGuild();
        Member member = event.getMember();
        ConsoleLog.info("MemberJoin", "userId=" + member.getId() + " guildId=" + guild.getId());

        xp.onMemberJoin(Instant.now());

        List<TextChannel> channels = guild.getTextChannelsByName(cfg.greetingChannelName, true);
        if (channels.isEmpty()) {
            ConsoleLog.debug("MemberJoin", "No greeting channel '" + cfg.greetingChannelName + "' in guildId=" + guild.getId());
            return;
        }

        EmbedBuilder eb = new EmbedBuilder()
                .setTitle("Welcome to " + guild.getName() + "! 👋")
                .setDescription("Hello " + member.getAsMention() + "! Welcome to our server.\n\n"
                        + "📝 Make sure to read the rules\n"
                        + "💬 Introduce yourself in the chat\n"
                        + "🎉 Have fun and enjoy your stay!\n\n"
                        + "🎮 Start earning XP by chatting and joining voice channels!")
                .setThumbnail(member.getEffectiveAvatarUrl())
                .setColor(Embeds.BRAND);

        channels.get(0).sendMessageEmbeds(eb.build()).queue(
                ok -> {},
                err -> ConsoleLog.error("MemberJoin", "Failed to send welcome: " + err.getMessage(), err)
        );
    }
}
