package org.gudu0.xpbot.commands;

import net.dv8tion.jda.api.EmbedBuilder;
import net.dv8tion.jda.api.Permission;
import net.dv8tion.jda.api.entities.Guild;
import net.dv8tion.jda.api.entities.Member;
import net.dv8tion.jda.api.entities.User;
import net.dv8tion.jda.api.events.interaction.command.SlashCommandInteractionEvent;
import net.dv8tion.jda.api.exceptions.ErrorResponseException;
import net.dv8tion.jda.api.hooks.ListenerAdapter;
import net.dv8tion.jda.api.requests.ErrorResponse;
import org.gudu0.xpbot.logging.LogService;
import org.gudu0.xpbot.notifications.Embeds;
import org.gudu0.xpbot.util.ConsoleLog;
import org.jetbrains.annotations.NotNull;

import java.util.EnumSet;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * /tempban: bans now and schedules exactly one unban. The unban is a no-op when the ban was
 * already lifted or the user no longer exists. Pending unbans do not survive a restart.
 */
public class TempBanListener extends ListenerAdapter implements CommandGuards {
    // 28 days
    static final long MAX_SECONDS = 28L * 24 * 60 * 60;

    private static final EnumSet<ErrorResponse> GONE =
            EnumSet.of(ErrorResponse.UNKNOWN_BAN, ErrorResponse.UNKNOWN_USER, ErrorResponse.UNKNOWN_GUILD);

    private final LogService logs;

    public TempBanListener(LogService logs) {
        this.logs = logs;
    }

    @Override
    public void onSlashCommandInteraction(@NotNull SlashCommandInteractionEvent event) {
        if (!event.getName().equals("tempban")) return;
        logInvocation(event);

        Guild g = requireGuild(event);
        if (g == null) return;
        if (!requireMemberPerms(event, Permission.BAN_MEMBERS)) return;
        if (!requireBotPerms(event, g, Permission.BAN_MEMBERS)) return;

        User target = Objects.requireNonNull(event.getOption("user")).getAsUser();
        long seconds = Objects.requireNonNull(event.getOption("seconds")).getAsLong();
        String reason = event.getOption("reason") != null
                ? Objects.requireNonNull(event.getOption("reason")).getAsString()
                : "No reason provided";

        if (seconds <= 0 || seconds > MAX_SECONDS) {
            event.reply("Duration must be between 1 and " + MAX_SECONDS + " seconds.").setEphemeral(true).queue();
            return;
        }
        if (target.getIdLong() == event.getUser().getIdLong()) {
            event.reply("❌ You cannot ban yourself.").setEphemeral(true).queue();
            return;
        }

        Member targetMember = Objects.requireNonNull(event.getOption("user")).getAsMember();
        Member self = g.getSelfMember();
        Member mod = Objects.requireNonNull(event.getMember());
        if (targetMember != null && (!mod.canInteract(targetMember) || !self.canInteract(targetMember))) {
            event.reply("❌ You cannot ban someone with an equal or higher role.").setEphemeral(true).queue();
            return;
        }

        String modName = event.getUser().getName();
        // the ban round trip can outlast the interaction's reply window
        event.deferReply().queue();
        g.ban(target, 0, TimeUnit.SECONDS)
                .reason("Temp banned by " + modName + ": " + reason)
                .queue(
                        ok -> {
                            event.getHook().sendMessageEmbeds(new EmbedBuilder()
                                    .setTitle("⏰ Member Temporarily Banned")
                                    .setDescription("✅ " + target.getAsMention() + " has been banned for " + seconds + " seconds.\n"
                                            + "📝 **Reason:** " + reason)
                                    .setColor(Embeds.BRAND)
                                    .build()).queue();
                            logs.log("Temp ban: userId=" + target.getId() + " by " + modName + " for " + seconds + "s");
                            scheduleUnban(g, target, seconds);
                        },
                        err -> {
                            ConsoleLog.error("TempBan", "Ban failed userId=" + target.getId() + ": " + err.getMessage(), err);
                            event.getHook().sendMessage("❌ Error temp banning member: " + err.getMessage()).queue();
                        }
                );
    }

    private void scheduleUnban(Guild g, User target, long seconds) {
        g.unban(target)
                .reason("Temporary ban expired")
                .queueAfter(seconds, TimeUnit.SECONDS,
                        ok -> ConsoleLog.info("TempBan", "Unbanned userId=" + target.getId() + " guildId=" + g.getId()),
                        err -> {
                            if (err instanceof ErrorResponseException e && GONE.contains(e.getErrorResponse())) {
                                ConsoleLog.info("TempBan", "Unban skipped (" + e.getErrorResponse() + ") userId=" + target.getId());
                                return;
                            }
                            ConsoleLog.error("TempBan", "Unban failed userId=" + target.getId() + ": " + err.getMessage(), err);
                        });
    }
}
