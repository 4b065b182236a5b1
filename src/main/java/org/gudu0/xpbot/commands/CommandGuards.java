package org.gudu0.xpbot.commands;

import net.dv8tion.jda.api.Permission;
import net.dv8tion.jda.api.entities.Guild;
import net.dv8tion.jda.api.entities.Member;
import net.dv8tion.jda.api.events.interaction.command.SlashCommandInteractionEvent;
import org.gudu0.xpbot.util.ConsoleLog;

import java.util.EnumSet;
import java.util.stream.Collectors;

public interface CommandGuards {

    default void logInvocation(SlashCommandInteractionEvent event) {
        ConsoleLog.info("Command - " + this.getClass().getSimpleName(),
                "/" + event.getName()
                        + " by userId=" + event.getUser().getId()
                        + " name=" + event.getUser().getName()
                        + " guildId=" + (event.getGuild() != null ? event.getGuild().getId() : "DM")
                        + " channelId=" + event.getChannel().getId());
    }

    // --- Guild / member guards ---

    default Guild requireGuild(SlashCommandInteractionEvent event) {
        Guild g = event.getGuild();
        if (g == null) {
            event.reply("This command can only be used in a server.")
                    .setEphemeral(true).queue();
            return null;
        }
        return g;
    }

    default boolean requireMemberPerms(SlashCommandInteractionEvent event, Permission... perms) {
        Member m = event.getMember();
        if (m == null || !m.hasPermission(perms)) {
            event.reply("You don't have permission to use this.")
                    .setEphemeral(true).queue();
            return false;
        }
        return true;
    }

    /** The single configured bot admin (not a server permission). */
    default boolean requireBotAdmin(SlashCommandInteractionEvent event, long adminUserId) {
        if (adminUserId != 0 && event.getUser().getIdLong() == adminUserId) return true;
        event.reply("Only the bot admin can use this.")
                .setEphemeral(true).queue();
        return false;
    }

    // --- Bot permission guards (guild-wide) ---

    default boolean requireBotPerms(SlashCommandInteractionEvent event, Guild g, Permission... perms) {
        Member self = g.getSelfMember();

        EnumSet<Permission> missing = EnumSet.noneOf(Permission.class);
        for (Permission p : perms) {
            if (!self.hasPermission(p)) missing.add(p);
        }

        if (missing.isEmpty()) return true;

        String missingStr = missing.stream()
                .map(Permission::getName)
                .collect(Collectors.joining(", "));

        event.reply("I'm missing permissions in this server: **" + missingStr + "**")
                .setEphemeral(true).queue();
        return false;
    }
}
