package org.gudu0.xpbot.commands;

import net.dv8tion.jda.api.entities.Guild;
import net.dv8tion.jda.api.events.guild.GuildJoinEvent;
import net.dv8tion.jda.api.hooks.ListenerAdapter;
import org.gudu0.xpbot.util.ConsoleLog;
import org.jetbrains.annotations.NotNull;

import java.util.function.Consumer;

/**
 * Registers slash commands when the bot is added to a server while running.
 */
public class GuildJoinListener extends ListenerAdapter {

    private final Consumer<Guild> registerCommandsForGuild;

    public GuildJoinListener(Consumer<Guild> registerCommandsForGuild) {
        this.registerCommandsForGuild = registerCommandsForGuild;
    }

    @Override
    public void onGuildJoin(@NotNull GuildJoinEvent event) {
        Guild g = event.getGuild();
        ConsoleLog.warn("GuildJoin", "Joined new guild: " + g.getName() + " (" + g.getId() + ")");

        registerCommandsForGuild.accept(g);
    }
}
