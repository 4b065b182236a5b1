package org.gudu0.xpbot.commands;

import net.dv8tion.jda.api.EmbedBuilder;
import net.dv8tion.jda.api.events.interaction.command.SlashCommandInteractionEvent;
import net.dv8tion.jda.api.hooks.ListenerAdapter;
import org.gudu0.xpbot.config.GlobalConfig;
import org.gudu0.xpbot.logging.LogService;
import org.gudu0.xpbot.notifications.Embeds;
import org.gudu0.xpbot.state.StateStore;
import org.gudu0.xpbot.util.ConsoleLog;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * /events shows the free-text events board; /setevents replaces it (bot admin only).
 */
public class EventsListener extends ListenerAdapter implements CommandGuards {
    // embed description limit
    static final int MAX_LENGTH = 4000;

    private final StateStore store;
    private final GlobalConfig cfg;
    private final LogService logs;

    public EventsListener(StateStore store, GlobalConfig cfg, LogService logs) {
        this.store = store;
        this.cfg = cfg;
        this.logs = logs;
    }

    @Override
    public void onSlashCommandInteraction(@NotNull SlashCommandInteractionEvent event) {
        switch (event.getName()) {
            case "events" -> showEvents(event);
            case "setevents" -> setEvents(event);
            default -> { }
        }
    }

    private void showEvents(SlashCommandInteractionEvent event) {
        logInvocation(event);

        String text;
        synchronized (store.lock) {
            text = store.state().eventsMessage;
        }

        event.replyEmbeds(new EmbedBuilder()
                .setTitle("📅 Current Events")
                .setDescription(text)
                .setColor(Embeds.BRAND)
                .build()).queue();
    }

    private void setEvents(SlashCommandInteractionEvent event) {
        logInvocation(event);
        if (!requireBotAdmin(event, cfg.adminUserIdLong())) return;

        String text = Objects.requireNonNull(event.getOption("text")).getAsString().trim();
        if (text.isEmpty() || text.length() > MAX_LENGTH) {
            event.reply("Events text must be 1-" + MAX_LENGTH + " characters.").setEphemeral(true).queue();
            return;
        }

        synchronized (store.lock) {
            store.state().eventsMessage = text;
            store.markDirty();
        }

        try {
            store.save();
        } catch (Exception e) {
            ConsoleLog.error("Events", "Failed to save events text: " + e.getMessage(), e);
            event.reply("⚠️ Events updated, but saving failed. It will be retried on the next autosave.")
                    .setEphemeral(true).queue();
            return;
        }

        logs.log("Events text updated by <@" + event.getUser().getId() + ">");
        event.reply("✅ Events updated successfully.").setEphemeral(true).queue();
    }
}
