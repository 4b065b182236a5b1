package org.gudu0.xpbot.logging;

import net.dv8tion.jda.api.JDA;
import net.dv8tion.jda.api.entities.channel.middleman.MessageChannel;
import org.gudu0.xpbot.config.GlobalConfig;
import org.gudu0.xpbot.util.ConsoleLog;

import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.FormatStyle;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Console log line plus an optional mirror into a Discord channel (logChannelId).
 */
public class LogService {
    private final GlobalConfig cfg;
    private final AtomicBoolean ready = new AtomicBoolean(false);
    private volatile JDA jda;

    public static final DateTimeFormatter TS = DateTimeFormatter.ofLocalizedDateTime(FormatStyle.MEDIUM);

    public LogService(GlobalConfig cfg) {
        this.cfg = cfg;
    }

    public void attach(JDA jda) {
        this.jda = jda;
        this.ready.set(true);
    }

    public void log(String message) {
        ConsoleLog.info("LogService", message);

        if (cfg.logChannelId == null || cfg.logChannelId.isBlank()) {
            ConsoleLog.debug("LogService", "Discord logging disabled (logChannelId missing)");
            return;
        }
        if (!ready.get() || jda == null) {
            ConsoleLog.debug("LogService", "Discord logging skipped (JDA not ready yet)");
            return;
        }

        MessageChannel ch = jda.getChannelById(MessageChannel.class, cfg.logChannelId);
        if (ch == null) {
            ConsoleLog.warn("LogService", "logChannelId not found: " + cfg.logChannelId);
            return;
        }

        String out = "[" + ZonedDateTime.now(cfg.zone()).format(TS) + "] " + message;

        ch.sendMessage(out).queue(
                ok -> ConsoleLog.debug("LogService", "Sent discord log"),
                err -> ConsoleLog.error("LogService", "Log send failed: " + err.getMessage(), err)
        );
    }
}
