package org.gudu0.xpbot.console;

import net.dv8tion.jda.api.JDA;
import org.gudu0.xpbot.progression.ProfileService;
import org.gudu0.xpbot.progression.UserProfile;
import org.gudu0.xpbot.state.StateStore;
import org.gudu0.xpbot.stats.DailyStatsAggregator;
import org.gudu0.xpbot.stats.DailySummary;
import org.gudu0.xpbot.util.ConsoleLog;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Locale;

/**
 * Operator commands read from stdin.
 */
public final class ConsoleCommandService {

    private final StateStore store;
    private final ProfileService profiles;
    private final DailyStatsAggregator daily;
    private final ZoneId zone;
    private final JDA jda;

    private volatile boolean running = true;

    public ConsoleCommandService(StateStore store, ProfileService profiles, DailyStatsAggregator daily, ZoneId zone, JDA jda) {
        this.store = store;
        this.profiles = profiles;
        this.daily = daily;
        this.zone = zone;
        this.jda = jda;
    }

    public void start() {
        Thread t = new Thread(this::runLoop, "ConsoleCommandService");
        t.setDaemon(true);
        t.start();

        ConsoleLog.info("Console", "Console commands enabled. Type 'help' for commands.");
    }

    private void runLoop() {
        try (BufferedReader br = new BufferedReader(
                new InputStreamReader(System.in, StandardCharsets.UTF_8))) {

            while (running) {
                String line = br.readLine();
                if (line == null) {
                    ConsoleLog.warn("Console", "STDIN closed; console commands disabled.");
                    return;
                }

                line = line.trim();
                if (line.isEmpty()) continue;

                try {
                    handle(line);
                } catch (RuntimeException e) {
                    ConsoleLog.error("Console", "Command failed: " + line + " (" + e.getMessage() + ")", e);
                }
            }
        } catch (Exception e) {
            ConsoleLog.error("Console", "Console command loop crashed: " + e.getMessage(), e);
        }
    }

    void handle(String raw) {
        String[] parts = raw.trim().split("\\s+");
        String cmd = parts[0].toLowerCase(Locale.ROOT);

        switch (cmd) {
            case "help" -> printHelp();

            case "save" -> save();

            case "status" -> status();

            case "user" -> {
                if (parts.length < 2) {
                    ConsoleLog.warn("Console", "Usage: user <userId>");
                    return;
                }
                try {
                    user(Long.parseLong(parts[1]));
                } catch (NumberFormatException e) {
                    ConsoleLog.warn("Console", "Invalid userId: " + parts[1]);
                }
            }

            case "today" -> today();

            case "debug" -> {
                if (parts.length < 2 || !(parts[1].equalsIgnoreCase("on") || parts[1].equalsIgnoreCase("off"))) {
                    ConsoleLog.warn("Console", "Usage: debug on|off");
                    return;
                }
                ConsoleLog.DEBUG = parts[1].equalsIgnoreCase("on");
                ConsoleLog.info("Console", "Debug logging " + (ConsoleLog.DEBUG ? "enabled" : "disabled"));
            }

            case "shutdown", "exit" -> {
                ConsoleLog.warn("Console", "Shutdown requested from console.");
                running = false;
                save();
                if (jda != null) jda.shutdown();
                // shutdown hooks flush the snapshot again
                System.exit(0);
            }

            default -> ConsoleLog.warn("Console", "Unknown command: " + cmd + " (type 'help')");
        }
    }

    private void printHelp() {
        ConsoleLog.info("Console", """
                Commands:
                  help                    - show this help
                  save                    - write progress.json now
                  status                  - users, guilds, log counters
                  user <id>               - show one user's progress
                  today                   - show today's live stats
                  debug on|off            - toggle debug logging
                  shutdown|exit           - save and terminate process
                """.trim());
    }

    private void save() {
        try {
            store.save();
            ConsoleLog.info("Console", "Saved snapshot.");
        } catch (Exception e) {
            ConsoleLog.error("Console", "Save failed: " + e.getMessage(), e);
        }
    }

    private void status() {
        int users;
        int sessions;
        long total;
        synchronized (store.lock) {
            users = store.state().users.size();
            sessions = store.state().voiceSessions.size();
            total = store.state().totalServerMessages;
        }
        ConsoleLog.info("Console", "Status:");
        ConsoleLog.info("Console", "  users=" + users + " voiceSessions=" + sessions + " totalServerMessages=" + total);
        ConsoleLog.info("Console", "  guilds=" + (jda != null ? jda.getGuilds().size() : 0));
        ConsoleLog.info("Console", "  warnings=" + ConsoleLog.warnings() + " errors=" + ConsoleLog.errors());
    }

    private void user(long userId) {
        UserProfile p = profiles.profile(userId);
        ConsoleLog.info("Console", "User " + userId + ":");
        ConsoleLog.info("Console", "  xp=" + p.xp() + " level=" + p.level() + " prestige=" + p.prestige() + " rank=#" + p.rank());
        ConsoleLog.info("Console", "  messages=" + p.messages() + " voiceMinutes=" + p.voiceMinutes() + " streak=" + p.dailyStreak());
        ConsoleLog.info("Console", "  achievements=" + p.achievements());
    }

    private void today() {
        LocalDate day = LocalDate.now(zone);
        DailySummary s = daily.summaryFor(day).orElse(DailySummary.EMPTY);
        ConsoleLog.info("Console", "Today (" + day + "): " + s);
    }
}
