package org.gudu0.xpbot;

import net.dv8tion.jda.api.JDA;
import net.dv8tion.jda.api.JDABuilder;
import net.dv8tion.jda.api.entities.Guild;
import net.dv8tion.jda.api.interactions.commands.OptionType;
import net.dv8tion.jda.api.interactions.commands.build.Commands;
import net.dv8tion.jda.api.interactions.commands.build.OptionData;
import net.dv8tion.jda.api.requests.GatewayIntent;
import org.gudu0.xpbot.achievements.AchievementsService;
import org.gudu0.xpbot.commands.*;
import org.gudu0.xpbot.config.GlobalConfig;
import org.gudu0.xpbot.config.TypedConfigStore;
import org.gudu0.xpbot.console.ConsoleCommandService;
import org.gudu0.xpbot.leaderboard.Leaderboard;
import org.gudu0.xpbot.logging.LogService;
import org.gudu0.xpbot.notifications.DiscordNotifier;
import org.gudu0.xpbot.progression.ProfileService;
import org.gudu0.xpbot.progression.ProgressionCalculator;
import org.gudu0.xpbot.progression.XpAwardService;
import org.gudu0.xpbot.state.StateStore;
import org.gudu0.xpbot.stats.DailyStatsAggregator;
import org.gudu0.xpbot.stats.DailyStatsReporter;
import org.gudu0.xpbot.transport.EngagementListener;
import org.gudu0.xpbot.util.BotPaths;
import org.gudu0.xpbot.util.ConsoleLog;

import java.nio.file.Files;
import java.time.ZoneId;
import java.util.Random;

public class Main {

    public static void main(String[] args) throws Exception {
        ConsoleLog.info("Main", "Starting Bot");
        BotPaths.ensureBaseDirs();

        // 1) Token (env)
        String token = reqEnv("DISCORD_TOKEN");

        // 2) Config (data/global/config.json); invalid values stop startup
        GlobalConfig cfg = loadOrCreateGlobalConfig();
        cfg.validate();
        ZoneId zone = cfg.zone();
        ConsoleLog.useZone(zone);

        ConsoleLog.info("Main", "GlobalConfig: zone=" + zone
                + " statsChannel=" + cfg.statsChannelName
                + " announceChannel=" + cfg.announceChannelName
                + " prestigeThreshold=" + cfg.progression.prestigeThreshold);

        // 3) State (data/global/progress.json)
        ProgressionCalculator calc = new ProgressionCalculator(cfg.progression);
        StateStore store = new StateStore(BotPaths.SNAPSHOT_FILE, calc);
        store.load();
        store.startAutoFlush(cfg.autosaveSeconds);

        // 4) Services
        LogService logs = new LogService(cfg);
        DiscordNotifier notifier = new DiscordNotifier(cfg);

        AchievementsService achievements = new AchievementsService(logs);
        DailyStatsAggregator daily = new DailyStatsAggregator(store);
        Leaderboard leaderboard = new Leaderboard(store, calc, cfg.progression);
        ProfileService profiles = new ProfileService(store, calc, leaderboard);

        XpAwardService xp = new XpAwardService(store, calc, achievements, daily, leaderboard, notifier,
                cfg.progression, zone, new Random());

        DailyStatsReporter reporter = new DailyStatsReporter(cfg, store, daily, leaderboard, notifier);

        // 5) Build JDA
        ConsoleLog.info("Main", "Building JDA (GUILD_MEMBERS enabled)");
        JDA jda = JDABuilder.createDefault(token)
                .enableIntents(GatewayIntent.GUILD_MEMBERS, GatewayIntent.GUILD_VOICE_STATES)
                .addEventListeners(
                        // Commands
                        new ProfileListener(profiles, achievements),
                        new LeaderboardListener(store, leaderboard, cfg.leaderboardSize),
                        new DailyStatsListener(daily, leaderboard, cfg.statsTopCount, zone),
                        new ServerInfoListener(daily, zone),
                        new AchievementsCommandListener(achievements, profiles),
                        new EventsListener(store, cfg, logs),
                        new TempBanListener(logs),
                        new GuildJoinListener(Main::registerGuildCommandsOne),
                        // Core listeners
                        new EngagementListener(xp, cfg),
                        reporter
                )
                .build();

        jda.awaitReady();
        ConsoleLog.info("Main", "JDA ready as " + jda.getSelfUser().getName());

        // 6) Attach services that need JDA
        logs.attach(jda);
        notifier.attach(jda);

        ConsoleCommandService console = new ConsoleCommandService(store, profiles, daily, zone, jda);
        console.start();

        // 7) Register commands (guild-scoped, for every guild)
        ConsoleLog.info("Main", "Registering guild commands (all guilds)");
        for (Guild g : jda.getGuilds()) {
            registerGuildCommandsOne(g);
        }

        ConsoleLog.info("Main", "Startup complete");
        logs.log("Bot Startup Completed Successfully.");
    }

    private static GlobalConfig loadOrCreateGlobalConfig() {
        boolean existed = Files.exists(BotPaths.CONFIG_FILE);
        TypedConfigStore<GlobalConfig> s = new TypedConfigStore<>(BotPaths.CONFIG_FILE, GlobalConfig.class, GlobalConfig::new);

        // TypedConfigStore never writes by itself
        if (!existed) {
            ConsoleLog.warn("Main", "Global config missing; creating default at " + BotPaths.CONFIG_FILE);
            try {
                s.save();
            } catch (Exception e) {
                ConsoleLog.error("Main", "Failed to write default config; continuing with defaults. " + e.getMessage(), e);
            }
        }
        return s.cfg();
    }

    // ----------------------------
    // Commands registration
    // ----------------------------

    private static void registerGuildCommandsOne(Guild g) {
        g.updateCommands()
                .addCommands(
                        Commands.slash("profile", "Show level, XP, rank and achievements")
                                .addOption(OptionType.USER, "user", "User to view (defaults to you)", false),

                        Commands.slash("leaderboard", "Top users by XP, voice time and prestige"),

                        Commands.slash("dailystats", "Show today's server statistics"),

                        Commands.slash("info", "Show server info and activity totals"),

                        Commands.slash("achievements", "View achievements")
                                .addOption(OptionType.USER, "user", "User to view (defaults to you)", false),

                        Commands.slash("events", "Show current events"),

                        Commands.slash("setevents", "Replace the events text (bot admin only)")
                                .addOptions(new OptionData(OptionType.STRING, "text", "New events text", true)
                                        .setMaxLength(4000)),

                        Commands.slash("tempban", "Ban a member for a number of seconds")
                                .addOption(OptionType.USER, "user", "Member to ban", true)
                                .addOptions(new OptionData(OptionType.INTEGER, "seconds", "Ban duration in seconds", true)
                                        .setMinValue(1))
                                .addOption(OptionType.STRING, "reason", "Reason (optional)", false)
                )
                .queue(
                        ok -> ConsoleLog.info("Main", "Guild commands updated: " + g.getName() + " (" + g.getId() + ")"),
                        err -> ConsoleLog.error("Main", "Failed registering commands in guildId=" + g.getId() + ": " + err.getMessage(), err)
                );
    }

    // ----------------------------
    // Utils
    // ----------------------------

    private static String reqEnv(String key) {
        String v = System.getenv(key);
        if (v == null || v.isBlank()) throw new IllegalStateException("Missing environment variable: " + key);
        return v;
    }
}
