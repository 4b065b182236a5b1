package org.gudu0.xpbot.commands;

import net.dv8tion.jda.api.entities.Guild;
import net.dv8tion.jda.api.events.interaction.command.SlashCommandInteractionEvent;
import net.dv8tion.jda.api.hooks.ListenerAdapter;
import org.gudu0.xpbot.leaderboard.Leaderboard;
import org.gudu0.xpbot.notifications.Embeds;
import org.gudu0.xpbot.stats.DailyStatsAggregator;
import org.jetbrains.annotations.NotNull;

import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;

public class DailyStatsListener extends ListenerAdapter implements CommandGuards {
    private final DailyStatsAggregator daily;
    private final Leaderboard leaderboard;
    private final int topCount;
    private final ZoneId zone;

    public DailyStatsListener(DailyStatsAggregator daily, Leaderboard leaderboard, int topCount, ZoneId zone) {
        this.daily = daily;
        this.leaderboard = leaderboard;
        this.topCount = topCount;
        this.zone = zone;
    }

    @Override
    public void onSlashCommandInteraction(@NotNull SlashCommandInteractionEvent event) {
        if (!event.getName().equals("dailystats")) return;
        logInvocation(event);

        LocalDate today = LocalDate.now(zone);
        Guild guild = event.getGuild();
        List<String> top = Embeds.topUserLines(leaderboard.topAmong(daily.activeUsersOn(today), topCount),
                id -> Embeds.displayName(guild, id));

        event.replyEmbeds(Embeds.dailyStats("📊 Today's Server Statistics",
                daily.comparison(today), top, daily.serverTotals(), "Live numbers, the full report posts after the day ends"))
                .queue();
    }
}
