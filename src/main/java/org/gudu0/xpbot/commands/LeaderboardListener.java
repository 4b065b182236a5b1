package org.gudu0.xpbot.commands;

import net.dv8tion.jda.api.EmbedBuilder;
import net.dv8tion.jda.api.events.interaction.command.SlashCommandInteractionEvent;
import net.dv8tion.jda.api.hooks.ListenerAdapter;
import org.gudu0.xpbot.leaderboard.Leaderboard;
import org.gudu0.xpbot.leaderboard.LeaderboardEntry;
import org.gudu0.xpbot.notifications.Embeds;
import org.gudu0.xpbot.progression.UserProgress;
import org.gudu0.xpbot.state.StateStore;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Locale;

public class LeaderboardListener extends ListenerAdapter implements CommandGuards {
    private static final String[] MEDALS = {"🥇", "🥈", "🥉"};

    private final StateStore store;
    private final Leaderboard leaderboard;
    private final int size;

    public LeaderboardListener(StateStore store, Leaderboard leaderboard, int size) {
        this.store = store;
        this.leaderboard = leaderboard;
        this.size = size;
    }

    @Override
    public void onSlashCommandInteraction(@NotNull SlashCommandInteractionEvent event) {
        if (!event.getName().equals("leaderboard")) return;
        logInvocation(event);

        // Build the text under the lock so levels match the scores
        StringBuilder sb = new StringBuilder();
        synchronized (store.lock) {
            List<LeaderboardEntry> top = leaderboard.top(size);
            if (top.isEmpty()) {
                sb.append("_No data yet._");
            }

            int rank = 1;
            for (LeaderboardEntry e : top) {
                UserProgress p = store.userOrDefault(e.userId());
                String medal = rank <= MEDALS.length ? MEDALS[rank - 1] : rank + ".";
                String prestige = p.prestige > 0 ? " ⭐" + p.prestige : "";

                sb.append(medal).append(" <@").append(e.userId()).append("> - Lv.").append(p.level).append(prestige)
                        .append(" | **").append(String.format(Locale.ENGLISH, "%,.0f", e.score())).append("** pts")
                        .append(" (").append(String.format(Locale.ENGLISH, "%,.0f", p.xp)).append(" XP, ")
                        .append(String.format(Locale.ENGLISH, "%.0f", p.voiceMinutes)).append("m voice)\n");
                rank++;
            }
        }

        EmbedBuilder eb = new EmbedBuilder()
                .setTitle("🏆 Server Leaderboard")
                .setDescription(sb.toString())
                .setColor(Embeds.BRAND)
                .setFooter("Score = XP + voice minutes x weight + prestige bonus");

        event.replyEmbeds(eb.build()).queue();
    }
}
