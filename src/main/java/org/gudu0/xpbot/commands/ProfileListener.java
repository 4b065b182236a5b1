package org.gudu0.xpbot.commands;

import net.dv8tion.jda.api.EmbedBuilder;
import net.dv8tion.jda.api.entities.User;
import net.dv8tion.jda.api.events.interaction.command.SlashCommandInteractionEvent;
import net.dv8tion.jda.api.hooks.ListenerAdapter;
import org.gudu0.xpbot.achievements.AchievementDef;
import org.gudu0.xpbot.achievements.AchievementsService;
import org.gudu0.xpbot.notifications.Embeds;
import org.gudu0.xpbot.progression.LevelProgress;
import org.gudu0.xpbot.progression.ProfileService;
import org.gudu0.xpbot.progression.UserProfile;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

public class ProfileListener extends ListenerAdapter implements CommandGuards {
    private static final int SHOWN_ACHIEVEMENTS = 5;

    private final ProfileService profiles;
    private final AchievementsService achievements;

    public ProfileListener(ProfileService profiles, AchievementsService achievements) {
        this.profiles = profiles;
        this.achievements = achievements;
    }

    @Override
    public void onSlashCommandInteraction(@NotNull SlashCommandInteractionEvent event) {
        if (!event.getName().equals("profile")) return;
        logInvocation(event);

        User target = event.getOption("user") != null
                ? Objects.requireNonNull(event.getOption("user")).getAsUser()
                : event.getUser();

        // never creates an entry for unknown users
        UserProfile p = profiles.profile(target.getIdLong());
        LevelProgress lp = p.progress();

        String prestigeText = p.prestige() > 0 ? " ⭐" + p.prestige() : "";

        EmbedBuilder eb = new EmbedBuilder()
                .setTitle("👤 " + target.getName() + "'s Profile" + prestigeText)
                .setColor(Embeds.BRAND)
                .setThumbnail(target.getEffectiveAvatarUrl())
                .setDescription("🏆 **Level:** " + p.level() + prestigeText + "\n"
                        + "💎 **XP:** " + String.format(Locale.ENGLISH, "%,.0f", p.xp()) + "\n"
                        + "📊 **Progress:** " + String.format(Locale.ENGLISH, "%.0f", lp.progress()) + "/" + lp.requirementForNext() + " XP\n"
                        + "🥇 **Server Rank:** #" + p.rank() + "\n"
                        + "💬 **Messages:** " + String.format(Locale.ENGLISH, "%,d", p.messages()) + "\n"
                        + "🔊 **Voice Time:** " + String.format(Locale.ENGLISH, "%.0f", p.voiceMinutes()) + " minutes\n"
                        + "🔥 **Current Streak:** " + p.dailyStreak() + " days");

        if (lp.hasNextLevel()) {
            eb.addField("📈 Level Progress", progressBar(lp.ratio()), false);
        }

        List<String> lines = new ArrayList<>();
        for (String id : p.achievements()) {
            Optional<AchievementDef> def = achievements.find(id);
            def.ifPresent(d -> lines.add(d.icon + " " + d.title));
        }
        if (!lines.isEmpty()) {
            String body = String.join("\n", lines.subList(0, Math.min(SHOWN_ACHIEVEMENTS, lines.size())));
            if (lines.size() > SHOWN_ACHIEVEMENTS) body += "\n+ " + (lines.size() - SHOWN_ACHIEVEMENTS) + " more...";
            eb.addField("🏅 Achievements", body, false);
        }

        event.replyEmbeds(eb.build()).queue();
    }

    static String progressBar(double ratio) {
        double pct = Math.max(0, Math.min(1, ratio));

        int width = 20;
        int filled = (int) Math.floor(pct * width);

        return "`" + "█".repeat(filled) + "░".repeat(width - filled) + "` "
                + String.format(Locale.ENGLISH, "%.1f", pct * 100.0) + "%";
    }
}
