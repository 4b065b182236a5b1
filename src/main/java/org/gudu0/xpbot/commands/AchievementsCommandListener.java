package org.gudu0.xpbot.commands;

import net.dv8tion.jda.api.EmbedBuilder;
import net.dv8tion.jda.api.events.interaction.command.SlashCommandInteractionEvent;
import net.dv8tion.jda.api.hooks.ListenerAdapter;
import org.gudu0.xpbot.achievements.AchievementDef;
import org.gudu0.xpbot.achievements.AchievementsService;
import org.gudu0.xpbot.notifications.Embeds;
import org.gudu0.xpbot.progression.ProfileService;
import org.jetbrains.annotations.NotNull;

import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

public class AchievementsCommandListener extends ListenerAdapter implements CommandGuards {
    private final AchievementsService achievements;
    private final ProfileService profiles;

    public AchievementsCommandListener(AchievementsService achievements, ProfileService profiles) {
        this.achievements = achievements;
        this.profiles = profiles;
    }

    @Override
    public void onSlashCommandInteraction(@NotNull SlashCommandInteractionEvent event) {
        if (!event.getName().equals("achievements")) return;
        logInvocation(event);

        long userId = event.getOption("user") != null
                ? Objects.requireNonNull(event.getOption("user")).getAsUser().getIdLong()
                : event.getUser().getIdLong();

        Set<String> held = new HashSet<>(profiles.profile(userId).achievements());

        StringBuilder sb = new StringBuilder();
        int unlocked = 0;
        for (AchievementDef def : achievements.defs()) {
            boolean has = held.contains(def.id);
            if (has) unlocked++;
            sb.append(has ? "✅ " : "🔒 ")
                    .append(def.icon).append(" **").append(def.title).append("** - ")
                    .append(def.description).append("\n");
        }

        EmbedBuilder eb = new EmbedBuilder()
                .setTitle("🏅 Achievements")
                .setDescription("User: <@" + userId + ">\nUnlocked: **" + unlocked + "** / **" + achievements.defs().size() + "**")
                .addField("Catalog", sb.toString(), false)
                .setColor(Embeds.BRAND);

        event.replyEmbeds(eb.build()).setEphemeral(true).queue();
    }
}
