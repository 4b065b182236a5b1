package org.gudu0.xpbot.achievements;

import org.gudu0.xpbot.logging.LogService;
import org.gudu0.xpbot.progression.UserProgress;
import org.gudu0.xpbot.util.ConsoleLog;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Achievement rules. Evaluation itself is pure ({@link #newlyUnlocked}); {@link #evaluate} and
 * {@link #unlockById} apply the result to a {@link UserProgress} the caller holds under the store lock.
 * Unlocking is one-way and idempotent.
 */
public class AchievementsService {
    private final LogService logs;

    private final List<AchievementDef> defs = AchievementsCatalog.all();

    public AchievementsService(LogService logs) {
        this.logs = logs;
    }

    public List<AchievementDef> defs() {
        return defs;
    }

    public Optional<AchievementDef> find(String id) {
        for (AchievementDef d : defs) {
            if (d.id.equals(id)) return Optional.of(d);
        }
        return Optional.empty();
    }

    /** Rules for {@code trigger} that match {@code ctx} and are not in {@code held}. */
    public List<AchievementDef> newlyUnlocked(AchievementTrigger trigger, AchievementContext ctx, Set<String> held) {
        List<AchievementDef> out = new ArrayList<>();
        for (AchievementDef def : defs) {
            if (!def.triggers.contains(trigger)) continue;
            if (held.contains(def.id)) continue;
            if (def.condition.matches(ctx)) out.add(def);
        }
        return out;
    }

    /**
     * Evaluates every rule of {@code trigger} against the current values of {@code p} and unlocks matches.
     * @param rank leaderboard rank, or 0 when not computed
     */
    public List<AchievementDef> evaluate(AchievementTrigger trigger, long userId, UserProgress p, int rank) {
        AchievementContext ctx = AchievementContext.of(userId, p, rank);

        List<AchievementDef> unlocked = newlyUnlocked(trigger, ctx, p.achievements);
        for (AchievementDef def : unlocked) {
            p.unlock(def.id);
            announce(userId, def);
        }
        return unlocked;
    }

    /** For unlocks decided by code rather than a rule check (prestige transition). */
    public boolean unlockById(long userId, UserProgress p, String achievementId) {
        Optional<AchievementDef> def = find(achievementId);
        if (def.isEmpty()) {
            ConsoleLog.warn("Achievements", "Unknown achievement id=" + achievementId + " userId=" + userId);
            return false;
        }
        if (!p.unlock(achievementId)) return false;

        announce(userId, def.get());
        return true;
    }

    private void announce(long userId, AchievementDef def) {
        ConsoleLog.info("Achievements", "Unlocked id=" + def.id + " title=\"" + def.title + "\" userId=" + userId);
        if (def.logOnUnlock && logs != null) {
            logs.log("Achievement unlocked: " + def.icon + " " + def.title + ", by <@" + userId + ">!");
        }
    }
}
