package org.gudu0.xpbot.progression;

import org.gudu0.xpbot.achievements.AchievementTrigger;
import org.gudu0.xpbot.achievements.AchievementsCatalog;
import org.gudu0.xpbot.achievements.AchievementsService;
import org.gudu0.xpbot.config.ProgressionConfig;
import org.gudu0.xpbot.leaderboard.Leaderboard;
import org.gudu0.xpbot.notifications.EventContext;
import org.gudu0.xpbot.notifications.NotificationKind;
import org.gudu0.xpbot.notifications.ProgressNotification;
import org.gudu0.xpbot.notifications.ProgressNotifier;
import org.gudu0.xpbot.state.StateStore;
import org.gudu0.xpbot.stats.DailyStatsAggregator;
import org.gudu0.xpbot.util.ConsoleLog;
import org.jetbrains.annotations.Nullable;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Optional;
import java.util.Random;

/**
 * Turns inbound activity into XP, levels and prestige.
 * <p>
 * Every mutation runs under {@link StateStore#lock}; notifications are built inside the lock and
 * handed to the {@link ProgressNotifier} after it is released.
 */
public class XpAwardService {
    private final StateStore store;
    private final ProgressionCalculator calc;
    private final AchievementsService achievements;
    private final DailyStatsAggregator daily;
    private final Leaderboard leaderboard;
    private final ProgressNotifier notifier;
    private final ProgressionConfig cfg;
    private final ZoneId zone;
    private final Random random;

    public XpAwardService(StateStore store,
                          ProgressionCalculator calc,
                          AchievementsService achievements,
                          DailyStatsAggregator daily,
                          Leaderboard leaderboard,
                          ProgressNotifier notifier,
                          ProgressionConfig cfg,
                          ZoneId zone,
                          Random random) {
        this.store = store;
        this.calc = calc;
        this.achievements = achievements;
        this.daily = daily;
        this.leaderboard = leaderboard;
        this.notifier = notifier;
        this.cfg = cfg;
        this.zone = zone;
        this.random = random;
    }

    // --- Inbound events ---

    /** Every guild message counts toward the server total; only some of them earn XP. */
    public void onMessage(long userId, EventContext ctx, Instant now) {
        ProgressNotification n = null;
        synchronized (store.lock) {
            store.state().totalServerMessages++;
            store.markDirty();

            Optional<XpAward> award = awardMessageXp(userId, now);
            if (award.isPresent()) {
                n = toNotification(userId, award.get().result(), XpSource.MESSAGE, ctx);
            }
        }
        dispatch(n);
    }

    public void onVoiceJoin(long userId, Instant now) {
        synchronized (store.lock) {
            Instant previous = store.state().voiceSessions.put(userId, now);
            if (previous != null) {
                ConsoleLog.debug("XpAward", "Voice session restarted without a leave userId=" + userId);
            }
        }
    }

    /** Closes the user's voice session; leaving without a recorded join is ignored. */
    public void onVoiceLeave(long userId, EventContext ctx, Instant now) {
        ProgressNotification n = null;
        synchronized (store.lock) {
            Instant start = store.state().voiceSessions.remove(userId);
            if (start == null) {
                ConsoleLog.debug("XpAward", "Voice leave without join userId=" + userId);
                return;
            }

            double minutes = Math.max(0, Duration.between(start, now).toMillis() / 60_000.0);
            Optional<XpAward> award = awardVoiceXp(userId, minutes, now);
            if (award.isPresent()) {
                n = toNotification(userId, award.get().result(), XpSource.VOICE, ctx);
            }
        }
        dispatch(n);
    }

    public void onMemberJoin(Instant now) {
        daily.record(null, 0, 0, 0, false, false, true, today(now));
    }

    // --- Award paths ---

    /**
     * Message XP with daily bonus, streak bonus and the random flat bonus.
     * @return empty while the user is on cooldown
     */
    public Optional<XpAward> awardMessageXp(long userId, Instant now) {
        synchronized (store.lock) {
            UserProgress p = store.user(userId);

            if (p.lastMessageAt != null
                    && Duration.between(p.lastMessageAt, now).toMillis() < cfg.antispamCooldownSeconds * 1000L) {
                ConsoleLog.debug("XpAward", "Cooldown active userId=" + userId);
                return Optional.empty();
            }

            LocalDate today = today(now);
            double multiplier = 1.0;
            if (!today.equals(p.lastDailyDate)) {
                multiplier = cfg.dailyBonusMultiplier;
                p.dailyStreak = today.minusDays(1).equals(p.lastDailyDate) ? p.dailyStreak + 1 : 1;
                p.lastDailyDate = today;
            }
            if (p.dailyStreak >= cfg.streakBonusDays) {
                multiplier *= cfg.streakBonusMultiplier;
            }

            // flat bonus is added after the multipliers
            double xp = cfg.baseMessageXp * multiplier + rollBonus();

            AddXpResult result = xp > 0 ? addXp(userId, xp, now) : AddXpResult.unchanged(p.level);

            p.messageCount++;
            p.lastMessageAt = now;
            daily.record(userId, 1, xp, 0, false, false, false, today);

            achievements.evaluate(AchievementTrigger.MESSAGE, userId, p, leaderboard.rank(userId));
            store.markDirty();

            ConsoleLog.debug("XpAward", "Message xp=" + xp + " userId=" + userId + " level=" + result.newLevel()
                    + " streak=" + p.dailyStreak);
            return Optional.of(new XpAward(xp, result));
        }
    }

    /**
     * Voice XP for a finished session.
     * @return empty for sessions shorter than one minute
     */
    public Optional<XpAward> awardVoiceXp(long userId, double minutes, Instant now) {
        if (!(minutes >= 1.0) || Double.isInfinite(minutes)) {
            ConsoleLog.debug("XpAward", "Voice session too short for XP userId=" + userId + " minutes=" + minutes);
            return Optional.empty();
        }

        synchronized (store.lock) {
            UserProgress p = store.user(userId);
            // counted before the award so voice achievements see this session
            p.voiceMinutes += minutes;

            double xp = minutes * cfg.voiceXpPerMinute;
            AddXpResult result;
            if (xp > 0) {
                result = addXp(userId, xp, now);
            } else {
                achievements.evaluate(AchievementTrigger.XP_AWARD, userId, p, 0);
                result = AddXpResult.unchanged(p.level);
            }

            daily.record(userId, 0, xp, minutes, false, false, false, today(now));
            store.markDirty();

            ConsoleLog.debug("XpAward", "Voice xp=" + xp + " minutes=" + minutes + " userId=" + userId);
            return Optional.of(new XpAward(xp, result));
        }
    }

    /**
     * The core transition. Achievements see the post-award values before any prestige reset.
     * Crossing the prestige threshold resets xp and level and discards the overflow.
     */
    public AddXpResult addXp(long userId, double amount, Instant now) {
        synchronized (store.lock) {
            UserProgress p = store.user(userId);
            if (!(amount > 0) || Double.isInfinite(amount)) {
                ConsoleLog.warn("XpAward", "Rejected xp amount=" + amount + " userId=" + userId);
                return AddXpResult.unchanged(p.level);
            }

            int oldLevel = p.level;
            p.xp += amount;
            int newLevel = calc.levelFromXp(p.xp);
            p.level = newLevel;

            achievements.evaluate(AchievementTrigger.XP_AWARD, userId, p, 0);

            int threshold = calc.prestigeThreshold();
            boolean prestiged = false;
            if (newLevel >= threshold && oldLevel < threshold) {
                p.prestige++;
                p.xp = 0;
                p.level = 0;
                newLevel = 0;
                prestiged = true;
                achievements.unlockById(userId, p, AchievementsCatalog.FIRST_PRESTIGE);
                ConsoleLog.info("XpAward", "Prestige userId=" + userId + " prestige=" + p.prestige);
            }

            boolean leveledUp = !prestiged && newLevel > oldLevel;
            if (leveledUp || prestiged) {
                daily.record(userId, 0, 0, 0, leveledUp, prestiged, false, today(now));
            }

            store.markDirty();
            return new AddXpResult(leveledUp, newLevel, prestiged);
        }
    }

    // --- Helpers ---

    private double rollBonus() {
        if (random.nextDouble() < cfg.bonusXpChance) {
            return cfg.bonusXpMin + random.nextInt(cfg.bonusXpMax - cfg.bonusXpMin + 1);
        }
        return 0;
    }

    private LocalDate today(Instant now) {
        return LocalDate.ofInstant(now, zone);
    }

    @Nullable
    private ProgressNotification toNotification(long userId, AddXpResult r, XpSource source, EventContext ctx) {
        int prestige = store.userOrDefault(userId).prestige;
        if (r.prestiged()) {
            return new ProgressNotification(NotificationKind.PRESTIGE, userId, r.newLevel(), prestige, source, ctx);
        }
        if (r.leveledUp()) {
            return new ProgressNotification(NotificationKind.LEVEL_UP, userId, r.newLevel(), prestige, source, ctx);
        }
        return null;
    }

    private void dispatch(@Nullable ProgressNotification n) {
        if (n == null) return;
        try {
            notifier.notifyProgress(n);
        } catch (RuntimeException e) {
            ConsoleLog.error("XpAward", "Notifier failed for " + n.kind() + " userId=" + n.userId() + ": " + e.getMessage(), e);
        }
    }
}
