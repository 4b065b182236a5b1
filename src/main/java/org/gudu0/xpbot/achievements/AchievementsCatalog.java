package org.gudu0.xpbot.achievements;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;

import static org.gudu0.xpbot.achievements.Conditions.*;

public final class AchievementsCatalog {
    private AchievementsCatalog() {}

    public static final String FIRST_MESSAGE = "first_message";
    public static final String FIRST_PRESTIGE = "first_prestige";
    public static final String TOP_3 = "top_3";

    public static List<AchievementDef> all() {
        return List.of(
                def(FIRST_MESSAGE, "First Steps", "Send your first message", "👶",
                        tr(AchievementTrigger.MESSAGE),
                        userStatAtLeast(StatKey.MESSAGES, 1)
                ),

                // XP milestones (xp since last prestige)
                def("100_xp", "Getting Started", "Reach 100 XP", "🌱",
                        tr(AchievementTrigger.XP_AWARD),
                        userStatAtLeast(StatKey.XP, 100)
                ),

                def("1000_xp", "Experienced", "Reach 1000 XP", "💪",
                        tr(AchievementTrigger.XP_AWARD),
                        userStatAtLeast(StatKey.XP, 1000)
                ),

                // Level milestones
                def("level_10", "Double Digits", "Reach level 10", "🔟",
                        tr(AchievementTrigger.XP_AWARD),
                        userStatAtLeast(StatKey.LEVEL, 10)
                ),

                def("level_25", "Quarter Century", "Reach level 25", "🎯",
                        tr(AchievementTrigger.XP_AWARD),
                        userStatAtLeast(StatKey.LEVEL, 25)
                ),

                // Also unlocked directly by the prestige transition
                def(FIRST_PRESTIGE, "Prestige Master", "Achieve your first prestige", "⭐",
                        tr(AchievementTrigger.XP_AWARD),
                        userStatAtLeast(StatKey.PRESTIGE, 1)
                ),

                def("10_day_streak", "Dedicated", "Maintain a 10-day streak", "🔥",
                        tr(AchievementTrigger.XP_AWARD),
                        userStatAtLeast(StatKey.DAILY_STREAK, 10)
                ),

                def("voice_hour", "Socializer", "Spend 60 minutes in voice", "🎤",
                        tr(AchievementTrigger.XP_AWARD),
                        userStatAtLeast(StatKey.VOICE_MINUTES, 60)
                ),

                def(TOP_3, "Podium Finish", "Reach top 3 on leaderboard", "🏆",
                        tr(AchievementTrigger.MESSAGE),
                        rankAtMost(3)
                )
        );
    }

    private static EnumSet<AchievementTrigger> tr(AchievementTrigger... t) {
        EnumSet<AchievementTrigger> s = EnumSet.noneOf(AchievementTrigger.class);
        s.addAll(Arrays.asList(t));
        return s;
    }

    private static AchievementDef def(String id, String title, String desc, String icon,
                                      EnumSet<AchievementTrigger> triggers,
                                      Condition cond) {
        return new AchievementDef(id, title, desc, icon, triggers, cond, true);
    }
}
