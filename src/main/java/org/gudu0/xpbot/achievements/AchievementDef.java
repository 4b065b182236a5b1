package org.gudu0.xpbot.achievements;

import java.util.EnumSet;

@SuppressWarnings("ClassCanBeRecord")
public class AchievementDef {
    public final String id;
    public final String title;
    public final String description;
    public final String icon;
    public final EnumSet<AchievementTrigger> triggers;
    public final Condition condition;

    public final boolean logOnUnlock;

    public AchievementDef(String id, String title, String description, String icon,
                          EnumSet<AchievementTrigger> triggers,
                          Condition condition,
                          boolean logOnUnlock) {
        this.id = id;
        this.title = title;
        this.description = description;
        this.icon = icon;
        this.triggers = triggers;
        this.condition = condition;
        this.logOnUnlock = logOnUnlock;
    }
}
