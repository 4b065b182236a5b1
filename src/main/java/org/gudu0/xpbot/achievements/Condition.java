package org.gudu0.xpbot.achievements;

@FunctionalInterface
public interface Condition {
    boolean matches(AchievementContext ctx);
}
