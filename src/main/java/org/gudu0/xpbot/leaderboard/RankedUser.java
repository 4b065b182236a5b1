package org.gudu0.xpbot.leaderboard;

/** A leaderboard row with the level and prestige shown next to the name. */
public record RankedUser(long userId, double score, int level, int prestige) {}
