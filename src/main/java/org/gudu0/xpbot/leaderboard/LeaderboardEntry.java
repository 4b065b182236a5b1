package org.gudu0.xpbot.leaderboard;

public record LeaderboardEntry(long userId, double score) {}
