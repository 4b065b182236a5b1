package org.gudu0.xpbot.stats;

import org.gudu0.xpbot.leaderboard.RankedUser;

import java.util.List;

/**
 * What the periodic report posts: the finished day compared with the day before, that day's most
 * active users (best first) and all-time totals.
 */
public record DailyReport(StatsComparison comparison, List<RankedUser> topUsers, ServerTotals totals) {}
