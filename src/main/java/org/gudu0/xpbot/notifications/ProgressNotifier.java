package org.gudu0.xpbot.notifications;

import org.gudu0.xpbot.stats.DailyReport;

/**
 * Outbound side of the engine. Implementations must not block: delivery is fire-and-forget and
 * is always invoked outside the state lock.
 */
public interface ProgressNotifier {

    void notifyProgress(ProgressNotification notification);

    void reportDailyStats(DailyReport report);
}
