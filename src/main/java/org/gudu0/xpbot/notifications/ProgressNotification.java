package org.gudu0.xpbot.notifications;

import org.gudu0.xpbot.progression.XpSource;

/**
 * @param level    level reached (0 after a prestige)
 * @param prestige prestige count after the award
 */
public record ProgressNotification(NotificationKind kind, long userId, int level, int prestige,
                                   XpSource source, EventContext context) {}
