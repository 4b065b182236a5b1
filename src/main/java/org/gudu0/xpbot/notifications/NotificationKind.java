package org.gudu0.xpbot.notifications;

public enum NotificationKind {
    LEVEL_UP,
    PRESTIGE
}
