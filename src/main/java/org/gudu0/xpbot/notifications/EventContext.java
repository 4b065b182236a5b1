package org.gudu0.xpbot.notifications;

/**
 * Where an event came from, passed back unchanged with any notification it causes.
 * {@code channelId} is 0 when there is no source text channel (voice).
 */
public record EventContext(long guildId, long channelId) {

    public static EventContext voice(long guildId) {
        return new EventContext(guildId, 0L);
    }

    public boolean hasChannel() {
        return channelId != 0L;
    }
}
