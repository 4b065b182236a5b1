package org.gudu0.xpbot.progression;

public enum XpSource {
    MESSAGE,
    VOICE
}
