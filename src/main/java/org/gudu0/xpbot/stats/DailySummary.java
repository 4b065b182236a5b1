package org.gudu0.xpbot.stats;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Frozen totals of one finished day (as stored in daily_history).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DailySummary(
        @JsonProperty("messages") long messages,
        @JsonProperty("xp_gained") double xpGained,
        @JsonProperty("voice_time") double voiceMinutes,
        @JsonProperty("active_users") int activeUsers,
        @JsonProperty("level_ups") int levelUps,
        @JsonProperty("prestiges") int prestiges,
        @JsonProperty("new_members") int newMembers
) {
    public static final DailySummary EMPTY = new DailySummary(0, 0, 0, 0, 0, 0, 0);
}
