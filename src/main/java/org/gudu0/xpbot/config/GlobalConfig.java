package org.gudu0.xpbot.config;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.DateTimeException;
import java.time.ZoneId;

/**
 * Bot config (one per bot process).
 * Stored at: data/global/config.json
 * <p>
 * Keep DISCORD_TOKEN in an environment variable.
 */
public class GlobalConfig {
    /** The single user allowed to run admin-only commands (/setevents). */
    public String adminUserId = "0";

    /** Channel (by name) that receives the daily stats report. */
    public String statsChannelName = "daily-stats";

    /** Channel (by name) for welcome messages on member join. */
    public String greetingChannelName = "general";

    /** Channel (by name) for level-up/prestige announcements that have no source channel (voice). */
    public String announceChannelName = "general";

    /** Optional Discord channel/thread that mirrors bot logs. */
    public String logChannelId = "";

    /** Calendar days (streaks, daily stats) are computed in this zone. */
    public String timeZone = "UTC";

    public long autosaveSeconds = 300;

    /** How often the daily report checks whether it is due. */
    public long statsCheckSeconds = 60;

    /** Local hour (0-23) at or after which the previous day's report is posted. */
    public int statsReportHour = 0;

    public int leaderboardSize = 10;

    /** How many of the day's active users the daily report lists. */
    public int statsTopCount = 5;

    public ProgressionConfig progression = new ProgressionConfig();

    @JsonIgnore
    public ZoneId zone() {
        try {
            return ZoneId.of(timeZone);
        } catch (DateTimeException e) {
            throw new IllegalStateException("Invalid timeZone in config: " + timeZone, e);
        }
    }

    @JsonIgnore
    public long adminUserIdLong() {
        try {
            return Long.parseLong(adminUserId);
        } catch (NumberFormatException e) {
            return 0L;
        }
    }

    public void validate() {
        zone();
        if (statsReportHour < 0 || statsReportHour > 23) {
            throw new IllegalStateException("statsReportHour must be 0-23, got " + statsReportHour);
        }
        if (autosaveSeconds <= 0 || statsCheckSeconds <= 0) {
            throw new IllegalStateException("autosaveSeconds and statsCheckSeconds must be > 0");
        }
        if (leaderboardSize <= 0 || statsTopCount < 0) {
            throw new IllegalStateException("leaderboardSize must be > 0 and statsTopCount >= 0");
        }
        if (progression == null) {
            throw new IllegalStateException("progression section missing from config");
        }
        progression.validate();
    }
}
