package org.gudu0.xpbot.state;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.gudu0.xpbot.stats.DailySummary;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * On-disk layout of data/global/progress.json. User-indexed maps use the user id as a string key.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class BotSnapshot {
    @JsonProperty("user_xp")
    public Map<String, Double> userXp = new LinkedHashMap<>();

    @JsonProperty("user_level")
    public Map<String, Integer> userLevel = new LinkedHashMap<>();

    @JsonProperty("user_prestige")
    public Map<String, Integer> userPrestige = new LinkedHashMap<>();

    @JsonProperty("user_daily_streak")
    public Map<String, Integer> userDailyStreak = new LinkedHashMap<>();

    // yyyy-MM-dd
    @JsonProperty("user_last_daily")
    public Map<String, String> userLastDaily = new LinkedHashMap<>();

    @JsonProperty("user_message_count")
    public Map<String, Long> userMessageCount = new LinkedHashMap<>();

    @JsonProperty("user_voice_time")
    public Map<String, Double> userVoiceTime = new LinkedHashMap<>();

    @JsonProperty("user_achievements")
    public Map<String, List<String>> userAchievements = new LinkedHashMap<>();

    @JsonProperty("events_message")
    public String eventsMessage = ProgressionState.DEFAULT_EVENTS_MESSAGE;

    @JsonProperty("total_server_messages")
    public long totalServerMessages = 0;

    @JsonProperty("daily_stats")
    public DailyStatsSnapshot dailyStats = new DailyStatsSnapshot();

    @JsonProperty("daily_history")
    public Map<String, DailySummary> dailyHistory = new LinkedHashMap<>();

    @JsonProperty("previous_day")
    public String previousDay = "";

    @JsonProperty("previous_day_active_users")
    public List<Long> previousDayActiveUsers = new ArrayList<>();

    @JsonProperty("last_report_date")
    public String lastReportDate = "";

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class DailyStatsSnapshot {
        // "" before the first day
        @JsonProperty("date")
        public String date = "";

        @JsonProperty("messages")
        public long messages = 0;

        @JsonProperty("xp_gained")
        public double xpGained = 0;

        @JsonProperty("voice_time")
        public double voiceTime = 0;

        @JsonProperty("active_users")
        public List<Long> activeUsers = new ArrayList<>();

        @JsonProperty("level_ups")
        public int levelUps = 0;

        @JsonProperty("prestiges")
        public int prestiges = 0;

        @JsonProperty("new_members")
        public int newMembers = 0;
    }
}
