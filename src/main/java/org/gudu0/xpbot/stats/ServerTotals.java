package org.gudu0.xpbot.stats;

/** All-time totals across every tracked user. */
public record ServerTotals(long totalMessages, double totalXp, double totalVoiceMinutes, long totalPrestiges) {}
