package org.gudu0.xpbot.progression;

/**
 * One granted award: the XP amount credited and what it did to the user's level.
 */
public record XpAward(double xp, AddXpResult result) {}
