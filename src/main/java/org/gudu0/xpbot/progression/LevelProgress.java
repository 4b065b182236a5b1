package org.gudu0.xpbot.progression;

public record LevelProgress(int level, double progress, long requirementForNext) {

    public boolean hasNextLevel() {
        return requirementForNext > 0;
    }

    /** 0..1; 1 when there is no next level. */
    public double ratio() {
        if (requirementForNext <= 0) return 1.0;
        double r = progress / (double) requirementForNext;
        return Math.max(0.0, Math.min(1.0, r));
    }
}
