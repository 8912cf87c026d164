package com.poweragent.common.model;

/**
 * Ordinal optimization aggressiveness, also the label space of the severity classifier.
 */
public enum SeverityClass {
    NONE,
    LIGHT,
    MODERATE,
    AGGRESSIVE;

    public int level() {
        return ordinal();
    }

    public static SeverityClass fromLevel(int level) {
        SeverityClass[] all = values();
        if (level < 0 || level >= all.length) {
            throw new IllegalArgumentException("Severity level out of range: " + level);
        }
        return all[level];
    }
}
