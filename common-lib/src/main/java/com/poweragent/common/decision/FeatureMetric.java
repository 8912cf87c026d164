package com.poweragent.common.decision;

/**
 * Positions of the decision feature vector. The order is significant: it is the column
 * order the severity classifier was trained on.
 */
public enum FeatureMetric {
    BATTERY_PERCENT,
    CPU_PERCENT,
    MEMORY_PERCENT,
    GPU_PERCENT,
    NETWORK_ACTIVITY,
    SCREEN_BRIGHTNESS,
    TIME_OF_DAY,
    POWER_PLUGGED,
    TARGET_APP_CPU,
    TARGET_APP_MEMORY,
    CONTEXT_SCORE;

    public static final int COUNT = values().length;

    public int index() {
        return ordinal();
    }
}
