package com.poweragent.common.model;

/**
 * Qualitative battery band. {@link #severity()} feeds the context score.
 */
public enum BatteryLevel {
    CRITICAL(3.0),
    LOW(2.25),
    MEDIUM(1.5),
    HIGH(0.75),
    FULL(0.0);

    private final double severity;

    BatteryLevel(double severity) {
        this.severity = severity;
    }

    public double severity() {
        return severity;
    }
}
