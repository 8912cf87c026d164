package com.poweragent.common.model;

/**
 * Presence of the user inferred from the trailing snapshot window.
 */
public enum UserActivity {
    ACTIVE(0.0),
    IDLE(1.5),
    AWAY(3.0);

    private final double severity;

    UserActivity(double severity) {
        this.severity = severity;
    }

    public double severity() {
        return severity;
    }
}
