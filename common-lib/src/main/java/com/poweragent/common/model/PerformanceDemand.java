package com.poweragent.common.model;

/**
 * Combined CPU + GPU load band.
 */
public enum PerformanceDemand {
    IDLE(0.0),
    LIGHT(1.0),
    MODERATE(2.0),
    HEAVY(3.0);

    private final double severity;

    PerformanceDemand(double severity) {
        this.severity = severity;
    }

    public double severity() {
        return severity;
    }
}
