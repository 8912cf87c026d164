package com.poweragent.common.model;

public enum PowerSource {
    BATTERY(3.0),
    PLUGGED(0.0);

    private final double severity;

    PowerSource(double severity) {
        this.severity = severity;
    }

    public double severity() {
        return severity;
    }
}
