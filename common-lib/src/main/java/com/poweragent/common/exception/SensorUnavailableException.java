package com.poweragent.common.exception;

/**
 * A metric could not be read this cycle. The sampler substitutes the metric's default.
 */
public class SensorUnavailableException extends PowerAgentException {
    private final String sensor;

    public SensorUnavailableException(String sensor, String message) {
        super("Monitor", sensor + ": " + message);
        this.sensor = sensor;
    }

    public SensorUnavailableException(String sensor, String message, Throwable cause) {
        super("Monitor", sensor + ": " + message, cause);
        this.sensor = sensor;
    }

    public String getSensor() {
        return sensor;
    }
}
