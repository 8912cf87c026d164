package com.poweragent.common.exception;

/**
 * Base of the agent's unchecked failures. The message is prefixed with the reporting
 * component in brackets, matching the log format, e.g. {@code [Actuator] action=... timed out}.
 * Callers record the matching {@link FailureKind} and keep the loop running.
 */
public class PowerAgentException extends RuntimeException {
    private final String component;

    public PowerAgentException(String component, String message) {
        super("[" + component + "] " + message);
        this.component = component;
    }

    public PowerAgentException(String component, String message, Throwable cause) {
        super("[" + component + "] " + message, cause);
        this.component = component;
    }

    public String getComponent() {
        return component;
    }
}
