package com.poweragent.common.exception;

/**
 * An actuator call for one action failed or timed out after its retries.
 */
public class ActuationException extends PowerAgentException {
    private final String actionId;

    public ActuationException(String actionId, String message) {
        super("Actuator", "action=" + actionId + " " + message);
        this.actionId = actionId;
    }

    public ActuationException(String actionId, String message, Throwable cause) {
        super("Actuator", "action=" + actionId + " " + message, cause);
        this.actionId = actionId;
    }

    public String getActionId() {
        return actionId;
    }
}
