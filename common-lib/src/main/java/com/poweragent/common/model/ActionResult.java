package com.poweragent.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of a single apply or revert call against an actuator.
 */
public record ActionResult(
    @JsonProperty("success") boolean success,
    @JsonProperty("message") String  message
) {

    public static ActionResult ok(String message) {
        return new ActionResult(true, message);
    }

    public static ActionResult failed(String message) {
        return new ActionResult(false, message);
    }
}
