package com.poweragent.agent.loop;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.poweragent.common.model.OptimizationAction;

import java.time.Instant;

/**
 * Entry of the controller's active-action map, keyed by target component.
 */
public record ActiveAction(
    @JsonProperty("action")   OptimizationAction action,
    @JsonProperty("origin")   ActionOrigin       origin,
    @JsonProperty("status")   ActiveActionStatus status,
    @JsonProperty("issuedAt") Instant            issuedAt
) {

    public String targetComponent() {
        return action.targetComponent();
    }

    public String actionId() {
        return action.id();
    }

    public ActiveAction withStatus(ActiveActionStatus newStatus) {
        return new ActiveAction(action, origin, newStatus, issuedAt);
    }

    public ActiveAction withOrigin(ActionOrigin newOrigin) {
        return new ActiveAction(action, newOrigin, status, issuedAt);
    }
}
