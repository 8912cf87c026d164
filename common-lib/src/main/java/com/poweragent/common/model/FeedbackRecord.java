package com.poweragent.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * User feedback on the agent's recent behaviour, linked to the decision that was in
 * effect when it was given. Never mutated after creation.
 */
public record FeedbackRecord(
    @JsonProperty("satisfaction")          double  satisfaction,
    @JsonProperty("performanceAcceptable") boolean performanceAcceptable,
    @JsonProperty("batteryImprovement")    boolean batteryImprovement,
    @JsonProperty("comments")              String  comments,
    @JsonProperty("linkedDecisionId")      String  linkedDecisionId,
    @JsonProperty("timestamp")             Instant timestamp
) {

    public FeedbackRecord {
        satisfaction = Double.isNaN(satisfaction) ? 0.0 : Math.max(0.0, Math.min(1.0, satisfaction));
        comments     = comments == null ? "" : comments;
    }

    public boolean isSuccess() {
        return performanceAcceptable && batteryImprovement;
    }
}
