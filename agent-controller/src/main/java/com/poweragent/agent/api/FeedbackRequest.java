package com.poweragent.agent.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of {@code POST /api/v1/agent/feedback}. Satisfaction outside [0, 1] is clamped.
 */
public record FeedbackRequest(
    @JsonProperty("satisfaction")          double  satisfaction,
    @JsonProperty("performanceAcceptable") boolean performanceAcceptable,
    @JsonProperty("batteryImprovement")    boolean batteryImprovement,
    @JsonProperty("comments")              String  comments
) {}
