package com.poweragent.agent.loop;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * An apply or revert that exhausted its retries.
 */
public record StuckAction(
    @JsonProperty("actionId")        String  actionId,
    @JsonProperty("targetComponent") String  targetComponent,
    @JsonProperty("operation")       String  operation,
    @JsonProperty("message")         String  message,
    @JsonProperty("at")              Instant at
) {}
