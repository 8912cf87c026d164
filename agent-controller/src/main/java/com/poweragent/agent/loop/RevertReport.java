package com.poweragent.agent.loop;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Result of reverting one active action on operator request.
 */
public record RevertReport(
    @JsonProperty("actionId")        String  actionId,
    @JsonProperty("targetComponent") String  targetComponent,
    @JsonProperty("success")         boolean success,
    @JsonProperty("pending")         boolean pending,
    @JsonProperty("message")         String  message
) {}
