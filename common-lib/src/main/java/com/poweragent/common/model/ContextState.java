package com.poweragent.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Qualitative reading of the current machine state, one per tick.
 *
 * <p>{@code contextScore} lies in [0, 3] and never decreases when any of the
 * other fields moves to a more severe value.
 */
public record ContextState(
    @JsonProperty("batteryLevel")      BatteryLevel      batteryLevel,
    @JsonProperty("performanceDemand") PerformanceDemand performanceDemand,
    @JsonProperty("userActivity")      UserActivity      userActivity,
    @JsonProperty("powerSource")       PowerSource       powerSource,
    @JsonProperty("timeOfDay")         TimeOfDay         timeOfDay,
    @JsonProperty("contextScore")      double            contextScore,
    @JsonProperty("timestamp")         Instant           timestamp
) {

    public boolean isCritical() {
        return batteryLevel == BatteryLevel.CRITICAL;
    }
}
