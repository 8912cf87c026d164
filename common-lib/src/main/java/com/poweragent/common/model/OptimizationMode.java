package com.poweragent.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * User-selected aggressiveness. Candidates below {@code minConfidence} are dropped and
 * intensities above {@code maxIntensity} are clamped, except under emergency.
 */
public record OptimizationMode(
    @JsonProperty("name")          ModeName name,
    @JsonProperty("maxIntensity")  double   maxIntensity,
    @JsonProperty("minConfidence") double   minConfidence
) {

    public OptimizationMode {
        if (name == null) {
            throw new IllegalArgumentException("Mode name is required");
        }
        maxIntensity  = Math.max(0.0, Math.min(1.0, maxIntensity));
        minConfidence = Math.max(0.0, Math.min(1.0, minConfidence));
    }

    public static OptimizationMode conservative() {
        return new OptimizationMode(ModeName.CONSERVATIVE, 0.3, 0.8);
    }

    public static OptimizationMode balanced() {
        return new OptimizationMode(ModeName.BALANCED, 0.6, 0.7);
    }

    public static OptimizationMode aggressive() {
        return new OptimizationMode(ModeName.AGGRESSIVE, 0.9, 0.6);
    }
}
