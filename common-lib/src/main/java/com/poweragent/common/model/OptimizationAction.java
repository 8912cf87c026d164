package com.poweragent.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.UUID;

/**
 * A concrete optimization proposed for, or applied to, one target component.
 *
 * <p>{@code intensity}, {@code performanceImpact} and {@code confidence} are clamped to
 * [0, 1] on construction; {@code estimatedSavings} is a percentage and never negative.
 */
public record OptimizationAction(
    @JsonProperty("id")                String     id,
    @JsonProperty("actionType")        ActionType actionType,
    @JsonProperty("intensity")         double     intensity,
    @JsonProperty("targetComponent")   String     targetComponent,
    @JsonProperty("estimatedSavings")  double     estimatedSavings,
    @JsonProperty("performanceImpact") double     performanceImpact,
    @JsonProperty("confidence")        double     confidence,
    @JsonProperty("createdAt")         Instant    createdAt
) {

    public OptimizationAction {
        intensity         = clampUnit(intensity);
        performanceImpact = clampUnit(performanceImpact);
        confidence        = clampUnit(confidence);
        estimatedSavings  = Math.max(0.0, estimatedSavings);
    }

    public static OptimizationAction create(ActionType actionType, double intensity, String targetComponent,
                                            double estimatedSavings, double performanceImpact,
                                            double confidence, Instant createdAt) {
        return new OptimizationAction(UUID.randomUUID().toString(), actionType, intensity, targetComponent,
            estimatedSavings, performanceImpact, confidence, createdAt);
    }

    /**
     * Copy at a different intensity. Savings scale proportionally with intensity.
     */
    public OptimizationAction withIntensity(double newIntensity) {
        double clamped = clampUnit(newIntensity);
        double savings = intensity > 0.0 ? estimatedSavings * (clamped / intensity) : estimatedSavings;
        return new OptimizationAction(id, actionType, clamped, targetComponent, savings,
            performanceImpact, confidence, createdAt);
    }

    public OptimizationAction withConfidence(double newConfidence) {
        return new OptimizationAction(id, actionType, intensity, targetComponent, estimatedSavings,
            performanceImpact, newConfidence, createdAt);
    }

    /**
     * True when both actions would put the target in the same state, ignoring identity
     * and intensity differences up to {@code tolerance}.
     */
    public boolean isEquivalentTo(OptimizationAction other, double tolerance) {
        return other != null
            && actionType == other.actionType
            && targetComponent.equals(other.targetComponent)
            && Math.abs(intensity - other.intensity) <= tolerance;
    }

    private static double clampUnit(double value) {
        if (Double.isNaN(value)) return 0.0;
        return Math.max(0.0, Math.min(1.0, value));
    }
}
