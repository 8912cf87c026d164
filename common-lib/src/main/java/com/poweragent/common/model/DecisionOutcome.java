package com.poweragent.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * What one tick decided and what it observed. {@code features} is the 11-value vector the
 * decision was made from, so the outcome can later become a training sample.
 */
public record DecisionOutcome(
    @JsonProperty("decisionId")           String                   decisionId,
    @JsonProperty("snapshotTimestamp")    Instant                  snapshotTimestamp,
    @JsonProperty("features")             List<Double>             features,
    @JsonProperty("severity")             SeverityClass            severity,
    @JsonProperty("decisionPath")         DecisionPath             decisionPath,
    @JsonProperty("actionsApplied")       List<OptimizationAction> actionsApplied,
    @JsonProperty("observedSavings")      double                   observedSavings,
    @JsonProperty("observedSatisfaction") double                   observedSatisfaction,
    @JsonProperty("timestamp")            Instant                  timestamp
) {

    public DecisionOutcome {
        features       = features == null ? List.of() : List.copyOf(features);
        actionsApplied = actionsApplied == null ? List.of() : List.copyOf(actionsApplied);
    }

    public double batteryPercent() {
        return features.isEmpty() ? 100.0 : features.get(0);
    }
}
