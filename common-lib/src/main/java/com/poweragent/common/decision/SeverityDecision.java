package com.poweragent.common.decision;

import com.poweragent.common.model.DecisionPath;
import com.poweragent.common.model.SeverityClass;

import java.util.List;

/**
 * Answer of a {@link DecisionSource}: the chosen class, how sure the source is about it
 * and the per-class probabilities in {@link SeverityClass} order (one-hot for rules).
 */
public record SeverityDecision(
    SeverityClass severity,
    double        classConfidence,
    List<Double>  probabilities,
    DecisionPath  path
) {

    public SeverityDecision {
        probabilities = probabilities == null ? List.of() : List.copyOf(probabilities);
    }
}
