package com.poweragent.common.decision;

import com.poweragent.common.model.DecisionPath;
import com.poweragent.common.model.OptimizationAction;
import com.poweragent.common.model.SeverityClass;

import java.util.List;

/**
 * Output of one {@link DecisionEngine#decide} call.
 *
 * <ul>
 *   <li>{@code candidates}: proposed actions, highest estimated savings first.</li>
 *   <li>{@code probabilities}: per-class probabilities in {@link SeverityClass} order.</li>
 *   <li>{@code source}: {@link DecisionPath#LEARNED} or {@link DecisionPath#RULE}.</li>
 *   <li>{@code features}: the vector the decision was made from.</li>
 *   <li>{@code modelUnavailable}: true when no usable model was loaded for this call.</li>
 * </ul>
 */
public record DecisionResult(
    List<OptimizationAction> candidates,
    List<Double>             probabilities,
    DecisionPath             source,
    SeverityClass            severity,
    FeatureVector            features,
    boolean                  modelUnavailable
) {

    public DecisionResult {
        candidates    = List.copyOf(candidates);
        probabilities = List.copyOf(probabilities);
    }
}
