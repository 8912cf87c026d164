package com.poweragent.common.decision;

import com.poweragent.common.model.DecisionPath;
import com.poweragent.common.model.SeverityClass;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Ordered threshold table, evaluated top to bottom; the first matching row wins.
 * Always answers: when no row matches the result is {@link SeverityClass#NONE}.
 */
public final class RuleDecisionSource implements DecisionSource {

    private final List<ThresholdRule> rules;
    private final double              ruleConfidence;

    public RuleDecisionSource(List<ThresholdRule> rules, double ruleConfidence) {
        this.rules          = List.copyOf(rules);
        this.ruleConfidence = ruleConfidence;
    }

    @Override
    public Optional<SeverityDecision> evaluate(FeatureVector features) {
        SeverityClass severity = SeverityClass.NONE;
        for (ThresholdRule rule : rules) {
            if (rule.matches(features)) {
                severity = rule.severity();
                break;
            }
        }
        return Optional.of(new SeverityDecision(severity, ruleConfidence, oneHot(severity), DecisionPath.RULE));
    }

    private static List<Double> oneHot(SeverityClass severity) {
        List<Double> p = new ArrayList<>(SeverityClass.values().length);
        for (SeverityClass c : SeverityClass.values()) {
            p.add(c == severity ? 1.0 : 0.0);
        }
        return p;
    }
}
