package com.poweragent.common.decision;

import com.poweragent.common.model.SeverityClass;

import java.util.List;

/**
 * A row of the rule table: all conditions must hold for the rule to select its severity.
 * A rule without conditions always matches and is used as the table's final row.
 */
public record ThresholdRule(String name, List<RuleCondition> conditions, SeverityClass severity) {

    public ThresholdRule {
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
    }

    public boolean matches(FeatureVector features) {
        for (RuleCondition condition : conditions) {
            if (!condition.test(features)) {
                return false;
            }
        }
        return true;
    }
}
