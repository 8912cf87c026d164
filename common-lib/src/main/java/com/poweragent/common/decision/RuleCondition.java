package com.poweragent.common.decision;

/**
 * One comparison of a feature against a constant, e.g. {@code BATTERY_PERCENT < 15}.
 */
public record RuleCondition(FeatureMetric metric, Comparison comparison, double threshold) {

    public enum Comparison {
        LT, LE, GT, GE;

        boolean test(double value, double threshold) {
            return switch (this) {
                case LT -> value < threshold;
                case LE -> value <= threshold;
                case GT -> value > threshold;
                case GE -> value >= threshold;
            };
        }
    }

    public static RuleCondition below(FeatureMetric metric, double threshold) {
        return new RuleCondition(metric, Comparison.LT, threshold);
    }

    public static RuleCondition above(FeatureMetric metric, double threshold) {
        return new RuleCondition(metric, Comparison.GT, threshold);
    }

    public boolean test(FeatureVector features) {
        return comparison.test(features.get(metric), threshold);
    }
}
