package com.poweragent.common.decision;

/**
 * Fixed action proposed while the user is away, independent of the severity class.
 * A positive {@code minNetworkMb} restricts the rule to ticks whose network traffic
 * exceeds it.
 */
public record AwayRule(
    ActionTemplate template,
    double         confidence,
    double         minNetworkMb
) {

    public boolean appliesTo(FeatureVector features) {
        return minNetworkMb <= 0.0 || features.get(FeatureMetric.NETWORK_ACTIVITY) > minNetworkMb;
    }
}
