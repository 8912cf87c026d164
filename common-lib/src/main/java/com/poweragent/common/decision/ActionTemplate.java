package com.poweragent.common.decision;

import com.poweragent.common.model.ActionType;

/**
 * Per-target action produced for a severity class before context scaling.
 */
public record ActionTemplate(
    ActionType actionType,
    String     targetComponent,
    double     baseIntensity,
    double     baseSavings,
    double     performanceImpact
) {}
