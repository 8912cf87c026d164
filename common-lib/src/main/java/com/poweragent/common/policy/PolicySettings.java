package com.poweragent.common.policy;

import com.poweragent.common.decision.ActionTemplate;
import com.poweragent.common.model.ActionType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Limits applied by the {@link PolicyFilter}.
 *
 * <p>{@code emergencyTemplates} maps a target component to the action issued for it under
 * emergency when no sufficiently confident candidate exists. Its keys are also the default
 * set of known targets.
 */
public record PolicySettings(
    int                         maxActionsPerCycle,
    double                      maxPerformanceImpact,
    double                      emergencyConfidenceFloor,
    Map<String, ActionTemplate> emergencyTemplates
) {

    public PolicySettings {
        if (maxActionsPerCycle < 1) {
            throw new IllegalArgumentException("maxActionsPerCycle must be at least 1");
        }
        emergencyTemplates = Collections.unmodifiableMap(new LinkedHashMap<>(emergencyTemplates));
    }

    public static PolicySettings defaults() {
        return new PolicySettings(4, 0.7, 0.3, defaultEmergencyTemplates());
    }

    public static Map<String, ActionTemplate> defaultEmergencyTemplates() {
        Map<String, ActionTemplate> t = new LinkedHashMap<>();
        t.put("system",     new ActionTemplate(ActionType.CPU_THROTTLE,      "system",     1.0, 25, 0.6));
        t.put("display",    new ActionTemplate(ActionType.BRIGHTNESS_ADJUST, "display",    1.0, 21, 0.4));
        t.put("target_app", new ActionTemplate(ActionType.APP_THROTTLE,      "target_app", 1.0, 20, 0.5));
        t.put("network",    new ActionTemplate(ActionType.NETWORK_LIMIT,     "network",    1.0, 25, 0.2));
        t.put("background", new ActionTemplate(ActionType.PROCESS_PRIORITY,  "background", 1.0, 10, 0.2));
        return t;
    }
}
