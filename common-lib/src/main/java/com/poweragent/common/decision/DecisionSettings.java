package com.poweragent.common.decision;

import com.poweragent.common.model.ActionType;
import com.poweragent.common.model.SeverityClass;

import java.time.ZoneId;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Tunables of the {@link DecisionEngine}: the rule table, the per-severity templates and
 * intensity bands, and the learned-source gates.
 *
 * <p>{@code appPriorityCpu} marks the target application as critical: above it no
 * {@link ActionType#APP_THROTTLE} is proposed. {@code awayRules} are added on battery
 * power while the user is away.
 *
 * <p>Collections are copied on construction; the record is safe to share between threads.
 */
public record DecisionSettings(
    List<ThresholdRule>                        rules,
    Map<SeverityClass, List<ActionTemplate>>   templates,
    Map<SeverityClass, SeverityBand>           bands,
    double                                     ruleConfidence,
    double                                     emergencyBoost,
    int                                        minTrainingSamples,
    double                                     probabilityFloor,
    double                                     intensityLow,
    double                                     intensityHigh,
    double                                     contextWeight,
    double                                     appPriorityCpu,
    List<AwayRule>                             awayRules,
    ZoneId                                     zone
) {

    public DecisionSettings {
        rules = List.copyOf(rules);
        Map<SeverityClass, List<ActionTemplate>> t = new EnumMap<>(SeverityClass.class);
        templates.forEach((k, v) -> t.put(k, List.copyOf(v)));
        templates = Map.copyOf(t);
        bands = Map.copyOf(bands);
        awayRules = List.copyOf(awayRules);
        zone  = zone == null ? ZoneId.systemDefault() : zone;
    }

    public List<ActionTemplate> templatesFor(SeverityClass severity) {
        return templates.getOrDefault(severity, List.of());
    }

    public DecisionSettings withRules(List<ThresholdRule> newRules) {
        return new DecisionSettings(newRules, templates, bands, ruleConfidence, emergencyBoost,
            minTrainingSamples, probabilityFloor, intensityLow, intensityHigh, contextWeight,
            appPriorityCpu, awayRules, zone);
    }

    public DecisionSettings withZone(ZoneId newZone) {
        return new DecisionSettings(rules, templates, bands, ruleConfidence, emergencyBoost,
            minTrainingSamples, probabilityFloor, intensityLow, intensityHigh, contextWeight,
            appPriorityCpu, awayRules, newZone);
    }

    public static DecisionSettings defaults() {
        return new DecisionSettings(defaultRules(), defaultTemplates(), defaultBands(),
            0.75, 1.2, 100, 0.5, 0.85, 1.15, 0.15, 20.0, defaultAwayRules(), ZoneId.systemDefault());
    }

    // ── defaults ───────────────────────────────────────────────────────────

    public static List<ThresholdRule> defaultRules() {
        return List.of(
            new ThresholdRule("battery-critical",
                List.of(RuleCondition.below(FeatureMetric.BATTERY_PERCENT, 15)), SeverityClass.AGGRESSIVE),
            new ThresholdRule("battery-low",
                List.of(RuleCondition.below(FeatureMetric.BATTERY_PERCENT, 30)), SeverityClass.MODERATE),
            new ThresholdRule("battery-medium-busy",
                List.of(RuleCondition.below(FeatureMetric.BATTERY_PERCENT, 60),
                        RuleCondition.above(FeatureMetric.CPU_PERCENT, 70)), SeverityClass.LIGHT),
            new ThresholdRule("default", List.of(), SeverityClass.NONE)
        );
    }

    public static Map<SeverityClass, List<ActionTemplate>> defaultTemplates() {
        Map<SeverityClass, List<ActionTemplate>> t = new EnumMap<>(SeverityClass.class);
        t.put(SeverityClass.LIGHT, List.of(
            new ActionTemplate(ActionType.BRIGHTNESS_ADJUST, "display", 0.3, 5, 0.1)));
        t.put(SeverityClass.MODERATE, List.of(
            new ActionTemplate(ActionType.CPU_THROTTLE,      "system",     0.5, 10, 0.3),
            new ActionTemplate(ActionType.BRIGHTNESS_ADJUST, "display",    0.5,  8, 0.2),
            new ActionTemplate(ActionType.PROCESS_PRIORITY,  "background", 0.4,  4, 0.1)));
        t.put(SeverityClass.AGGRESSIVE, List.of(
            new ActionTemplate(ActionType.CPU_THROTTLE,      "system",     0.8, 20, 0.6),
            new ActionTemplate(ActionType.BRIGHTNESS_ADJUST, "display",    0.7, 15, 0.4),
            new ActionTemplate(ActionType.APP_THROTTLE,      "target_app", 0.6, 12, 0.5),
            new ActionTemplate(ActionType.NETWORK_LIMIT,     "network",    0.6, 15, 0.2),
            new ActionTemplate(ActionType.PROCESS_PRIORITY,  "background", 0.6,  6, 0.2)));
        return t;
    }

    public static List<AwayRule> defaultAwayRules() {
        return List.of(
            new AwayRule(new ActionTemplate(ActionType.BRIGHTNESS_ADJUST, "display", 0.9, 30, 0.1), 0.95, 0.0),
            new AwayRule(new ActionTemplate(ActionType.NETWORK_LIMIT,     "network", 0.6, 15, 0.2), 0.8,  1.0));
    }

    public static Map<SeverityClass, SeverityBand> defaultBands() {
        Map<SeverityClass, SeverityBand> b = new EnumMap<>(SeverityClass.class);
        b.put(SeverityClass.LIGHT,      new SeverityBand(FeatureMetric.CPU_PERCENT,     70, 100));
        b.put(SeverityClass.MODERATE,   new SeverityBand(FeatureMetric.BATTERY_PERCENT, 30,  15));
        b.put(SeverityClass.AGGRESSIVE, new SeverityBand(FeatureMetric.BATTERY_PERCENT, 15,   0));
        return b;
    }
}
