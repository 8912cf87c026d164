package com.poweragent.common.context;

import java.time.Duration;
import java.time.ZoneId;

/**
 * Tunable boundaries used by {@link ContextAnalyzer}. Battery thresholds are inclusive
 * upper bounds of their band (a battery at exactly {@code criticalBattery} is critical).
 */
public record ContextThresholds(
    double   criticalBattery,
    double   lowBattery,
    double   mediumBattery,
    double   fullBattery,
    double   heavyDemand,
    double   moderateDemand,
    double   lightDemand,
    double   quietCpu,
    double   quietTargetCpu,
    Duration awayAfter,
    int      nightStartHour,
    int      nightEndHour,
    ZoneId   zone
) {

    public static ContextThresholds defaults() {
        return new ContextThresholds(5.0, 30.0, 60.0, 95.0,
            80.0, 50.0, 20.0,
            10.0, 5.0, Duration.ofMinutes(5),
            23, 6, ZoneId.systemDefault());
    }

    public ContextThresholds withZone(ZoneId newZone) {
        return new ContextThresholds(criticalBattery, lowBattery, mediumBattery, fullBattery,
            heavyDemand, moderateDemand, lightDemand, quietCpu, quietTargetCpu, awayAfter,
            nightStartHour, nightEndHour, newZone);
    }
}
