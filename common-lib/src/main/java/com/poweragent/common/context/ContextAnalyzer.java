package com.poweragent.common.context;

import com.poweragent.common.model.BatteryLevel;
import com.poweragent.common.model.ContextState;
import com.poweragent.common.model.PerformanceDemand;
import com.poweragent.common.model.PowerSource;
import com.poweragent.common.model.SystemSnapshot;
import com.poweragent.common.model.TimeOfDay;
import com.poweragent.common.model.UserActivity;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Turns a {@link SystemSnapshot} plus a short trailing window into a {@link ContextState}.
 *
 * <h3>Context score</h3>
 * <pre>
 *   score = 0.45 * battery + 0.20 * demand + 0.15 * activity + 0.20 * powerSource
 * </pre>
 * where each term is the enum's severity in [0, 3], so the score also lies in [0, 3]
 * and is monotonic in every field.
 *
 * <p>Pure and deterministic. The trailing window is owned by the caller and must be
 * ordered oldest first.
 */
public final class ContextAnalyzer {

    static final double BATTERY_WEIGHT  = 0.45;
    static final double DEMAND_WEIGHT   = 0.20;
    static final double ACTIVITY_WEIGHT = 0.15;
    static final double POWER_WEIGHT    = 0.20;

    public static final double MAX_SCORE = 3.0;

    private final ContextThresholds thresholds;

    public ContextAnalyzer(ContextThresholds thresholds) {
        this.thresholds = thresholds;
    }

    public ContextState analyze(SystemSnapshot snapshot, List<SystemSnapshot> recentHistory) {
        PowerSource       powerSource = classifyPowerSource(snapshot);
        BatteryLevel      battery     = classifyBattery(snapshot.batteryPercent(), powerSource);
        PerformanceDemand demand      = classifyDemand(snapshot.cpuPercent() + snapshot.gpuPercent());
        int               hour        = hourOf(snapshot.timestamp());
        UserActivity      activity    = classifyActivity(snapshot, recentHistory, hour);

        return new ContextState(battery, demand, activity, powerSource,
            TimeOfDay.fromHour(hour), score(battery, demand, activity, powerSource),
            snapshot.timestamp());
    }

    public int hourOf(Instant timestamp) {
        return timestamp.atZone(thresholds.zone()).getHour();
    }

    public static double score(BatteryLevel battery, PerformanceDemand demand,
                               UserActivity activity, PowerSource powerSource) {
        double raw = BATTERY_WEIGHT  * battery.severity()
                   + DEMAND_WEIGHT   * demand.severity()
                   + ACTIVITY_WEIGHT * activity.severity()
                   + POWER_WEIGHT    * powerSource.severity();
        return Math.max(0.0, Math.min(MAX_SCORE, raw));
    }

    /**
     * Score for a state described by raw numbers rather than a snapshot, as used when
     * synthesising training rows. A quiet row counts as idle, never as away.
     */
    public double contextScore(double batteryPercent, double combinedUtilisation,
                               boolean plugged, boolean quiet) {
        PowerSource powerSource = plugged ? PowerSource.PLUGGED : PowerSource.BATTERY;
        return score(classifyBattery(batteryPercent, powerSource),
                     classifyDemand(combinedUtilisation),
                     quiet ? UserActivity.IDLE : UserActivity.ACTIVE,
                     powerSource);
    }

    // ── classification ─────────────────────────────────────────────────────

    PowerSource classifyPowerSource(SystemSnapshot snapshot) {
        // a negative draw means the battery is charging, which needs external power
        if (snapshot.powerPlugged() || snapshot.batteryPowerDraw() < 0.0) {
            return PowerSource.PLUGGED;
        }
        return PowerSource.BATTERY;
    }

    BatteryLevel classifyBattery(double percent, PowerSource powerSource) {
        if (percent <= thresholds.criticalBattery()) return BatteryLevel.CRITICAL;
        if (percent <= thresholds.lowBattery())      return BatteryLevel.LOW;
        if (percent <= thresholds.mediumBattery())   return BatteryLevel.MEDIUM;
        if (percent >= thresholds.fullBattery() && powerSource == PowerSource.PLUGGED) {
            return BatteryLevel.FULL;
        }
        return BatteryLevel.HIGH;
    }

    PerformanceDemand classifyDemand(double combinedUtilisation) {
        if (combinedUtilisation > thresholds.heavyDemand())    return PerformanceDemand.HEAVY;
        if (combinedUtilisation > thresholds.moderateDemand()) return PerformanceDemand.MODERATE;
        if (combinedUtilisation > thresholds.lightDemand())    return PerformanceDemand.LIGHT;
        return PerformanceDemand.IDLE;
    }

    UserActivity classifyActivity(SystemSnapshot current, List<SystemSnapshot> history, int hour) {
        if (!isQuiet(current)) {
            return UserActivity.ACTIVE;
        }

        Instant quietSince = current.timestamp();
        if (history != null) {
            for (int i = history.size() - 1; i >= 0; i--) {
                SystemSnapshot past = history.get(i);
                if (past.timestamp().isAfter(current.timestamp())) continue;
                if (!isQuiet(past)) break;
                quietSince = past.timestamp();
            }
        }

        Duration quietFor = Duration.between(quietSince, current.timestamp());
        if (quietFor.compareTo(thresholds.awayAfter()) >= 0) {
            return UserActivity.AWAY;
        }
        return isNight(hour) ? UserActivity.AWAY : UserActivity.IDLE;
    }

    private boolean isQuiet(SystemSnapshot snapshot) {
        return isQuiet(snapshot.cpuPercent(), snapshot.targetAppCpu());
    }

    public boolean isQuiet(double cpuPercent, double targetAppCpu) {
        return cpuPercent < thresholds.quietCpu() && targetAppCpu < thresholds.quietTargetCpu();
    }

    private boolean isNight(int hour) {
        return hour >= thresholds.nightStartHour() || hour < thresholds.nightEndHour();
    }
}
