package com.poweragent.agent.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runtime configuration bound from {@code power-agent.*}.
 *
 * <p>Every field carries the default the agent ships with, so an empty configuration
 * yields a working balanced-mode agent with a 2 s sampling and 10 s decision cadence.
 */
@Data
@ConfigurationProperties(prefix = "power-agent")
public class AgentProperties {

    /** Monitor sampling cadence. Snapshots older than twice this are stale. */
    private Duration monitoringInterval = Duration.ofSeconds(2);

    /** Controller tick cadence. */
    private Duration decisionInterval = Duration.ofSeconds(10);

    /** Mode active at startup: conservative, balanced or aggressive. */
    private String mode = "balanced";

    /** Number of snapshots kept for trend features. */
    private int trailingWindow = 30;

    /** Intensity difference under which an approved action counts as unchanged. */
    private double unchangedTolerance = 0.05;

    /** Time zone used for time-of-day features; system zone when blank. */
    private String zone;

    /** Upper bound for blocking store reads at startup and for the shutdown flush. */
    private Duration storeTimeout = Duration.ofSeconds(5);

    private Thresholds thresholds = new Thresholds();
    private Decision   decision   = new Decision();
    private Policy     policy     = new Policy();
    private Actuation  actuation  = new Actuation();
    private Learning   learning   = new Learning();

    private Map<String, Mode> modes = defaultModes();

    // ── nested groups ──────────────────────────────────────────────────────

    @Data
    public static class Thresholds {
        /** Battery at or below this is critical and triggers emergency. */
        private double emergencyBattery = 5.0;
        private double lowBattery       = 30.0;
        private double mediumBattery    = 60.0;
        private double fullBattery      = 95.0;
        private double heavyDemand      = 80.0;
        private double moderateDemand   = 50.0;
        private double lightDemand      = 20.0;
        private double quietCpu         = 10.0;
        private double quietTargetCpu   = 5.0;
        private Duration awayAfter      = Duration.ofMinutes(5);
        private int nightStartHour      = 23;
        private int nightEndHour        = 6;
    }

    @Data
    public static class Decision {
        private double ruleConfidence     = 0.75;
        private double emergencyBoost     = 1.2;
        private int    minTrainingSamples = 100;
        private double probabilityFloor   = 0.5;

        /** Target-app CPU above which the app counts as critical and is never throttled. */
        private double appPriorityCpu     = 20.0;
        /** Adds the away rules on battery while the user is away. */
        private boolean awayMode          = true;
        /** Network traffic in MB a tick must exceed before the away network limit applies. */
        private double awayNetworkMb      = 1.0;

        /** Ordered rule table. Empty means the built-in table. */
        private List<Rule> rules = new ArrayList<>();
    }

    @Data
    public static class Rule {
        private String name;
        private String severity;
        private List<Condition> conditions = new ArrayList<>();
    }

    @Data
    public static class Condition {
        /** Feature name, e.g. {@code battery_percent}. */
        private String metric;
        /** One of lt, le, gt, ge. */
        private String comparison;
        private double threshold;
    }

    @Data
    public static class Policy {
        private int    maxActionsPerCycle       = 4;
        private double maxPerformanceImpact     = 0.7;
        private double emergencyConfidenceFloor = 0.3;
    }

    @Data
    public static class Actuation {
        private int      maxRetries      = 3;
        private Duration retryBackoff    = Duration.ofMillis(200);
        private Duration dispatchTimeout = Duration.ofSeconds(2);

        /** Components driven by the built-in simulated optimizers. */
        private List<String> targets = new ArrayList<>(List.of("system", "display", "target_app", "network", "background"));
    }

    @Data
    public static class Learning {
        private int      retrainThreshold     = 50;
        private Duration retrainInterval      = Duration.ofHours(1);
        private int      liveSampleWeight     = 2;
        private int      bufferSize           = 1000;
        private double   accuracyAlpha        = 0.1;
        private double   successSatisfaction  = 0.6;
        private int      bootstrapSamples     = 1000;
        private long     bootstrapSeed        = 42L;
        private int      epochs               = 1000;
        private double   learningRate         = 0.5;
        private double   l2                   = 1e-4;

        /** Persisted model versions kept; older rows are pruned after each save. */
        private int      modelHistory         = 5;
    }

    @Data
    public static class Mode {
        private double maxIntensity;
        private double minConfidence;

        public Mode() {
        }

        public Mode(double maxIntensity, double minConfidence) {
            this.maxIntensity  = maxIntensity;
            this.minConfidence = minConfidence;
        }
    }

    private static Map<String, Mode> defaultModes() {
        Map<String, Mode> modes = new LinkedHashMap<>();
        modes.put("conservative", new Mode(0.3, 0.8));
        modes.put("balanced",     new Mode(0.6, 0.7));
        modes.put("aggressive",   new Mode(0.9, 0.6));
        return modes;
    }
}
