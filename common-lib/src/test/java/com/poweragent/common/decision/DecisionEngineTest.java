package com.poweragent.common.decision;

import com.poweragent.common.classifier.BootstrapDataGenerator;
import com.poweragent.common.classifier.SeverityModel;
import com.poweragent.common.classifier.SeverityModelTrainer;
import com.poweragent.common.context.ContextAnalyzer;
import com.poweragent.common.context.ContextThresholds;
import com.poweragent.common.model.ActionType;
import com.poweragent.common.model.Calibration;
import com.poweragent.common.model.ContextState;
import com.poweragent.common.model.DecisionPath;
import com.poweragent.common.model.OptimizationAction;
import com.poweragent.common.model.SeverityClass;
import com.poweragent.common.model.SystemSnapshot;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class DecisionEngineTest {

    private static final Instant NOON  = Instant.parse("2024-05-01T12:00:00Z");
    private static final Clock   CLOCK = Clock.fixed(NOON, ZoneOffset.UTC);

    private final ContextAnalyzer  analyzer = new ContextAnalyzer(ContextThresholds.defaults().withZone(ZoneOffset.UTC));
    private final DecisionSettings settings = DecisionSettings.defaults().withZone(ZoneOffset.UTC);

    /** Fixed answers for the read side of the learning loop. */
    static final class StubModels implements ModelProvider {
        private final SeverityModel model;
        private final Calibration   calibration;

        StubModels(SeverityModel model, Calibration calibration) {
            this.model       = model;
            this.calibration = calibration;
        }

        @Override public Optional<SeverityModel> currentModel() { return Optional.ofNullable(model); }
        @Override public Calibration calibration()              { return calibration; }
    }

    private DecisionResult decide(ModelProvider models, SystemSnapshot snapshot) {
        ContextState context = analyzer.analyze(snapshot, List.of());
        return new DecisionEngine(models, settings, CLOCK).decide(snapshot, context);
    }

    private static SystemSnapshot snapshot(double battery, double cpu, boolean plugged) {
        return SystemSnapshot.builder().timestamp(NOON).batteryPercent(battery).cpuPercent(cpu)
            .targetAppCpu(cpu / 2).powerPlugged(plugged).build();
    }

    // ── rule fallback ──────────────────────────────────────────────────────

    @Nested
    @DisplayName("rule fallback")
    class RuleFallbackTests {

        private final ModelProvider noModel = new StubModels(null, Calibration.neutral());

        @Test
        @DisplayName("battery 10, cpu 80, unplugged → AGGRESSIVE with cpu_throttle in [0.6, 0.9]")
        void lowBatteryBusy_isAggressive() {
            DecisionResult result = decide(noModel, snapshot(10, 80, false));

            assertEquals(SeverityClass.AGGRESSIVE, result.severity());
            assertEquals(DecisionPath.RULE, result.source());
            assertTrue(result.modelUnavailable());
            assertEquals(4, result.candidates().size(), "target app at 40% cpu is not throttled");

            OptimizationAction cpu = result.candidates().stream()
                .filter(a -> a.actionType() == ActionType.CPU_THROTTLE).findFirst().orElseThrow();
            assertTrue(cpu.intensity() >= 0.6 && cpu.intensity() <= 0.9, "intensity=" + cpu.intensity());
            assertEquals("system", cpu.targetComponent());
            assertEquals(0.75, cpu.confidence(), 1e-9);
        }

        @Test
        @DisplayName("battery 70, cpu 10, plugged → NONE with no candidates")
        void comfortable_isNone() {
            DecisionResult result = decide(noModel, snapshot(70, 10, true));
            assertEquals(SeverityClass.NONE, result.severity());
            assertTrue(result.candidates().isEmpty());
        }

        @Test
        @DisplayName("battery 50, cpu 75 → LIGHT brightness only")
        void mediumBusy_isLight() {
            DecisionResult result = decide(noModel, snapshot(50, 75, false));
            assertEquals(SeverityClass.LIGHT, result.severity());
            assertEquals(1, result.candidates().size());
            assertEquals(ActionType.BRIGHTNESS_ADJUST, result.candidates().get(0).actionType());
        }

        @Test
        @DisplayName("candidates are sorted by descending estimated savings")
        void sortedBySavings() {
            List<OptimizationAction> c = decide(noModel, snapshot(20, 40, false)).candidates();
            for (int i = 1; i < c.size(); i++) {
                assertTrue(c.get(i - 1).estimatedSavings() >= c.get(i).estimatedSavings());
            }
        }

        @Test
        @DisplayName("confidence scales with historical accuracy")
        void calibrationScalesConfidence() {
            DecisionResult result = decide(new StubModels(null, new Calibration(0.5, 20)), snapshot(10, 80, false));
            result.candidates().forEach(a -> assertEquals(0.375, a.confidence(), 1e-9));
        }

        @Test
        @DisplayName("critical battery boosts confidence by 1.2")
        void emergencyBoost() {
            DecisionResult result = decide(noModel, snapshot(4, 30, false));
            result.candidates().forEach(a -> assertEquals(0.9, a.confidence(), 1e-9));
        }

        @Test
        @DisplayName("lower battery inside the aggressive band gives higher intensity")
        void bandPositionRaisesIntensity() {
            double at14 = decide(noModel, snapshot(14, 30, false)).candidates().get(0).intensity();
            double at6  = decide(noModel, snapshot(6, 30, false)).candidates().get(0).intensity();
            assertTrue(at6 > at14);
        }
    }

    // ── app priority and away mode ─────────────────────────────────────────

    @Nested
    @DisplayName("app priority and away mode")
    class AppPriorityAndAwayTests {

        private static final Instant TWO_AM = Instant.parse("2024-05-01T02:00:00Z");

        private final ModelProvider noModel = new StubModels(null, Calibration.neutral());

        private SystemSnapshot.Builder night(double battery, boolean plugged) {
            return SystemSnapshot.builder().timestamp(TWO_AM).batteryPercent(battery)
                .cpuPercent(5).targetAppCpu(2).powerPlugged(plugged);
        }

        private Optional<OptimizationAction> on(DecisionResult result, String target) {
            return result.candidates().stream().filter(a -> a.targetComponent().equals(target)).findFirst();
        }

        @Test
        @DisplayName("quiet target app keeps app_throttle in the aggressive class")
        void backgroundApp_isThrottled() {
            SystemSnapshot s = SystemSnapshot.builder().timestamp(NOON).batteryPercent(10)
                .cpuPercent(80).targetAppCpu(10).build();
            DecisionResult result = decide(noModel, s);

            assertEquals(5, result.candidates().size());
            assertEquals(ActionType.APP_THROTTLE, on(result, "target_app").orElseThrow().actionType());
        }

        @Test
        @DisplayName("target app above the priority cpu is never throttled")
        void criticalApp_notThrottled() {
            SystemSnapshot s = SystemSnapshot.builder().timestamp(NOON).batteryPercent(10)
                .cpuPercent(80).targetAppCpu(25).build();
            DecisionResult result = decide(noModel, s);

            assertTrue(on(result, "target_app").isEmpty());
            assertTrue(result.candidates().stream().noneMatch(a -> a.actionType() == ActionType.APP_THROTTLE));
        }

        @Test
        @DisplayName("away on battery with no severity → dimmed display at fixed intensity")
        void awayQuietNetwork_dimsDisplay() {
            DecisionResult result = decide(noModel, night(50, false).build());

            assertEquals(SeverityClass.NONE, result.severity());
            assertEquals(1, result.candidates().size());
            OptimizationAction display = result.candidates().get(0);
            assertEquals(ActionType.BRIGHTNESS_ADJUST, display.actionType());
            assertEquals(0.9, display.intensity(), 1e-9);
            assertEquals(30.0, display.estimatedSavings(), 1e-9);
            assertEquals(0.95, display.confidence(), 1e-9);
        }

        @Test
        @DisplayName("away with more than 1 MB of traffic also limits the network")
        void awayBusyNetwork_limitsNetwork() {
            DecisionResult result = decide(noModel, night(50, false)
                .networkBytesSent(700_000).networkBytesRecv(700_000).build());

            OptimizationAction network = on(result, "network").orElseThrow();
            assertEquals(ActionType.NETWORK_LIMIT, network.actionType());
            assertEquals(0.6, network.intensity(), 1e-9);
            assertEquals(0.8, network.confidence(), 1e-9);
            assertEquals("display", result.candidates().get(0).targetComponent());
        }

        @Test
        @DisplayName("away action replaces a smaller proposal on the same target")
        void awayMergesByTarget() {
            DecisionResult result = decide(noModel, night(20, false).build());

            assertEquals(SeverityClass.MODERATE, result.severity());
            assertEquals(3, result.candidates().size());
            OptimizationAction display = on(result, "display").orElseThrow();
            assertEquals(0.9, display.intensity(), 1e-9);
            assertEquals(30.0, display.estimatedSavings(), 1e-9);
        }

        @Test
        @DisplayName("away while plugged in proposes nothing")
        void awayPlugged_noActions() {
            DecisionResult result = decide(noModel, night(70, true).build());
            assertTrue(result.candidates().isEmpty());
        }

        @Test
        @DisplayName("empty away rules leave the severity candidates untouched")
        void awayRulesDisabled() {
            DecisionSettings noAway = new DecisionSettings(settings.rules(), settings.templates(), settings.bands(),
                settings.ruleConfidence(), settings.emergencyBoost(), settings.minTrainingSamples(),
                settings.probabilityFloor(), settings.intensityLow(), settings.intensityHigh(),
                settings.contextWeight(), settings.appPriorityCpu(), List.of(), settings.zone());
            SystemSnapshot s = night(50, false).build();

            DecisionResult result = new DecisionEngine(noModel, noAway, CLOCK).decide(s, analyzer.analyze(s, List.of()));
            assertTrue(result.candidates().isEmpty());
        }
    }

    // ── learned source ─────────────────────────────────────────────────────

    @Nested
    @DisplayName("learned source")
    class LearnedTests {

        private final SeverityModelTrainer   trainer   = SeverityModelTrainer.withDefaults(CLOCK);
        private final BootstrapDataGenerator bootstrap = new BootstrapDataGenerator(analyzer);

        @Test
        @DisplayName("trained model with enough samples answers on the LEARNED path")
        void trainedModel_isUsed() {
            SeverityModel model = trainer.train(bootstrap.generateDefault(), 1);
            DecisionResult result = decide(new StubModels(model, Calibration.neutral()), snapshot(6, 30, false));

            assertEquals(DecisionPath.LEARNED, result.source());
            assertEquals(SeverityClass.AGGRESSIVE, result.severity());
            assertFalse(result.modelUnavailable());
            assertEquals(4, result.probabilities().size());
        }

        @Test
        @DisplayName("model trained on fewer than 100 samples is ignored")
        void undertrainedModel_fallsBack() {
            SeverityModel model = trainer.train(bootstrap.generateDefault().subList(0, 50), 1);
            DecisionResult result = decide(new StubModels(model, Calibration.neutral()), snapshot(10, 80, false));
            assertEquals(DecisionPath.RULE, result.source());
            assertFalse(result.modelUnavailable());
        }

        @Test
        @DisplayName("low top-class probability falls back to rules")
        void lowProbability_fallsBack() {
            DecisionSource unsure = features -> Optional.empty();
            DecisionEngine engine = new DecisionEngine(unsure,
                new RuleDecisionSource(settings.rules(), settings.ruleConfidence()),
                new StubModels(null, Calibration.neutral()), settings, CLOCK);

            SystemSnapshot s = snapshot(10, 80, false);
            DecisionResult result = engine.decide(s, analyzer.analyze(s, List.of()));
            assertEquals(DecisionPath.RULE, result.source());
        }
    }

    @Test
    @DisplayName("learned source declines below the probability floor")
    void learnedSource_respectsFloor() {
        SeverityModel model = SeverityModelTrainer.withDefaults(CLOCK)
            .train(new BootstrapDataGenerator(analyzer).generateDefault(), 1);
        LearnedDecisionSource strict = new LearnedDecisionSource(new StubModels(model, Calibration.neutral()), 100, 1.01);
        SystemSnapshot s = snapshot(10, 80, false);
        FeatureVector features = FeatureVector.extract(s, analyzer.analyze(s, List.of()), 12);
        assertTrue(strict.evaluate(features).isEmpty());
    }
}
