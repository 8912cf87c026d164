package com.poweragent.agent.learning;

import com.poweragent.agent.config.AgentProperties;
import com.poweragent.agent.metrics.AgentMetrics;
import com.poweragent.agent.persistence.WriteBehindQueue;
import com.poweragent.agent.support.InMemoryAgentStateStore;
import com.poweragent.agent.support.MutableClock;
import com.poweragent.common.classifier.BootstrapDataGenerator;
import com.poweragent.common.classifier.SeverityModel;
import com.poweragent.common.classifier.SeverityModelTrainer;
import com.poweragent.common.context.ContextAnalyzer;
import com.poweragent.common.context.ContextThresholds;
import com.poweragent.common.decision.FeatureMetric;
import com.poweragent.common.exception.FailureKind;
import com.poweragent.common.exception.RetrainException;
import com.poweragent.common.model.ActionType;
import com.poweragent.common.model.Calibration;
import com.poweragent.common.model.DecisionOutcome;
import com.poweragent.common.model.DecisionPath;
import com.poweragent.common.model.FeedbackRecord;
import com.poweragent.common.model.OptimizationAction;
import com.poweragent.common.model.SeverityClass;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.*;

class FeedbackLearnerTest {

    private static final Instant  START   = Instant.parse("2024-05-01T12:00:00Z");
    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private MutableClock             clock;
    private InMemoryAgentStateStore  store;
    private WriteBehindQueue         writes;
    private AgentMetrics             metrics;
    private AgentProperties.Learning settings;
    private BootstrapDataGenerator   bootstrap;

    @BeforeEach
    void setUp() {
        clock     = new MutableClock(START);
        store     = new InMemoryAgentStateStore();
        writes    = new WriteBehindQueue();
        metrics   = new AgentMetrics(new SimpleMeterRegistry());
        bootstrap = new BootstrapDataGenerator(new ContextAnalyzer(ContextThresholds.defaults().withZone(ZoneOffset.UTC)));

        settings = new AgentProperties.Learning();
        settings.setBootstrapSamples(300);
        settings.setRetrainThreshold(3);
        settings.setRetrainInterval(Duration.ofHours(1));
    }

    @AfterEach
    void tearDown() {
        writes.close();
    }

    private FeedbackLearner learner(SeverityModelTrainer trainer) {
        return new FeedbackLearner(store, writes, trainer, bootstrap, metrics, clock, Schedulers.immediate(), settings);
    }

    private FeedbackLearner learner() {
        return learner(new SeverityModelTrainer(300, 0.5, 1e-4, clock));
    }

    private static DecisionOutcome outcome(double battery, SeverityClass severity, double satisfaction) {
        OptimizationAction dim = OptimizationAction.create(ActionType.BRIGHTNESS_ADJUST, 0.3, "display",
            5.0, 0.1, 0.75, START);
        return outcome(battery, severity, satisfaction, List.of(dim));
    }

    private static DecisionOutcome idleOutcome(double battery) {
        return outcome(battery, SeverityClass.NONE, 0.9, List.of());
    }

    private static DecisionOutcome outcome(double battery, SeverityClass severity, double satisfaction,
                                           List<OptimizationAction> applied) {
        List<Double> features = new ArrayList<>(Collections.nCopies(FeatureMetric.COUNT, 0.0));
        features.set(FeatureMetric.BATTERY_PERCENT.index(), battery);
        return new DecisionOutcome(UUID.randomUUID().toString(), START, features, severity, DecisionPath.RULE,
            applied, applied.stream().mapToDouble(OptimizationAction::estimatedSavings).sum(), satisfaction, START);
    }

    // ── startup ────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("initialize()")
    class InitializeTests {

        @Test
        @DisplayName("empty store → bootstrap model trained as version 1 and persisted")
        void emptyStore_trainsBootstrap() {
            FeedbackLearner learner = learner();

            learner.initialize(TIMEOUT);
            writes.flush(TIMEOUT);

            SeverityModel model = learner.currentModel().orElseThrow();
            assertEquals(1L, model.version());
            assertEquals(300, model.trainingSamples());
            assertEquals(1, store.models.size());
            assertEquals(Calibration.neutral(), learner.calibration());
        }

        @Test
        @DisplayName("stored model → restored without training")
        void storedModel_restored() {
            FeedbackLearner first = learner();
            first.initialize(TIMEOUT);
            writes.flush(TIMEOUT);

            SeverityModelTrainer trainer = mock(SeverityModelTrainer.class);
            FeedbackLearner second = learner(trainer);
            second.initialize(TIMEOUT);

            assertEquals(1L, second.currentModel().orElseThrow().version());
            verifyNoInteractions(trainer);
        }

        @Test
        @DisplayName("stored feedback and outcomes → satisfaction and calibration replayed")
        void storedBuffers_replayed() {
            store.feedback.add(new FeedbackRecord(0.5, true, true, "", null, START));
            store.outcomes.add(outcome(50, SeverityClass.NONE, 0.9));

            FeedbackLearner learner = learner();
            learner.initialize(TIMEOUT);

            assertEquals(0.8 * 0.8 + 0.2 * 0.5, learner.satisfactionAverage(), 1e-9);
            assertEquals(1, learner.calibration().sampleCount());
        }

        @Test
        @DisplayName("bootstrap training failure → counted, no model")
        void bootstrapFailure_counted() {
            SeverityModelTrainer trainer = mock(SeverityModelTrainer.class);
            when(trainer.train(any(), anyLong())).thenThrow(new RetrainException("diverged"));

            FeedbackLearner learner = learner(trainer);
            learner.initialize(TIMEOUT);

            assertTrue(learner.currentModel().isEmpty());
            assertEquals(1, metrics.failureCount(FailureKind.RETRAIN_FAILURE));
        }
    }

    // ── labels and calibration ─────────────────────────────────────────────

    @Nested
    @DisplayName("labels and calibration")
    class LabelTests {

        @Test
        @DisplayName("label table by battery band and success")
        void labelTable() {
            assertEquals(SeverityClass.NONE,       FeedbackLearner.labelFor(true,  80));
            assertEquals(SeverityClass.LIGHT,      FeedbackLearner.labelFor(false, 80));
            assertEquals(SeverityClass.LIGHT,      FeedbackLearner.labelFor(true,  45));
            assertEquals(SeverityClass.MODERATE,   FeedbackLearner.labelFor(false, 45));
            assertEquals(SeverityClass.MODERATE,   FeedbackLearner.labelFor(true,  20));
            assertEquals(SeverityClass.AGGRESSIVE, FeedbackLearner.labelFor(false, 20));
            assertEquals(SeverityClass.AGGRESSIVE, FeedbackLearner.labelFor(true,  10));
        }

        @Test
        @DisplayName("no outcomes → neutral calibration")
        void noOutcomes_neutral() {
            assertEquals(Calibration.neutral(), learner().calibration());
        }

        @Test
        @DisplayName("mismatched outcome lowers historical accuracy by alpha")
        void mismatch_lowersAccuracy() {
            settings.setRetrainThreshold(1_000);
            FeedbackLearner learner = learner();

            learner.recordOutcome(outcome(50, SeverityClass.NONE, 0.9));

            assertEquals(0.9, learner.calibration().historicalAccuracy(), 1e-9);
            assertEquals(1, learner.calibration().sampleCount());
        }

        @Test
        @DisplayName("outcomes that applied nothing leave calibration and the retrain counter alone")
        void idleOutcomes_notLabelled() {
            settings.setRetrainThreshold(1_000);
            FeedbackLearner learner = learner();

            for (int i = 0; i < 5; i++) {
                learner.recordOutcome(idleOutcome(45));
            }

            assertEquals(Calibration.neutral(), learner.calibration());
            assertEquals(0, learner.pendingSamples());
        }

        @Test
        @DisplayName("linked feedback overrides observed satisfaction")
        void linkedFeedback_overridesSatisfaction() {
            settings.setRetrainThreshold(1_000);
            FeedbackLearner learner = learner();
            DecisionOutcome o = outcome(80, SeverityClass.NONE, 0.9);

            learner.recordOutcome(o);
            assertEquals(1.0, learner.calibration().historicalAccuracy(), 1e-9);

            learner.submitFeedback(new FeedbackRecord(0.2, false, true, "laggy", o.decisionId(), START));
            assertEquals(0.9, learner.calibration().historicalAccuracy(), 1e-9);
        }
    }

    // ── retraining ─────────────────────────────────────────────────────────

    @Nested
    @DisplayName("retraining")
    class RetrainTests {

        @Test
        @DisplayName("threshold of new samples reached → model swapped to next version")
        void threshold_triggersRetrain() {
            FeedbackLearner learner = learner();
            learner.initialize(TIMEOUT);

            learner.recordOutcome(outcome(20, SeverityClass.MODERATE, 0.9));
            learner.recordOutcome(outcome(70, SeverityClass.NONE, 0.9));
            assertEquals(1L, learner.currentModel().orElseThrow().version());

            learner.recordOutcome(outcome(10, SeverityClass.AGGRESSIVE, 0.1));
            writes.flush(TIMEOUT);

            SeverityModel model = learner.currentModel().orElseThrow();
            assertEquals(2L, model.version());
            assertEquals(300 + 3 * 2, model.trainingSamples());
            assertEquals(0, learner.pendingSamples());
            assertEquals(2, store.models.size());
        }

        @Test
        @DisplayName("outcomes without applied actions are left out of the training set")
        void idleOutcomes_excludedFromTraining() {
            FeedbackLearner learner = learner();
            learner.initialize(TIMEOUT);

            learner.recordOutcome(idleOutcome(45));
            learner.recordOutcome(outcome(20, SeverityClass.MODERATE, 0.9));
            learner.recordOutcome(idleOutcome(70));
            learner.recordOutcome(outcome(70, SeverityClass.LIGHT, 0.9));
            assertEquals(1L, learner.currentModel().orElseThrow().version());

            learner.recordOutcome(outcome(10, SeverityClass.AGGRESSIVE, 0.1));

            SeverityModel model = learner.currentModel().orElseThrow();
            assertEquals(2L, model.version());
            assertEquals(300 + 3 * 2, model.trainingSamples());
        }

        @Test
        @DisplayName("interval elapsed with at least one sample → retrain")
        void interval_triggersRetrain() {
            settings.setRetrainThreshold(1_000);
            FeedbackLearner learner = learner();
            learner.initialize(TIMEOUT);

            learner.recordOutcome(outcome(40, SeverityClass.LIGHT, 0.9));
            assertEquals(1L, learner.currentModel().orElseThrow().version());

            clock.advance(Duration.ofMinutes(61));
            learner.maybeRetrain();

            assertEquals(2L, learner.currentModel().orElseThrow().version());
        }

        @Test
        @DisplayName("interval elapsed without samples → no retrain")
        void interval_withoutSamples_noRetrain() {
            FeedbackLearner learner = learner();
            learner.initialize(TIMEOUT);

            clock.advance(Duration.ofHours(2));
            learner.maybeRetrain();

            assertEquals(1L, learner.currentModel().orElseThrow().version());
        }

        @Test
        @DisplayName("training failure → previous model kept, failure counted, samples kept for next trigger")
        void failure_keepsPreviousModel() {
            SeverityModelTrainer trainer = spy(new SeverityModelTrainer(300, 0.5, 1e-4, clock));
            FeedbackLearner learner = learner(trainer);
            learner.initialize(TIMEOUT);
            doThrow(new RetrainException("diverged")).when(trainer).train(any(), anyLong());

            for (int i = 0; i < 3; i++) {
                learner.recordOutcome(outcome(50, SeverityClass.NONE, 0.9));
            }

            assertEquals(1L, learner.currentModel().orElseThrow().version());
            assertTrue(metrics.failureCount(FailureKind.RETRAIN_FAILURE) >= 1);
            assertEquals(3, learner.pendingSamples());
            assertFalse(learner.isRetraining());
        }
    }
}
