package com.poweragent.agent.learning;

import com.poweragent.agent.config.AgentProperties;
import com.poweragent.agent.metrics.AgentMetrics;
import com.poweragent.agent.persistence.AgentStateStore;
import com.poweragent.agent.persistence.WriteBehindQueue;
import com.poweragent.common.classifier.BootstrapDataGenerator;
import com.poweragent.common.classifier.SeverityModel;
import com.poweragent.common.classifier.SeverityModelParameters;
import com.poweragent.common.classifier.SeverityModelTrainer;
import com.poweragent.common.classifier.TrainingSample;
import com.poweragent.common.decision.FeatureMetric;
import com.poweragent.common.decision.FeatureVector;
import com.poweragent.common.decision.ModelProvider;
import com.poweragent.common.exception.FailureKind;
import com.poweragent.common.model.Calibration;
import com.poweragent.common.model.DecisionOutcome;
import com.poweragent.common.model.FeedbackRecord;
import com.poweragent.common.model.SeverityClass;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Online-learning side of the agent.
 *
 * <h3>Buffers</h3>
 * Decision outcomes and user feedback are appended to bounded ring buffers (oldest
 * evicted first) and persisted through the write-behind queue.
 *
 * <h3>Labels</h3>
 * Only outcomes that put at least one action in effect are labelled; a tick that applied
 * nothing says nothing about whether an intervention helped.
 * <pre>
 *   success = linked feedback ? performanceAcceptable ∧ batteryImprovement
 *                             : observedSatisfaction ≥ successSatisfaction
 *   battery &gt; 60 → success ? NONE     : LIGHT
 *   battery &gt; 30 → success ? LIGHT    : MODERATE
 *   battery &gt; 15 → success ? MODERATE : AGGRESSIVE
 *   otherwise    → AGGRESSIVE
 * </pre>
 *
 * <h3>Retraining</h3>
 * Triggered when {@code retrainThreshold} new samples arrived, or when
 * {@code retrainInterval} elapsed with at least one. Runs on the retrain scheduler; the
 * model handle is swapped only when training completes, so decisions keep using the
 * previous model meanwhile. A failure keeps the previous model and is retried at the
 * next trigger.
 */
public class FeedbackLearner implements ModelProvider {

    private static final Logger log = LoggerFactory.getLogger(FeedbackLearner.class);

    static final double INITIAL_SATISFACTION = 0.8;

    private final AgentStateStore          store;
    private final WriteBehindQueue         writes;
    private final SeverityModelTrainer     trainer;
    private final BootstrapDataGenerator   bootstrap;
    private final AgentMetrics             metrics;
    private final Clock                    clock;
    private final Scheduler                retrainScheduler;
    private final AgentProperties.Learning settings;

    private final AtomicReference<SeverityModel> model      = new AtomicReference<>();
    private final AtomicBoolean                  retraining = new AtomicBoolean(false);

    private final Deque<DecisionOutcome> outcomes = new ArrayDeque<>();
    private final Deque<FeedbackRecord>  feedback = new ArrayDeque<>();

    private List<TrainingSample> bootstrapSamples;
    private volatile Calibration calibration  = Calibration.neutral();
    private volatile double      satisfaction = INITIAL_SATISFACTION;
    private int                  newSamples;
    private Instant              lastTrainedAt;

    public FeedbackLearner(AgentStateStore store, WriteBehindQueue writes, SeverityModelTrainer trainer,
                           BootstrapDataGenerator bootstrap, AgentMetrics metrics, Clock clock,
                           Scheduler retrainScheduler, AgentProperties.Learning settings) {
        this.store            = store;
        this.writes           = writes;
        this.trainer          = trainer;
        this.bootstrap        = bootstrap;
        this.metrics          = metrics;
        this.clock            = clock;
        this.retrainScheduler = retrainScheduler;
        this.settings         = settings;
        this.lastTrainedAt    = clock.instant();
    }

    // ── startup ────────────────────────────────────────────────────────────

    /**
     * Restores buffers and the model from the store. Without a persisted model the
     * bootstrap model is trained here, synchronously, and persisted.
     */
    public void initialize(Duration timeout) {
        List<DecisionOutcome> storedOutcomes = List.of();
        List<FeedbackRecord>  storedFeedback = List.of();
        SeverityModelParameters storedModel  = null;
        try {
            storedOutcomes = store.loadOutcomes(settings.getBufferSize()).collectList().block(timeout);
            storedFeedback = store.loadFeedback(settings.getBufferSize()).collectList().block(timeout);
            storedModel    = store.loadLatestModel().block(timeout);
        } catch (RuntimeException e) {
            log.error("[FeedbackLearner] Could not restore learning state, starting fresh", e);
        }

        synchronized (this) {
            if (storedOutcomes != null) storedOutcomes.forEach(o -> push(outcomes, o));
            if (storedFeedback != null) {
                storedFeedback.forEach(f -> {
                    push(feedback, f);
                    satisfaction = blend(satisfaction, f.satisfaction());
                });
            }
            calibration = computeCalibration();
        }

        if (storedModel != null) {
            model.set(SeverityModel.fromParameters(storedModel));
            lastTrainedAt = storedModel.trainedAt() != null ? storedModel.trainedAt() : clock.instant();
            log.info("[FeedbackLearner] Restored model version={} samples={} outcomes={} feedback={}",
                storedModel.version(), storedModel.trainingSamples(), outcomes.size(), feedback.size());
            return;
        }

        try {
            SeverityModel trained = trainer.train(bootstrapSamples(), 1L);
            model.set(trained);
            lastTrainedAt = trained.trainedAt();
            SeverityModelParameters parameters = trained.toParameters();
            writes.submit(() -> store.saveModel(parameters));
            log.info("[FeedbackLearner] Bootstrap model trained samples={} accuracy={}",
                trained.trainingSamples(), String.format("%.3f", trained.trainingAccuracy()));
        } catch (RuntimeException e) {
            metrics.recordFailure(FailureKind.RETRAIN_FAILURE);
            log.error("[FeedbackLearner] Bootstrap training failed, rule table only until next retrain", e);
        }
    }

    // ── inputs ─────────────────────────────────────────────────────────────

    public void recordOutcome(DecisionOutcome outcome) {
        synchronized (this) {
            push(outcomes, outcome);
            if (isLabelled(outcome)) {
                newSamples++;
                calibration = computeCalibration();
            }
        }
        writes.submit(() -> store.appendOutcome(outcome));
        maybeRetrain();
    }

    public void submitFeedback(FeedbackRecord record) {
        synchronized (this) {
            push(feedback, record);
            newSamples++;
            satisfaction = blend(satisfaction, record.satisfaction());
            calibration  = computeCalibration();
        }
        writes.submit(() -> store.appendFeedback(record));
        log.info("[FeedbackLearner] Feedback received satisfaction={} acceptable={} improvement={} decision={} runningAvg={}",
            record.satisfaction(), record.performanceAcceptable(), record.batteryImprovement(),
            record.linkedDecisionId(), String.format("%.3f", satisfaction));
        maybeRetrain();
    }

    // ── read side ──────────────────────────────────────────────────────────

    @Override
    public Optional<SeverityModel> currentModel() {
        return Optional.ofNullable(model.get());
    }

    @Override
    public Calibration calibration() {
        return calibration;
    }

    public double satisfactionAverage() {
        return satisfaction;
    }

    public synchronized int pendingSamples() {
        return newSamples;
    }

    public boolean isRetraining() {
        return retraining.get();
    }

    // ── retraining ─────────────────────────────────────────────────────────

    /**
     * Starts a background retrain when a trigger condition holds. Never blocks.
     */
    public void maybeRetrain() {
        if (shouldRetrain()) {
            retrain().subscribe();
        }
    }

    synchronized boolean shouldRetrain() {
        if (retraining.get() || newSamples == 0) {
            return false;
        }
        if (newSamples >= settings.getRetrainThreshold()) {
            return true;
        }
        return !clock.instant().isBefore(lastTrainedAt.plus(settings.getRetrainInterval()));
    }

    /**
     * Retrains on the bootstrap set plus the weighted live samples. Emits the new model, or
     * completes empty when a retrain is already running or training failed.
     */
    public Mono<SeverityModel> retrain() {
        if (!retraining.compareAndSet(false, true)) {
            return Mono.empty();
        }

        final List<TrainingSample> live;
        final int consumed;
        synchronized (this) {
            live     = labelledSamples();
            consumed = newSamples;
        }
        long version = currentModel().map(SeverityModel::version).orElse(0L) + 1;

        return Mono.fromCallable(() -> trainer.train(trainingSet(live), version))
            .subscribeOn(retrainScheduler)
            .doOnNext(trained -> {
                model.set(trained);
                synchronized (this) {
                    newSamples    = Math.max(0, newSamples - consumed);
                    lastTrainedAt = trained.trainedAt();
                }
                SeverityModelParameters parameters = trained.toParameters();
                writes.submit(() -> store.saveModel(parameters));
                log.info("[FeedbackLearner] Model retrained version={} liveSamples={} totalSamples={} accuracy={}",
                    trained.version(), live.size(), trained.trainingSamples(),
                    String.format("%.3f", trained.trainingAccuracy()));
            })
            .onErrorResume(e -> {
                metrics.recordFailure(FailureKind.RETRAIN_FAILURE);
                log.error("[FeedbackLearner] Retrain failed, keeping model version={}",
                    currentModel().map(SeverityModel::version).orElse(0L), e);
                return Mono.empty();
            })
            .doFinally(signal -> retraining.set(false));
    }

    private List<TrainingSample> trainingSet(List<TrainingSample> live) {
        List<TrainingSample> all = new ArrayList<>(bootstrapSamples());
        int weight = Math.max(1, settings.getLiveSampleWeight());
        for (TrainingSample sample : live) {
            for (int i = 0; i < weight; i++) {
                all.add(sample);
            }
        }
        return all;
    }

    private synchronized List<TrainingSample> bootstrapSamples() {
        if (bootstrapSamples == null) {
            bootstrapSamples = bootstrap.generate(settings.getBootstrapSamples(), settings.getBootstrapSeed());
        }
        return bootstrapSamples;
    }

    // ── labelling ──────────────────────────────────────────────────────────

    private List<TrainingSample> labelledSamples() {
        Map<String, FeedbackRecord> linked = linkedFeedback();
        List<TrainingSample> samples = new ArrayList<>(outcomes.size());
        for (DecisionOutcome outcome : outcomes) {
            if (!isLabelled(outcome) || outcome.features().size() != FeatureMetric.COUNT) continue;
            samples.add(new TrainingSample(FeatureVector.fromList(outcome.features()), label(outcome, linked)));
        }
        return samples;
    }

    private Calibration computeCalibration() {
        Map<String, FeedbackRecord> linked = linkedFeedback();
        double accuracy = 1.0;
        int count = 0;
        for (DecisionOutcome outcome : outcomes) {
            if (!isLabelled(outcome) || outcome.severity() == null) continue;
            double hit = outcome.severity() == label(outcome, linked) ? 1.0 : 0.0;
            accuracy = (1.0 - settings.getAccuracyAlpha()) * accuracy + settings.getAccuracyAlpha() * hit;
            count++;
        }
        return count == 0 ? Calibration.neutral() : new Calibration(accuracy, count);
    }

    static boolean isLabelled(DecisionOutcome outcome) {
        return !outcome.actionsApplied().isEmpty();
    }

    private Map<String, FeedbackRecord> linkedFeedback() {
        Map<String, FeedbackRecord> linked = new HashMap<>();
        for (FeedbackRecord record : feedback) {
            if (record.linkedDecisionId() != null) {
                linked.put(record.linkedDecisionId(), record);
            }
        }
        return linked;
    }

    SeverityClass label(DecisionOutcome outcome, Map<String, FeedbackRecord> linked) {
        FeedbackRecord record = linked.get(outcome.decisionId());
        boolean success = record != null
            ? record.isSuccess()
            : outcome.observedSatisfaction() >= settings.getSuccessSatisfaction();
        return labelFor(success, outcome.batteryPercent());
    }

    static SeverityClass labelFor(boolean success, double battery) {
        if (battery > 60) return success ? SeverityClass.NONE : SeverityClass.LIGHT;
        if (battery > 30) return success ? SeverityClass.LIGHT : SeverityClass.MODERATE;
        if (battery > 15) return success ? SeverityClass.MODERATE : SeverityClass.AGGRESSIVE;
        return SeverityClass.AGGRESSIVE;
    }

    // ── helpers ────────────────────────────────────────────────────────────

    private <T> void push(Deque<T> buffer, T item) {
        buffer.addLast(item);
        while (buffer.size() > settings.getBufferSize()) {
            buffer.removeFirst();
        }
    }

    private static double blend(double average, double sample) {
        return 0.8 * average + 0.2 * sample;
    }
}
