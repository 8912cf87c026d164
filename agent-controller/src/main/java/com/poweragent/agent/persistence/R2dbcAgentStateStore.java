package com.poweragent.agent.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.poweragent.agent.loop.ActionOrigin;
import com.poweragent.agent.loop.ActiveAction;
import com.poweragent.agent.loop.ActiveActionStatus;
import com.poweragent.common.classifier.SeverityModelParameters;
import com.poweragent.common.exception.PowerAgentException;
import com.poweragent.common.model.DecisionOutcome;
import com.poweragent.common.model.FeedbackRecord;
import com.poweragent.common.model.OptimizationAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * {@link AgentStateStore} over Spring Data R2DBC repositories. Complex values are stored
 * as JSON text; timestamps as UTC {@link LocalDateTime}. Learning records are capped at
 * {@code bufferSize} per kind and model rows at the newest {@code modelHistory}.
 */
public class R2dbcAgentStateStore implements AgentStateStore {

    private static final Logger log = LoggerFactory.getLogger(R2dbcAgentStateStore.class);

    private final ActiveActionRepository   activeActions;
    private final LearningRecordRepository learningRecords;
    private final ModelStateRepository     models;
    private final ObjectMapper             objectMapper;
    private final int                      bufferSize;
    private final int                      modelHistory;

    public R2dbcAgentStateStore(ActiveActionRepository activeActions,
                                LearningRecordRepository learningRecords,
                                ModelStateRepository models,
                                ObjectMapper objectMapper,
                                int bufferSize,
                                int modelHistory) {
        this.activeActions   = activeActions;
        this.learningRecords = learningRecords;
        this.models          = models;
        this.objectMapper    = objectMapper;
        this.bufferSize      = bufferSize;
        this.modelHistory    = Math.max(1, modelHistory);
    }

    // ── active actions ─────────────────────────────────────────────────────

    @Override
    public Mono<Void> saveActiveAction(ActiveAction action) {
        return activeActions.findByActionId(action.actionId())
            .defaultIfEmpty(new ActiveActionEntity())
            .flatMap(entity -> Mono.fromCallable(() -> {
                entity.setActionId(action.actionId());
                entity.setTargetComponent(action.targetComponent());
                entity.setOrigin(action.origin().name());
                entity.setStatus(action.status().name());
                entity.setActionJson(objectMapper.writeValueAsString(action.action()));
                entity.setIssuedAt(toUtc(action.issuedAt()));
                return entity;
            }))
            .flatMap(activeActions::save)
            .doOnSuccess(e -> log.debug("[Store] Active action saved action={} target={} status={}",
                action.actionId(), action.targetComponent(), action.status()))
            .then();
    }

    @Override
    public Mono<Void> deleteActiveAction(String actionId) {
        return activeActions.deleteByActionId(actionId)
            .doOnSuccess(n -> log.debug("[Store] Active action removed action={} rows={}", actionId, n))
            .then();
    }

    @Override
    public Flux<ActiveAction> loadActiveActions() {
        return activeActions.findAll()
            .flatMap(entity -> Mono.fromCallable(() -> toActiveAction(entity))
                .onErrorResume(e -> {
                    log.warn("[Store] Skipping unreadable active action row id={}", entity.getId(), e);
                    return Mono.empty();
                }));
    }

    private ActiveAction toActiveAction(ActiveActionEntity entity) throws JsonProcessingException {
        OptimizationAction action = objectMapper.readValue(entity.getActionJson(), OptimizationAction.class);
        return new ActiveAction(action,
            ActionOrigin.valueOf(entity.getOrigin()),
            ActiveActionStatus.valueOf(entity.getStatus()),
            fromUtc(entity.getIssuedAt()));
    }

    // ── learning buffers ───────────────────────────────────────────────────

    @Override
    public Mono<Void> appendOutcome(DecisionOutcome outcome) {
        return append(LearningRecordEntity.KIND_OUTCOME, outcome, outcome.timestamp());
    }

    @Override
    public Mono<Void> appendFeedback(FeedbackRecord feedback) {
        return append(LearningRecordEntity.KIND_FEEDBACK, feedback, feedback.timestamp());
    }

    private Mono<Void> append(String kind, Object payload, Instant recordedAt) {
        return Mono.fromCallable(() -> {
                LearningRecordEntity entity = new LearningRecordEntity();
                entity.setKind(kind);
                entity.setPayload(objectMapper.writeValueAsString(payload));
                entity.setRecordedAt(toUtc(recordedAt));
                return entity;
            })
            .flatMap(learningRecords::save)
            .then(learningRecords.pruneOlderThanNewest(kind, bufferSize))
            .then();
    }

    @Override
    public Flux<DecisionOutcome> loadOutcomes(int limit) {
        return loadLatest(LearningRecordEntity.KIND_OUTCOME, limit, DecisionOutcome.class);
    }

    @Override
    public Flux<FeedbackRecord> loadFeedback(int limit) {
        return loadLatest(LearningRecordEntity.KIND_FEEDBACK, limit, FeedbackRecord.class);
    }

    private <T> Flux<T> loadLatest(String kind, int limit, Class<T> type) {
        return learningRecords.findLatest(kind, limit)
            .concatMap(entity -> Mono.fromCallable(() -> objectMapper.readValue(entity.getPayload(), type))
                .onErrorResume(e -> {
                    log.warn("[Store] Skipping unreadable {} row id={}", kind, entity.getId(), e);
                    return Mono.empty();
                }))
            .collectList()
            .flatMapMany(newestFirst -> {
                List<T> oldestFirst = new ArrayList<>(newestFirst);
                Collections.reverse(oldestFirst);
                return Flux.fromIterable(oldestFirst);
            });
    }

    // ── model ──────────────────────────────────────────────────────────────

    @Override
    public Mono<Void> saveModel(SeverityModelParameters parameters) {
        return Mono.fromCallable(() -> {
                ModelStateEntity entity = new ModelStateEntity();
                entity.setVersion(parameters.version());
                entity.setTrainingSamples(parameters.trainingSamples());
                entity.setTrainingAccuracy(parameters.trainingAccuracy());
                entity.setParameters(objectMapper.writeValueAsString(parameters));
                entity.setTrainedAt(toUtc(parameters.trainedAt()));
                return entity;
            })
            .flatMap(models::save)
            .then(models.pruneOlderThanNewest(modelHistory))
            .doOnSuccess(pruned -> log.info("[Store] Model persisted version={} samples={} prunedVersions={}",
                parameters.version(), parameters.trainingSamples(), pruned))
            .then();
    }

    @Override
    public Mono<SeverityModelParameters> loadLatestModel() {
        return models.findLatest()
            .flatMap(entity -> Mono.fromCallable(() ->
                    objectMapper.readValue(entity.getParameters(), SeverityModelParameters.class))
                .onErrorMap(e -> new PowerAgentException("Store",
                    "Persisted model version " + entity.getVersion() + " is unreadable", e)));
    }

    // ── helpers ────────────────────────────────────────────────────────────

    private static LocalDateTime toUtc(Instant instant) {
        return instant == null ? null : LocalDateTime.ofInstant(instant, ZoneOffset.UTC);
    }

    private static Instant fromUtc(LocalDateTime time) {
        return time == null ? null : time.toInstant(ZoneOffset.UTC);
    }
}
