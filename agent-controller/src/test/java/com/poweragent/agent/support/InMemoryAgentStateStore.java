package com.poweragent.agent.support;

import com.poweragent.agent.loop.ActiveAction;
import com.poweragent.agent.persistence.AgentStateStore;
import com.poweragent.common.classifier.SeverityModelParameters;
import com.poweragent.common.model.DecisionOutcome;
import com.poweragent.common.model.FeedbackRecord;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Map-backed store for controller and learner tests. */
public class InMemoryAgentStateStore implements AgentStateStore {

    public final Map<String, ActiveAction>      actions  = new LinkedHashMap<>();
    public final List<DecisionOutcome>          outcomes = new ArrayList<>();
    public final List<FeedbackRecord>           feedback = new ArrayList<>();
    public final List<SeverityModelParameters>  models   = new ArrayList<>();

    @Override
    public Mono<Void> saveActiveAction(ActiveAction action) {
        return Mono.fromRunnable(() -> {
            synchronized (this) {
                actions.put(action.actionId(), action);
            }
        });
    }

    @Override
    public Mono<Void> deleteActiveAction(String actionId) {
        return Mono.fromRunnable(() -> {
            synchronized (this) {
                actions.remove(actionId);
            }
        });
    }

    @Override
    public Flux<ActiveAction> loadActiveActions() {
        return Flux.defer(() -> {
            synchronized (this) {
                return Flux.fromIterable(new ArrayList<>(actions.values()));
            }
        });
    }

    @Override
    public Mono<Void> appendOutcome(DecisionOutcome outcome) {
        return Mono.fromRunnable(() -> {
            synchronized (this) {
                outcomes.add(outcome);
            }
        });
    }

    @Override
    public Mono<Void> appendFeedback(FeedbackRecord record) {
        return Mono.fromRunnable(() -> {
            synchronized (this) {
                feedback.add(record);
            }
        });
    }

    @Override
    public Flux<DecisionOutcome> loadOutcomes(int limit) {
        return Flux.defer(() -> {
            synchronized (this) {
                return Flux.fromIterable(new ArrayList<>(tail(outcomes, limit)));
            }
        });
    }

    @Override
    public Flux<FeedbackRecord> loadFeedback(int limit) {
        return Flux.defer(() -> {
            synchronized (this) {
                return Flux.fromIterable(new ArrayList<>(tail(feedback, limit)));
            }
        });
    }

    @Override
    public Mono<Void> saveModel(SeverityModelParameters parameters) {
        return Mono.fromRunnable(() -> {
            synchronized (this) {
                models.add(parameters);
            }
        });
    }

    @Override
    public Mono<SeverityModelParameters> loadLatestModel() {
        return Mono.defer(() -> {
            synchronized (this) {
                return models.isEmpty() ? Mono.empty() : Mono.just(models.get(models.size() - 1));
            }
        });
    }

    private static <T> List<T> tail(List<T> list, int limit) {
        return list.subList(Math.max(0, list.size() - limit), list.size());
    }
}
