package com.poweragent.agent.persistence;

import com.poweragent.agent.loop.ActiveAction;
import com.poweragent.common.classifier.SeverityModelParameters;
import com.poweragent.common.model.DecisionOutcome;
import com.poweragent.common.model.FeedbackRecord;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * State that must survive a restart: the active-action table, the learning ring buffers
 * and the classifier parameters.
 */
public interface AgentStateStore {

    Mono<Void> saveActiveAction(ActiveAction action);

    Mono<Void> deleteActiveAction(String actionId);

    Flux<ActiveAction> loadActiveActions();

    Mono<Void> appendOutcome(DecisionOutcome outcome);

    Mono<Void> appendFeedback(FeedbackRecord feedback);

    /** Newest {@code limit} outcomes, oldest first. */
    Flux<DecisionOutcome> loadOutcomes(int limit);

    /** Newest {@code limit} feedback records, oldest first. */
    Flux<FeedbackRecord> loadFeedback(int limit);

    Mono<Void> saveModel(SeverityModelParameters parameters);

    Mono<SeverityModelParameters> loadLatestModel();
}
