package com.poweragent.agent.loop;

import com.poweragent.agent.actuator.ActionDispatcher;
import com.poweragent.agent.actuator.Actuator;
import com.poweragent.agent.actuator.DispatchResult;
import com.poweragent.agent.learning.FeedbackLearner;
import com.poweragent.agent.metrics.AgentMetrics;
import com.poweragent.agent.monitor.Monitor;
import com.poweragent.agent.persistence.AgentStateStore;
import com.poweragent.agent.persistence.WriteBehindQueue;
import com.poweragent.common.classifier.SeverityModel;
import com.poweragent.common.context.ContextAnalyzer;
import com.poweragent.common.decision.DecisionEngine;
import com.poweragent.common.decision.DecisionResult;
import com.poweragent.common.exception.FailureKind;
import com.poweragent.common.model.ActionResult;
import com.poweragent.common.model.ContextState;
import com.poweragent.common.model.DecisionOutcome;
import com.poweragent.common.model.DecisionPath;
import com.poweragent.common.model.FeedbackRecord;
import com.poweragent.common.model.ModeName;
import com.poweragent.common.model.OptimizationAction;
import com.poweragent.common.model.OptimizationMode;
import com.poweragent.common.model.SystemSnapshot;
import com.poweragent.common.policy.PolicyFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the control loop state: the active-action map (one entry per target component),
 * the state machine and the trailing snapshot window.
 *
 * <h3>States</h3>
 * <pre>
 *   STOPPED   ──start()──────────────────────→ RUNNING
 *   RUNNING   ──pause()──→ PAUSED ──resume()──→ RUNNING
 *   RUNNING   ──battery critical─────────────→ EMERGENCY   (emergency set dispatched same tick)
 *   EMERGENCY ──battery above critical and
 *               no emergency-issued action left──→ RUNNING
 *   any       ──shutdown()───────────────────→ STOPPED     (all actions reverted first)
 * </pre>
 *
 * <h3>Tick</h3>
 * Latest snapshot (skipped when absent or stale) → context → decision → policy →
 * reconcile against the active-action map → outcome recorded. Unchanged actions are
 * left alone; a changed action on an occupied target is reverted before its replacement
 * is issued.
 *
 * <p>Ticks and control commands are serialised by one lock, so the map has a single
 * writer. Readers get copies.
 */
public class AgentController {

    private static final Logger log = LoggerFactory.getLogger(AgentController.class);

    private static final int MAX_STUCK_REPORTS = 50;

    private final Monitor            monitor;
    private final ContextAnalyzer    contextAnalyzer;
    private final DecisionEngine     decisionEngine;
    private final PolicyFilter       policyFilter;
    private final ActionDispatcher   dispatcher;
    private final Actuator           actuator;
    private final FeedbackLearner    learner;
    private final AgentStateStore    store;
    private final WriteBehindQueue   writes;
    private final AgentMetrics       metrics;
    private final Clock              clock;
    private final ControllerSettings settings;

    private final ReentrantLock lock = new ReentrantLock();

    private final Map<String, ActiveAction>    active  = new LinkedHashMap<>();
    private final Map<String, PendingDispatch> pending = new LinkedHashMap<>();
    private final Deque<SystemSnapshot>        window  = new ArrayDeque<>();
    private final Deque<StuckAction>           stuck   = new ArrayDeque<>();

    private volatile ControllerState state = ControllerState.STOPPED;
    private volatile OptimizationMode mode;
    private volatile String  lastDecisionId;
    private volatile Instant lastDecisionAt;

    private boolean modelMissing;
    private long    totalTicks;
    private long    totalDecisions;
    private long    emergencyActivations;

    public AgentController(Monitor monitor, ContextAnalyzer contextAnalyzer, DecisionEngine decisionEngine,
                           PolicyFilter policyFilter, ActionDispatcher dispatcher, Actuator actuator,
                           FeedbackLearner learner, AgentStateStore store, WriteBehindQueue writes,
                           AgentMetrics metrics, Clock clock, ControllerSettings settings) {
        this.monitor         = monitor;
        this.contextAnalyzer = contextAnalyzer;
        this.decisionEngine  = decisionEngine;
        this.policyFilter    = policyFilter;
        this.dispatcher      = dispatcher;
        this.actuator        = actuator;
        this.learner         = learner;
        this.store           = store;
        this.writes          = writes;
        this.metrics         = metrics;
        this.clock           = clock;
        this.settings        = settings;
        this.mode            = settings.modes().get(settings.initialMode());
        metrics.bindActiveActions(this::activeActionCount);
    }

    /** {@code APPLY_THEN_REVERT}: an apply still running when its revert was requested. */
    private enum DispatchKind { APPLY, REVERT, APPLY_THEN_REVERT }

    private record PendingDispatch(DispatchKind kind, String actionId, CompletableFuture<ActionResult> future) {}

    // ── lifecycle ──────────────────────────────────────────────────────────

    /**
     * Reloads the persisted active-action table, reconciles it with what the actuator
     * reports as active and starts accepting ticks. Store or actuator failures are logged
     * and never propagated.
     */
    public void start() {
        lock.lock();
        try {
            if (state != ControllerState.STOPPED) {
                log.warn("[Controller] start() ignored, already {}", state);
                return;
            }

            List<ActiveAction> persisted = List.of();
            try {
                List<ActiveAction> loaded = store.loadActiveActions().collectList().block(settings.storeTimeout());
                if (loaded != null) persisted = loaded;
            } catch (RuntimeException e) {
                log.error("[Controller] Could not reload active actions, starting with an empty map", e);
            }

            Set<String> live = new HashSet<>();
            try {
                live.addAll(actuator.listActive());
            } catch (RuntimeException e) {
                log.error("[Controller] Actuator listActive failed during reload", e);
            }

            Set<String> known = new HashSet<>();
            int restored = 0;
            for (ActiveAction entry : persisted) {
                known.add(entry.actionId());
                if (live.contains(entry.actionId())) {
                    ActiveActionStatus status = entry.status() == ActiveActionStatus.ACTIVE
                                             || entry.status() == ActiveActionStatus.APPLYING
                        ? ActiveActionStatus.ACTIVE
                        : ActiveActionStatus.REVERT_STUCK;
                    ActiveAction reloaded = entry.withStatus(status);
                    active.put(reloaded.targetComponent(), reloaded);
                    persist(reloaded);
                    restored++;
                } else {
                    writes.submit(() -> store.deleteActiveAction(entry.actionId()));
                }
            }

            int orphans = 0;
            for (String id : live) {
                if (!known.contains(id)) {
                    orphans++;
                    DispatchResult result = dispatcher.revert(id);
                    if (!result.isSucceeded()) {
                        recordStuck(id, "unknown", "revert", describe(result));
                    }
                }
            }

            state = ControllerState.RUNNING;
            log.info("[Controller] Started mode={} restored={} dropped={} orphansReverted={}",
                mode.name(), restored, persisted.size() - restored, orphans);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Reverts every active action and stops accepting ticks.
     */
    public void shutdown() {
        lock.lock();
        try {
            if (state == ControllerState.STOPPED) {
                return;
            }
            awaitPending();
            List<RevertReport> reports = revertEverything();
            awaitPending();
            for (Map.Entry<String, PendingDispatch> e : pending.entrySet()) {
                recordStuck(e.getValue().actionId(), e.getKey(), "revert", "still running at shutdown");
                log.warn("[Controller] Action left unresolved at shutdown target={} action={} kind={}",
                    e.getKey(), e.getValue().actionId(), e.getValue().kind());
            }
            state = ControllerState.STOPPED;
            long failed = reports.stream().filter(r -> !r.success()).count();
            log.info("[Controller] Stopped reverted={} failed={} unresolved={}",
                reports.size() - failed, failed, pending.size());
        } finally {
            lock.unlock();
        }
    }

    // ── tick ───────────────────────────────────────────────────────────────

    /**
     * One control cycle. Never throws.
     */
    public void tick() {
        lock.lock();
        try {
            if (state == ControllerState.STOPPED) {
                return;
            }
            pollPending();
            if (state == ControllerState.PAUSED) {
                return;
            }
            totalTicks++;

            Optional<SystemSnapshot> latest = monitor.latestSnapshot();
            if (latest.isEmpty() || isStale(latest.get())) {
                metrics.recordFailure(FailureKind.STALE_SNAPSHOT);
                log.debug("[Controller] Tick skipped, snapshot {}", latest.isEmpty() ? "absent" : "stale");
                return;
            }
            SystemSnapshot snapshot = latest.get();

            List<SystemSnapshot> history = new ArrayList<>(window);
            remember(snapshot);
            ContextState context = contextAnalyzer.analyze(snapshot, history);

            if (context.isCritical() && state == ControllerState.RUNNING) {
                enterEmergency(snapshot);
            }
            boolean emergency = state == ControllerState.EMERGENCY && context.isCritical();

            DecisionResult decision = decisionEngine.decide(snapshot, context);
            trackModelAvailability(decision.modelUnavailable());

            List<OptimizationAction> approved = policyFilter.filter(
                decision.candidates(), mode, emergency, actuator.knownTargets());
            List<OptimizationAction> inEffect = reconcile(approved,
                emergency ? ActionOrigin.EMERGENCY : ActionOrigin.NORMAL);

            if (state == ControllerState.EMERGENCY && !context.isCritical() && !hasEmergencyEntries()) {
                exitEmergency(snapshot);
            }

            recordOutcome(snapshot, decision, emergency, inEffect);
            totalDecisions++;

            log.debug("[Controller] Tick done state={} battery={} severity={} path={} candidates={} approved={} active={}",
                state, snapshot.batteryPercent(), decision.severity(), decision.source(),
                decision.candidates().size(), approved.size(), active.size());
        } catch (RuntimeException e) {
            log.error("[Controller] Tick failed, loop continues", e);
        } finally {
            lock.unlock();
        }
    }

    private boolean isStale(SystemSnapshot snapshot) {
        Instant cutoff = clock.instant().minus(settings.monitoringInterval().multipliedBy(2));
        return snapshot.timestamp().isBefore(cutoff);
    }

    private void remember(SystemSnapshot snapshot) {
        SystemSnapshot last = window.peekLast();
        if (last != null && !snapshot.timestamp().isAfter(last.timestamp())) {
            return;
        }
        window.addLast(snapshot);
        while (window.size() > settings.trailingWindow()) {
            window.removeFirst();
        }
    }

    private void trackModelAvailability(boolean missing) {
        if (missing && !modelMissing) {
            metrics.recordFailure(FailureKind.MODEL_UNAVAILABLE);
        }
        modelMissing = missing;
    }

    // ── reconcile ──────────────────────────────────────────────────────────

    /**
     * Brings the active-action map in line with the approved set and returns the approved
     * actions that are now in effect (or being applied).
     */
    private List<OptimizationAction> reconcile(List<OptimizationAction> approved, ActionOrigin origin) {
        Map<String, OptimizationAction> desired = new LinkedHashMap<>();
        for (OptimizationAction action : approved) {
            desired.putIfAbsent(action.targetComponent(), action);
        }

        List<OptimizationAction> inEffect = new ArrayList<>();

        for (ActiveAction entry : new ArrayList<>(active.values())) {
            String target = entry.targetComponent();
            if (pending.containsKey(target)) {
                continue;
            }
            OptimizationAction wanted = desired.remove(target);
            if (wanted == null) {
                revertEntry(entry);
            } else if (entry.status() == ActiveActionStatus.ACTIVE
                    && entry.action().isEquivalentTo(wanted, settings.unchangedTolerance())) {
                if (entry.origin() != origin) {
                    ActiveAction relabelled = entry.withOrigin(origin);
                    active.put(target, relabelled);
                    persist(relabelled);
                }
                inEffect.add(entry.action());
            } else if (revertEntry(entry) && issue(wanted, origin)) {
                inEffect.add(wanted);
            }
        }

        for (OptimizationAction wanted : desired.values()) {
            if (pending.containsKey(wanted.targetComponent()) || active.containsKey(wanted.targetComponent())) {
                continue;
            }
            if (issue(wanted, origin)) {
                inEffect.add(wanted);
            }
        }
        return inEffect;
    }

    /**
     * Issues {@code action}; true when it succeeded or is still being applied.
     */
    private boolean issue(OptimizationAction action, ActionOrigin origin) {
        DispatchResult result = dispatcher.apply(action);
        return switch (result.status()) {
            case SUCCEEDED -> {
                ActiveAction entry = new ActiveAction(action, origin, ActiveActionStatus.ACTIVE, clock.instant());
                active.put(action.targetComponent(), entry);
                persist(entry);
                log.info("[Controller] Action applied target={} type={} intensity={} origin={} action={}",
                    action.targetComponent(), action.actionType().wireName(),
                    String.format("%.2f", action.intensity()), origin, action.id());
                yield true;
            }
            case PENDING -> {
                ActiveAction entry = new ActiveAction(action, origin, ActiveActionStatus.APPLYING, clock.instant());
                active.put(action.targetComponent(), entry);
                pending.put(action.targetComponent(),
                    new PendingDispatch(DispatchKind.APPLY, action.id(), result.pending()));
                persist(entry);
                yield true;
            }
            case FAILED -> {
                metrics.recordFailure(FailureKind.ACTUATION_FAILURE);
                recordStuck(action.id(), action.targetComponent(), "apply", describe(result));
                log.warn("[Controller] Apply stuck target={} action={} reason={}",
                    action.targetComponent(), action.id(), describe(result));
                yield false;
            }
        };
    }

    /**
     * Reverts {@code entry}; true only when the target is free afterwards.
     */
    private boolean revertEntry(ActiveAction entry) {
        String target = entry.targetComponent();
        DispatchResult result = dispatcher.revert(entry.actionId());
        return switch (result.status()) {
            case SUCCEEDED -> {
                active.remove(target);
                writes.submit(() -> store.deleteActiveAction(entry.actionId()));
                log.info("[Controller] Action reverted target={} action={}", target, entry.actionId());
                yield true;
            }
            case PENDING -> {
                ActiveAction reverting = entry.withStatus(ActiveActionStatus.REVERTING);
                active.put(target, reverting);
                pending.put(target, new PendingDispatch(DispatchKind.REVERT, entry.actionId(), result.pending()));
                persist(reverting);
                yield false;
            }
            case FAILED -> {
                metrics.recordFailure(FailureKind.ACTUATION_FAILURE);
                ActiveAction stuckEntry = entry.withStatus(ActiveActionStatus.REVERT_STUCK);
                active.put(target, stuckEntry);
                persist(stuckEntry);
                recordStuck(entry.actionId(), target, "revert", describe(result));
                log.warn("[Controller] Revert stuck target={} action={} reason={}",
                    target, entry.actionId(), describe(result));
                yield false;
            }
        };
    }

    /**
     * Resolves dispatches that outlived their soft timeout.
     */
    private void pollPending() {
        for (Map.Entry<String, PendingDispatch> e : new ArrayList<>(pending.entrySet())) {
            String target = e.getKey();
            PendingDispatch p = e.getValue();
            Optional<DispatchResult> done = dispatcher.poll(p.future());
            if (done.isEmpty()) {
                continue;
            }
            pending.remove(target);
            DispatchResult result = done.get();
            ActiveAction entry = active.get(target);
            boolean sameAction = entry != null && entry.actionId().equals(p.actionId());

            if (p.kind() == DispatchKind.APPLY_THEN_REVERT) {
                if (result.isSucceeded() && sameAction) {
                    log.info("[Controller] Pending apply landed after revert request, reverting target={} action={}",
                        target, p.actionId());
                    revertEntry(entry);
                } else if (result.isSucceeded()) {
                    undoLateApply(target, p.actionId());
                } else {
                    metrics.recordFailure(FailureKind.ACTUATION_FAILURE);
                    if (sameAction) {
                        active.remove(target);
                        writes.submit(() -> store.deleteActiveAction(p.actionId()));
                    }
                    log.info("[Controller] Pending apply never took effect, nothing to revert target={} action={}",
                        target, p.actionId());
                }
            } else if (p.kind() == DispatchKind.APPLY) {
                if (result.isSucceeded() && sameAction) {
                    ActiveAction confirmed = entry.withStatus(ActiveActionStatus.ACTIVE);
                    active.put(target, confirmed);
                    persist(confirmed);
                    log.info("[Controller] Pending apply confirmed target={} action={}", target, p.actionId());
                } else if (result.isSucceeded()) {
                    undoLateApply(target, p.actionId());
                } else {
                    metrics.recordFailure(FailureKind.ACTUATION_FAILURE);
                    recordStuck(p.actionId(), target, "apply", describe(result));
                    if (sameAction) {
                        active.remove(target);
                        writes.submit(() -> store.deleteActiveAction(p.actionId()));
                    }
                }
            } else if (sameAction) {
                if (result.isSucceeded()) {
                    active.remove(target);
                    writes.submit(() -> store.deleteActiveAction(p.actionId()));
                    log.info("[Controller] Pending revert confirmed target={} action={}", target, p.actionId());
                } else {
                    metrics.recordFailure(FailureKind.ACTUATION_FAILURE);
                    ActiveAction stuckEntry = entry.withStatus(ActiveActionStatus.REVERT_STUCK);
                    active.put(target, stuckEntry);
                    persist(stuckEntry);
                    recordStuck(p.actionId(), target, "revert", describe(result));
                }
            }
        }
    }

    /**
     * Takes back an apply that landed after its map entry was gone.
     */
    private void undoLateApply(String target, String actionId) {
        DispatchResult undo = dispatcher.revert(actionId);
        if (!undo.isSucceeded()) {
            metrics.recordFailure(FailureKind.ACTUATION_FAILURE);
            recordStuck(actionId, target, "revert", describe(undo));
            log.warn("[Controller] Late apply could not be undone target={} action={} reason={}",
                target, actionId, describe(undo));
        }
    }

    /**
     * Gives every pending dispatch up to the soft timeout to finish, then resolves what
     * finished.
     */
    private void awaitPending() {
        for (PendingDispatch p : new ArrayList<>(pending.values())) {
            dispatcher.settle(p.future());
        }
        pollPending();
    }

    /**
     * Retries stuck reverts. Runs on every state transition.
     */
    private void flushStuckReverts() {
        pollPending();
        for (ActiveAction entry : new ArrayList<>(active.values())) {
            if (entry.status() == ActiveActionStatus.REVERT_STUCK && !pending.containsKey(entry.targetComponent())) {
                revertEntry(entry);
            }
        }
    }

    private boolean hasEmergencyEntries() {
        for (ActiveAction entry : active.values()) {
            if (entry.origin() == ActionOrigin.EMERGENCY) return true;
        }
        return false;
    }

    private void enterEmergency(SystemSnapshot snapshot) {
        state = ControllerState.EMERGENCY;
        emergencyActivations++;
        log.warn("[Controller] Entering emergency mode battery={} active={}", snapshot.batteryPercent(), active.size());
        flushStuckReverts();
    }

    private void exitEmergency(SystemSnapshot snapshot) {
        state = ControllerState.RUNNING;
        log.info("[Controller] Exiting emergency mode battery={}", snapshot.batteryPercent());
        flushStuckReverts();
    }

    // ── outcomes ───────────────────────────────────────────────────────────

    private void recordOutcome(SystemSnapshot snapshot, DecisionResult decision, boolean emergency,
                               List<OptimizationAction> inEffect) {
        String decisionId = UUID.randomUUID().toString();
        Instant now = clock.instant();
        double savings = inEffect.stream().mapToDouble(OptimizationAction::estimatedSavings).sum();

        DecisionOutcome outcome = new DecisionOutcome(decisionId, snapshot.timestamp(),
            decision.features().toList(), decision.severity(),
            emergency ? DecisionPath.EMERGENCY : decision.source(),
            inEffect, savings, learner.satisfactionAverage(), now);

        lastDecisionId = decisionId;
        lastDecisionAt = now;
        learner.recordOutcome(outcome);
    }

    // ── commands ───────────────────────────────────────────────────────────

    public void pause() {
        lock.lock();
        try {
            if (state == ControllerState.RUNNING || state == ControllerState.EMERGENCY) {
                state = ControllerState.PAUSED;
                log.info("[Controller] Paused active={}", active.size());
                flushStuckReverts();
            }
        } finally {
            lock.unlock();
        }
    }

    public void resume() {
        lock.lock();
        try {
            if (state == ControllerState.PAUSED) {
                state = ControllerState.RUNNING;
                log.info("[Controller] Resumed mode={}", mode.name());
                flushStuckReverts();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Reverts every active action. The next tick decides afresh.
     */
    public List<RevertReport> revertAll() {
        lock.lock();
        try {
            pollPending();
            List<RevertReport> reports = revertEverything();
            log.info("[Controller] Revert-all requested reverted={}", reports.size());
            return reports;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Reverts everything and pauses, so nothing is re-applied until {@link #resume()}.
     */
    public List<RevertReport> emergencyRevert() {
        lock.lock();
        try {
            log.warn("[Controller] Emergency revert triggered active={}", active.size());
            pollPending();
            List<RevertReport> reports = revertEverything();
            if (state == ControllerState.RUNNING || state == ControllerState.EMERGENCY) {
                state = ControllerState.PAUSED;
            }
            long ok = reports.stream().filter(RevertReport::success).count();
            log.warn("[Controller] Emergency reverted {}/{} actions, state={}", ok, reports.size(), state);
            return reports;
        } finally {
            lock.unlock();
        }
    }

    private List<RevertReport> revertEverything() {
        List<RevertReport> reports = new ArrayList<>();
        for (ActiveAction entry : new ArrayList<>(active.values())) {
            String target = entry.targetComponent();
            PendingDispatch inFlight = pending.get(target);
            if (inFlight != null) {
                if (inFlight.kind() == DispatchKind.APPLY) {
                    ActiveAction reverting = entry.withStatus(ActiveActionStatus.REVERTING);
                    active.put(target, reverting);
                    pending.put(target, new PendingDispatch(DispatchKind.APPLY_THEN_REVERT,
                        inFlight.actionId(), inFlight.future()));
                    persist(reverting);
                }
                reports.add(new RevertReport(entry.actionId(), target, false, true,
                    inFlight.kind() == DispatchKind.REVERT ? "still running" : "revert queued behind pending apply"));
                continue;
            }
            DispatchResult result = dispatcher.revert(entry.actionId());
            if (result.isSucceeded()) {
                active.remove(target);
                writes.submit(() -> store.deleteActiveAction(entry.actionId()));
            } else if (result.isPending()) {
                ActiveAction reverting = entry.withStatus(ActiveActionStatus.REVERTING);
                active.put(target, reverting);
                pending.put(target, new PendingDispatch(DispatchKind.REVERT, entry.actionId(), result.pending()));
                persist(reverting);
            } else {
                metrics.recordFailure(FailureKind.ACTUATION_FAILURE);
                ActiveAction stuckEntry = entry.withStatus(ActiveActionStatus.REVERT_STUCK);
                active.put(target, stuckEntry);
                persist(stuckEntry);
                recordStuck(entry.actionId(), target, "revert", describe(result));
            }
            reports.add(new RevertReport(entry.actionId(), target, result.isSucceeded(), result.isPending(),
                describe(result)));
        }
        return reports;
    }

    public void setMode(ModeName name) {
        OptimizationMode next = settings.modes().get(name);
        if (next == null) {
            throw new IllegalArgumentException("Unknown mode " + name);
        }
        mode = next;
        log.info("[Controller] Mode set mode={} maxIntensity={} minConfidence={}",
            name, next.maxIntensity(), next.minConfidence());
    }

    /**
     * Records user feedback against the most recent decision.
     */
    public FeedbackRecord submitFeedback(double satisfaction, boolean performanceAcceptable,
                                         boolean batteryImprovement, String comments) {
        FeedbackRecord record = new FeedbackRecord(satisfaction, performanceAcceptable, batteryImprovement,
            comments, lastDecisionId, clock.instant());
        learner.submitFeedback(record);
        return record;
    }

    // ── read side ──────────────────────────────────────────────────────────

    public ControllerState state() {
        return state;
    }

    public OptimizationMode mode() {
        return mode;
    }

    public List<ActiveAction> activeActions() {
        lock.lock();
        try {
            return List.copyOf(active.values());
        } finally {
            lock.unlock();
        }
    }

    public int activeActionCount() {
        lock.lock();
        try {
            return active.size();
        } finally {
            lock.unlock();
        }
    }

    public AgentStatus status() {
        lock.lock();
        try {
            double savings = active.values().stream()
                .mapToDouble(a -> a.action().estimatedSavings())
                .sum();
            long modelVersion = learner.currentModel().map(SeverityModel::version).orElse(-1L);
            return new AgentStatus(mode.name(), state, active.size(), savings, learner.satisfactionAverage(),
                metrics.failureCounts(), new ArrayList<>(stuck), learner.calibration(), modelVersion,
                lastDecisionId, lastDecisionAt, totalTicks, totalDecisions, emergencyActivations);
        } finally {
            lock.unlock();
        }
    }

    // ── helpers ────────────────────────────────────────────────────────────

    private void persist(ActiveAction entry) {
        writes.submit(() -> store.saveActiveAction(entry));
    }

    private void recordStuck(String actionId, String target, String operation, String message) {
        stuck.addLast(new StuckAction(actionId, target, operation, message, clock.instant()));
        while (stuck.size() > MAX_STUCK_REPORTS) {
            stuck.removeFirst();
        }
    }

    private static String describe(DispatchResult result) {
        if (result.isPending()) return "still running";
        return result.result() != null ? result.result().message() : "";
    }
}
