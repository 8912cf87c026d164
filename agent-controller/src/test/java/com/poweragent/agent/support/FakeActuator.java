package com.poweragent.agent.support;

import com.poweragent.agent.actuator.Actuator;
import com.poweragent.common.model.ActionResult;
import com.poweragent.common.model.OptimizationAction;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Records every call and keeps the live action ids per target. Applies and reverts can be
 * made to fail on demand, or held until released to outlive the dispatch timeout.
 */
public class FakeActuator implements Actuator {

    public static final Set<String> TARGETS = Collections.unmodifiableSet(
        new LinkedHashSet<>(List.of("system", "display", "target_app", "network", "background")));

    public final AtomicInteger applyCalls  = new AtomicInteger();
    public final AtomicInteger revertCalls = new AtomicInteger();

    public volatile boolean rejectApplies;
    public volatile boolean rejectReverts;

    private volatile CountDownLatch applyGate;
    private volatile CountDownLatch revertGate;

    private final Map<String, String>             liveTargets = new LinkedHashMap<>();
    private final Map<String, OptimizationAction> applied     = new LinkedHashMap<>();
    private final List<String>                    reverted    = new ArrayList<>();

    @Override
    public ActionResult apply(OptimizationAction action) {
        applyCalls.incrementAndGet();
        pass(applyGate);
        synchronized (this) {
            if (rejectApplies) {
                return ActionResult.failed("apply rejected");
            }
            liveTargets.put(action.id(), action.targetComponent());
            applied.put(action.id(), action);
            return ActionResult.ok("applied");
        }
    }

    @Override
    public ActionResult revert(String actionId) {
        revertCalls.incrementAndGet();
        pass(revertGate);
        synchronized (this) {
            if (rejectReverts) {
                return ActionResult.failed("revert rejected");
            }
            liveTargets.remove(actionId);
            reverted.add(actionId);
            return ActionResult.ok("reverted");
        }
    }

    /** Blocks applies until {@link #releaseApplies()}. */
    public void holdApplies() {
        applyGate = new CountDownLatch(1);
    }

    public void releaseApplies() {
        CountDownLatch gate = applyGate;
        applyGate = null;
        if (gate != null) gate.countDown();
    }

    /** Blocks reverts until {@link #releaseReverts()}. */
    public void holdReverts() {
        revertGate = new CountDownLatch(1);
    }

    public void releaseReverts() {
        CountDownLatch gate = revertGate;
        revertGate = null;
        if (gate != null) gate.countDown();
    }

    private static void pass(CountDownLatch gate) {
        if (gate == null) {
            return;
        }
        try {
            gate.await(10, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public synchronized List<String> listActive() {
        return new ArrayList<>(liveTargets.keySet());
    }

    @Override
    public Set<String> knownTargets() {
        return TARGETS;
    }

    /** Marks an action as already live, as if applied before a restart. */
    public synchronized void preload(String actionId, String target) {
        liveTargets.put(actionId, target);
    }

    public synchronized Map<String, String> liveTargets() {
        return new LinkedHashMap<>(liveTargets);
    }

    public synchronized Set<String> liveTargetComponents() {
        return new LinkedHashSet<>(liveTargets.values());
    }

    public synchronized List<String> reverted() {
        return new ArrayList<>(reverted);
    }

    public synchronized OptimizationAction applied(String actionId) {
        return applied.get(actionId);
    }
}
