package com.poweragent.agent.actuator;

import com.poweragent.common.model.ActionResult;
import com.poweragent.common.model.OptimizationAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process stand-in for a platform optimizer. Records what would be applied and always
 * succeeds. Wired by default for every configured target.
 */
public class SimulatedComponentOptimizer implements ComponentOptimizer {

    private static final Logger log = LoggerFactory.getLogger(SimulatedComponentOptimizer.class);

    private final String targetComponent;
    private final Map<String, OptimizationAction> applied = new ConcurrentHashMap<>();

    public SimulatedComponentOptimizer(String targetComponent) {
        this.targetComponent = targetComponent;
    }

    @Override
    public String targetComponent() {
        return targetComponent;
    }

    @Override
    public ActionResult apply(OptimizationAction action) {
        applied.put(action.id(), action);
        log.info("[Actuator] Simulated apply target={} type={} intensity={} action={}",
            targetComponent, action.actionType().wireName(), String.format("%.2f", action.intensity()), action.id());
        return ActionResult.ok("applied " + action.actionType().wireName() + " on " + targetComponent);
    }

    @Override
    public ActionResult revert(String actionId) {
        OptimizationAction removed = applied.remove(actionId);
        if (removed == null) {
            return ActionResult.ok("nothing to revert for " + actionId);
        }
        log.info("[Actuator] Simulated revert target={} action={}", targetComponent, actionId);
        return ActionResult.ok("reverted " + removed.actionType().wireName() + " on " + targetComponent);
    }

    @Override
    public Collection<String> activeActionIds() {
        return List.copyOf(applied.keySet());
    }
}
