package com.poweragent.agent.actuator;

import com.poweragent.common.model.ActionResult;
import com.poweragent.common.model.OptimizationAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link Actuator} that routes each action to the {@link ComponentOptimizer} registered for
 * its target component.
 */
public class ComponentOptimizerRegistry implements Actuator {

    private static final Logger log = LoggerFactory.getLogger(ComponentOptimizerRegistry.class);

    private final Map<String, ComponentOptimizer> optimizers = new ConcurrentHashMap<>();

    public ComponentOptimizerRegistry(List<ComponentOptimizer> initial) {
        initial.forEach(this::register);
    }

    public void register(ComponentOptimizer optimizer) {
        ComponentOptimizer previous = optimizers.put(optimizer.targetComponent(), optimizer);
        if (previous != null) {
            log.warn("[Actuator] Optimizer replaced target={}", optimizer.targetComponent());
        } else {
            log.info("[Actuator] Optimizer registered target={}", optimizer.targetComponent());
        }
    }

    public void unregister(String targetComponent) {
        if (optimizers.remove(targetComponent) != null) {
            log.info("[Actuator] Optimizer unregistered target={}", targetComponent);
        }
    }

    @Override
    public ActionResult apply(OptimizationAction action) {
        ComponentOptimizer optimizer = optimizers.get(action.targetComponent());
        if (optimizer == null) {
            return ActionResult.failed("No optimizer registered for target " + action.targetComponent());
        }
        return optimizer.apply(action);
    }

    @Override
    public ActionResult revert(String actionId) {
        for (ComponentOptimizer optimizer : optimizers.values()) {
            if (optimizer.activeActionIds().contains(actionId)) {
                return optimizer.revert(actionId);
            }
        }
        return ActionResult.ok("Action " + actionId + " not active");
    }

    @Override
    public List<String> listActive() {
        List<String> ids = new ArrayList<>();
        optimizers.values().forEach(o -> ids.addAll(o.activeActionIds()));
        return ids;
    }

    @Override
    public Set<String> knownTargets() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(optimizers.keySet()));
    }
}
