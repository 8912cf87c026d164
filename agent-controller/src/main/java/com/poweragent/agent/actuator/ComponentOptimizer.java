package com.poweragent.agent.actuator;

import com.poweragent.common.model.ActionResult;
import com.poweragent.common.model.OptimizationAction;

import java.util.Collection;

/**
 * Capability of one integrated component (display, CPU governor, an application...) to
 * take and release optimization actions addressed to its target key.
 */
public interface ComponentOptimizer {

    String targetComponent();

    ActionResult apply(OptimizationAction action);

    ActionResult revert(String actionId);

    Collection<String> activeActionIds();
}
