package com.poweragent.agent.actuator;

import com.poweragent.common.model.ActionResult;
import com.poweragent.common.model.OptimizationAction;

import java.util.List;
import java.util.Set;

/**
 * Applies and reverts optimization actions on the machine.
 *
 * <p>Calls may block and may fail; callers are expected to run them off the tick thread
 * and to retry. Implementations must be thread-safe.
 */
public interface Actuator {

    ActionResult apply(OptimizationAction action);

    ActionResult revert(String actionId);

    /** Ids of actions currently in effect. */
    List<String> listActive();

    /** Target components this actuator can drive. */
    Set<String> knownTargets();
}
