package com.poweragent.agent.loop;

/**
 * Whether an active action was issued by a normal decision or by the emergency override.
 */
public enum ActionOrigin {
    NORMAL,
    EMERGENCY
}
