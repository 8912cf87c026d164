package com.poweragent.agent.loop;

public enum ActiveActionStatus {
    /** Confirmed in effect. */
    ACTIVE,
    /** Apply dispatched, not yet confirmed. */
    APPLYING,
    /** Revert dispatched, not yet confirmed. */
    REVERTING,
    /** Revert exhausted its retries; retried on later ticks and state changes. */
    REVERT_STUCK
}
