package com.poweragent.agent.monitor;

import com.poweragent.common.model.SystemSnapshot;

import java.util.Optional;

/**
 * Source of the most recent machine-state sample. Never blocks; staleness is judged by
 * the caller from the snapshot timestamp.
 */
public interface Monitor {

    Optional<SystemSnapshot> latestSnapshot();
}
