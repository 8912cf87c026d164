package com.poweragent.agent.monitor;

import com.poweragent.common.model.SystemSnapshot;

import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Single-slot, last-write-wins holder shared between the sampler (writer) and the
 * control loop (reader).
 */
public class SnapshotCell implements Monitor {

    private final ReentrantLock lock = new ReentrantLock();
    private SystemSnapshot latest;

    public void publish(SystemSnapshot snapshot) {
        lock.lock();
        try {
            latest = snapshot;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<SystemSnapshot> latestSnapshot() {
        lock.lock();
        try {
            return Optional.ofNullable(latest);
        } finally {
            lock.unlock();
        }
    }
}
