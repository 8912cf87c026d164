package com.poweragent.agent.metrics;

import com.poweragent.common.exception.FailureKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Failure counters ({@code power.agent.failures{kind=...}}) and the active-action gauge.
 * Counts are read back for the status endpoint.
 */
public class AgentMetrics {

    static final String FAILURES     = "power.agent.failures";
    static final String ACTIVE_GAUGE = "power.agent.active.actions";

    private final MeterRegistry            registry;
    private final Map<FailureKind, Counter> failures = new EnumMap<>(FailureKind.class);

    public AgentMetrics(MeterRegistry registry) {
        this.registry = registry;
        for (FailureKind kind : FailureKind.values()) {
            failures.put(kind, Counter.builder(FAILURES)
                .description("Non-fatal failures observed by the control loop")
                .tag("kind", kind.name().toLowerCase(Locale.ROOT))
                .register(registry));
        }
    }

    public void recordFailure(FailureKind kind) {
        failures.get(kind).increment();
    }

    public long failureCount(FailureKind kind) {
        return (long) failures.get(kind).count();
    }

    public Map<FailureKind, Long> failureCounts() {
        Map<FailureKind, Long> out = new EnumMap<>(FailureKind.class);
        failures.forEach((kind, counter) -> out.put(kind, (long) counter.count()));
        return out;
    }

    public void bindActiveActions(Supplier<Number> activeCount) {
        Gauge.builder(ACTIVE_GAUGE, activeCount)
            .description("Optimization actions currently in effect")
            .register(registry);
    }
}
