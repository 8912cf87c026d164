package com.poweragent.agent.monitor;

import com.poweragent.agent.metrics.AgentMetrics;
import com.poweragent.common.exception.FailureKind;
import com.poweragent.common.exception.SensorUnavailableException;
import com.poweragent.common.model.SystemSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.time.Duration;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Polls a {@link MetricSource} on a fixed cadence and publishes each reading into the
 * {@link SnapshotCell}.
 *
 * <p>A sensor that throws {@link SensorUnavailableException} is replaced by its default
 * (battery 100 % and plugged, brightness 70, everything else 0) and listed in the
 * snapshot's {@code unavailableSensors}. A SensorUnavailable failure is counted and
 * logged when a sensor stops answering, not on every cycle it stays down.
 */
public class MonitorSampler {

    private static final Logger log = LoggerFactory.getLogger(MonitorSampler.class);

    private final MetricSource source;
    private final SnapshotCell cell;
    private final AgentMetrics metrics;
    private final Clock        clock;
    private final Duration     interval;
    private final Scheduler    scheduler;

    private final Set<String> downSensors = new HashSet<>();
    private volatile Disposable subscription;

    public MonitorSampler(MetricSource source, SnapshotCell cell, AgentMetrics metrics,
                          Clock clock, Duration interval, Scheduler scheduler) {
        this.source    = source;
        this.cell      = cell;
        this.metrics   = metrics;
        this.clock     = clock;
        this.interval  = interval;
        this.scheduler = scheduler;
    }

    public synchronized void start() {
        if (subscription != null && !subscription.isDisposed()) {
            return;
        }
        log.info("[Monitor] Sampling started intervalMs={}", interval.toMillis());
        subscription = Flux.interval(Duration.ZERO, interval, scheduler)
            .onBackpressureDrop()
            .subscribe(
                i -> sampleOnce(),
                err -> log.error("[Monitor] Sampling loop terminated unexpectedly", err));
    }

    public synchronized void stop() {
        if (subscription != null) {
            subscription.dispose();
            subscription = null;
            log.info("[Monitor] Sampling stopped");
        }
    }

    /**
     * Takes one reading and publishes it. Never throws.
     */
    public SystemSnapshot sampleOnce() {
        Set<String> missing = new LinkedHashSet<>();

        SystemSnapshot snapshot = SystemSnapshot.builder()
            .timestamp(clock.instant())
            .batteryPercent(read("battery_percent", source::batteryPercent, 100.0, missing))
            .batteryPowerDraw(read("battery_power_draw", source::batteryPowerDraw, 0.0, missing))
            .powerPlugged(read("power_plugged", source::powerPlugged, Boolean.TRUE, missing))
            .cpuPercent(read("cpu_percent", source::cpuPercent, 0.0, missing))
            .cpuFreq(read("cpu_freq", source::cpuFreq, 0.0, missing))
            .memoryPercent(read("memory_percent", source::memoryPercent, 0.0, missing))
            .gpuPercent(read("gpu_percent", source::gpuPercent, 0.0, missing))
            .gpuMemoryPercent(read("gpu_memory_percent", source::gpuMemoryPercent, 0.0, missing))
            .networkBytesSent(read("network_bytes_sent", source::networkBytesSent, 0L, missing))
            .networkBytesRecv(read("network_bytes_recv", source::networkBytesRecv, 0L, missing))
            .diskIoRead(read("disk_io_read", source::diskIoRead, 0L, missing))
            .diskIoWrite(read("disk_io_write", source::diskIoWrite, 0L, missing))
            .screenBrightness(read("screen_brightness", source::screenBrightness, 70, missing))
            .activeProcessCount(read("active_process_count", source::activeProcessCount, 0, missing))
            .targetAppCpu(read("target_app_cpu", source::targetAppCpu, 0.0, missing))
            .targetAppMemory(read("target_app_memory", source::targetAppMemory, 0.0, missing))
            .unavailableSensors(missing)
            .build();

        trackSensorHealth(missing);
        cell.publish(snapshot);
        log.debug("[Monitor] Snapshot battery={} cpu={} plugged={} degraded={}",
            snapshot.batteryPercent(), snapshot.cpuPercent(), snapshot.powerPlugged(), snapshot.isDegraded());
        return snapshot;
    }

    private <T> T read(String sensor, Supplier<T> reader, T fallback, Set<String> missing) {
        try {
            return reader.get();
        } catch (SensorUnavailableException e) {
            missing.add(sensor);
            if (!downSensors.contains(sensor)) {
                log.warn("[Monitor] Sensor unavailable, using default sensor={} default={} reason={}",
                    sensor, fallback, e.getMessage());
            }
            return fallback;
        } catch (RuntimeException e) {
            missing.add(sensor);
            log.warn("[Monitor] Sensor read failed, using default sensor={} default={}", sensor, fallback, e);
            return fallback;
        }
    }

    private synchronized void trackSensorHealth(Set<String> missing) {
        for (String sensor : missing) {
            if (downSensors.add(sensor)) {
                metrics.recordFailure(FailureKind.SENSOR_UNAVAILABLE);
            }
        }
        downSensors.removeIf(sensor -> {
            boolean recovered = !missing.contains(sensor);
            if (recovered) {
                log.info("[Monitor] Sensor recovered sensor={}", sensor);
            }
            return recovered;
        });
    }
}
