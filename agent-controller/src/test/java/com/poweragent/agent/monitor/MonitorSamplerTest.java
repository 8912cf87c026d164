package com.poweragent.agent.monitor;

import com.poweragent.agent.metrics.AgentMetrics;
import com.poweragent.common.exception.FailureKind;
import com.poweragent.common.exception.SensorUnavailableException;
import com.poweragent.common.model.SystemSnapshot;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MonitorSamplerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    @Mock
    private MetricSource source;

    private SnapshotCell   cell;
    private AgentMetrics   metrics;
    private MonitorSampler sampler;

    @BeforeEach
    void setUp() {
        cell    = new SnapshotCell();
        metrics = new AgentMetrics(new SimpleMeterRegistry());
        sampler = new MonitorSampler(source, cell, metrics, Clock.fixed(NOW, ZoneOffset.UTC),
            Duration.ofSeconds(2), VirtualTimeScheduler.create());
    }

    @Test
    @DisplayName("readings are copied into the published snapshot")
    void sampleOnce_publishesReadings() {
        when(source.batteryPercent()).thenReturn(42.0);
        when(source.cpuPercent()).thenReturn(63.0);
        when(source.powerPlugged()).thenReturn(false);
        when(source.screenBrightness()).thenReturn(55);

        SystemSnapshot snapshot = sampler.sampleOnce();

        assertEquals(42.0, snapshot.batteryPercent());
        assertEquals(63.0, snapshot.cpuPercent());
        assertFalse(snapshot.powerPlugged());
        assertEquals(55, snapshot.screenBrightness());
        assertEquals(NOW, snapshot.timestamp());
        assertFalse(snapshot.isDegraded());
        assertSame(snapshot, cell.latestSnapshot().orElseThrow());
    }

    @Test
    @DisplayName("unavailable sensors → documented defaults and listed as unavailable")
    void unavailableSensors_useDefaults() {
        when(source.batteryPercent()).thenThrow(new SensorUnavailableException("battery_percent", "no battery"));
        when(source.powerPlugged()).thenThrow(new SensorUnavailableException("power_plugged", "no battery"));
        when(source.screenBrightness()).thenThrow(new SensorUnavailableException("screen_brightness", "headless"));
        when(source.gpuPercent()).thenThrow(new IllegalStateException("driver crashed"));

        SystemSnapshot snapshot = sampler.sampleOnce();

        assertEquals(100.0, snapshot.batteryPercent());
        assertTrue(snapshot.powerPlugged());
        assertEquals(70, snapshot.screenBrightness());
        assertEquals(0.0, snapshot.gpuPercent());
        assertEquals(Set.of("battery_percent", "power_plugged", "screen_brightness", "gpu_percent"),
            snapshot.unavailableSensors());
    }

    @Test
    @DisplayName("sensor failures are counted once per outage")
    void sensorOutage_countedOnTransition() {
        when(source.batteryPercent())
            .thenThrow(new SensorUnavailableException("battery_percent", "gone"))
            .thenThrow(new SensorUnavailableException("battery_percent", "gone"))
            .thenReturn(80.0)
            .thenThrow(new SensorUnavailableException("battery_percent", "gone"));

        sampler.sampleOnce();
        sampler.sampleOnce();
        assertEquals(1, metrics.failureCount(FailureKind.SENSOR_UNAVAILABLE));

        assertEquals(80.0, sampler.sampleOnce().batteryPercent());
        assertEquals(1, metrics.failureCount(FailureKind.SENSOR_UNAVAILABLE));

        sampler.sampleOnce();
        assertEquals(2, metrics.failureCount(FailureKind.SENSOR_UNAVAILABLE));
    }

    @Test
    @DisplayName("start() samples at the configured cadence until stop()")
    void start_samplesOnInterval() {
        VirtualTimeScheduler scheduler = VirtualTimeScheduler.create();
        MonitorSampler timed = new MonitorSampler(source, cell, metrics, Clock.fixed(NOW, ZoneOffset.UTC),
            Duration.ofSeconds(2), scheduler);

        timed.start();
        scheduler.advanceTimeBy(Duration.ofSeconds(4));
        verify(source, times(3)).cpuPercent();

        timed.stop();
        scheduler.advanceTimeBy(Duration.ofSeconds(10));
        verify(source, times(3)).cpuPercent();
        assertTrue(cell.latestSnapshot().isPresent());
    }
}
