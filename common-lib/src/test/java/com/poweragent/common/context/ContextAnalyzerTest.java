package com.poweragent.common.context;

import com.poweragent.common.model.BatteryLevel;
import com.poweragent.common.model.ContextState;
import com.poweragent.common.model.PerformanceDemand;
import com.poweragent.common.model.PowerSource;
import com.poweragent.common.model.SystemSnapshot;
import com.poweragent.common.model.TimeOfDay;
import com.poweragent.common.model.UserActivity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Deterministic verification of {@link ContextAnalyzer} classification and scoring.
 */
class ContextAnalyzerTest {

    private static final Instant NOON = Instant.parse("2024-05-01T12:00:00Z");

    private final ContextAnalyzer analyzer =
        new ContextAnalyzer(ContextThresholds.defaults().withZone(ZoneOffset.UTC));

    private static SystemSnapshot.Builder base() {
        return SystemSnapshot.builder().timestamp(NOON).powerPlugged(false).cpuPercent(40).targetAppCpu(20);
    }

    // ── battery ────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("battery level")
    class BatteryTests {

        @Test
        @DisplayName("4 % → CRITICAL")
        void below5_isCritical() {
            ContextState ctx = analyzer.analyze(base().batteryPercent(4).build(), List.of());
            assertEquals(BatteryLevel.CRITICAL, ctx.batteryLevel());
            assertTrue(ctx.isCritical());
        }

        @Test
        @DisplayName("boundaries are inclusive: 5 → CRITICAL, 30 → LOW, 60 → MEDIUM")
        void inclusiveBoundaries() {
            assertEquals(BatteryLevel.CRITICAL, analyzer.analyze(base().batteryPercent(5).build(), List.of()).batteryLevel());
            assertEquals(BatteryLevel.LOW,      analyzer.analyze(base().batteryPercent(30).build(), List.of()).batteryLevel());
            assertEquals(BatteryLevel.MEDIUM,   analyzer.analyze(base().batteryPercent(60).build(), List.of()).batteryLevel());
        }

        @Test
        @DisplayName("97 % is FULL only when plugged")
        void fullRequiresPlug() {
            assertEquals(BatteryLevel.FULL,
                analyzer.analyze(base().batteryPercent(97).powerPlugged(true).build(), List.of()).batteryLevel());
            assertEquals(BatteryLevel.HIGH,
                analyzer.analyze(base().batteryPercent(97).build(), List.of()).batteryLevel());
        }

        @Test
        @DisplayName("negative power draw counts as plugged")
        void chargingDraw_isPlugged() {
            ContextState ctx = analyzer.analyze(base().batteryPercent(50).batteryPowerDraw(-12.0).build(), List.of());
            assertEquals(PowerSource.PLUGGED, ctx.powerSource());
        }
    }

    // ── demand ─────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("performance demand")
    class DemandTests {

        @Test
        @DisplayName("cpu + gpu > 80 → HEAVY")
        void heavy() {
            ContextState ctx = analyzer.analyze(base().cpuPercent(60).gpuPercent(25).build(), List.of());
            assertEquals(PerformanceDemand.HEAVY, ctx.performanceDemand());
        }

        @Test
        @DisplayName("exactly 50 is LIGHT, not MODERATE")
        void boundaryIsExclusive() {
            ContextState ctx = analyzer.analyze(base().cpuPercent(50).build(), List.of());
            assertEquals(PerformanceDemand.LIGHT, ctx.performanceDemand());
        }

        @Test
        @DisplayName("20 or less → IDLE")
        void idle() {
            ContextState ctx = analyzer.analyze(base().cpuPercent(15).gpuPercent(5).build(), List.of());
            assertEquals(PerformanceDemand.IDLE, ctx.performanceDemand());
        }
    }

    // ── activity ───────────────────────────────────────────────────────────

    @Nested
    @DisplayName("user activity")
    class ActivityTests {

        private List<SystemSnapshot> quietHistory(Instant end, Duration span, Duration step) {
            List<SystemSnapshot> history = new ArrayList<>();
            for (Instant t = end.minus(span); t.isBefore(end); t = t.plus(step)) {
                history.add(base().timestamp(t).cpuPercent(3).targetAppCpu(1).build());
            }
            return history;
        }

        @Test
        @DisplayName("busy snapshot → ACTIVE")
        void busy_isActive() {
            assertEquals(UserActivity.ACTIVE, analyzer.analyze(base().build(), List.of()).userActivity());
        }

        @Test
        @DisplayName("quiet for one minute at noon → IDLE")
        void shortQuiet_isIdle() {
            SystemSnapshot now = base().cpuPercent(3).targetAppCpu(1).build();
            ContextState ctx = analyzer.analyze(now, quietHistory(NOON, Duration.ofMinutes(1), Duration.ofSeconds(10)));
            assertEquals(UserActivity.IDLE, ctx.userActivity());
        }

        @Test
        @DisplayName("quiet for six minutes → AWAY")
        void longQuiet_isAway() {
            SystemSnapshot now = base().cpuPercent(3).targetAppCpu(1).build();
            ContextState ctx = analyzer.analyze(now, quietHistory(NOON, Duration.ofMinutes(6), Duration.ofSeconds(30)));
            assertEquals(UserActivity.AWAY, ctx.userActivity());
        }

        @Test
        @DisplayName("an active sample inside the window resets the quiet streak")
        void interruptedQuiet_isIdle() {
            List<SystemSnapshot> history = new ArrayList<>(quietHistory(NOON.minus(Duration.ofMinutes(2)),
                Duration.ofMinutes(6), Duration.ofSeconds(30)));
            history.add(base().timestamp(NOON.minus(Duration.ofMinutes(1))).cpuPercent(60).build());
            SystemSnapshot now = base().cpuPercent(3).targetAppCpu(1).build();
            assertEquals(UserActivity.IDLE, analyzer.analyze(now, history).userActivity());
        }

        @Test
        @DisplayName("quiet at 02:00 → AWAY")
        void quietAtNight_isAway() {
            SystemSnapshot now = base().timestamp(Instant.parse("2024-05-01T02:00:00Z"))
                .cpuPercent(3).targetAppCpu(1).build();
            ContextState ctx = analyzer.analyze(now, List.of());
            assertEquals(UserActivity.AWAY, ctx.userActivity());
            assertEquals(TimeOfDay.NIGHT, ctx.timeOfDay());
        }
    }

    // ── score ──────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("context score")
    class ScoreTests {

        @Test
        @DisplayName("calmest state scores 0, most severe scores 3")
        void extremes() {
            assertEquals(0.0, ContextAnalyzer.score(BatteryLevel.FULL, PerformanceDemand.IDLE,
                UserActivity.ACTIVE, PowerSource.PLUGGED), 1e-9);
            assertEquals(3.0, ContextAnalyzer.score(BatteryLevel.CRITICAL, PerformanceDemand.HEAVY,
                UserActivity.AWAY, PowerSource.BATTERY), 1e-9);
        }

        @Test
        @DisplayName("score never decreases as any field becomes more severe")
        void monotonic() {
            for (BatteryLevel b : BatteryLevel.values())
                for (PerformanceDemand d : PerformanceDemand.values())
                    for (UserActivity a : UserActivity.values())
                        for (PowerSource p : PowerSource.values()) {
                            double s = ContextAnalyzer.score(b, d, a, p);
                            assertTrue(s >= 0.0 && s <= 3.0);
                            for (BatteryLevel worse : BatteryLevel.values()) {
                                if (worse.severity() >= b.severity()) {
                                    assertTrue(ContextAnalyzer.score(worse, d, a, p) >= s);
                                }
                            }
                        }
        }

        @Test
        @DisplayName("low battery, moderate demand, unplugged → 2.0125")
        void scenarioValue() {
            ContextState ctx = analyzer.analyze(base().batteryPercent(10).cpuPercent(80).build(), List.of());
            assertEquals(BatteryLevel.LOW, ctx.batteryLevel());
            assertEquals(PerformanceDemand.MODERATE, ctx.performanceDemand());
            assertEquals(2.0125, ctx.contextScore(), 1e-9);
        }
    }
}
