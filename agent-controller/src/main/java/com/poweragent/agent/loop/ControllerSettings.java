package com.poweragent.agent.loop;

import com.poweragent.common.model.ModeName;
import com.poweragent.common.model.OptimizationMode;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Controller tunables resolved from configuration.
 */
public record ControllerSettings(
    Duration                             monitoringInterval,
    int                                  trailingWindow,
    double                               unchangedTolerance,
    Map<ModeName, OptimizationMode>      modes,
    ModeName                             initialMode,
    Duration                             storeTimeout
) {

    public ControllerSettings {
        modes = Map.copyOf(modes);
        if (!modes.containsKey(initialMode)) {
            throw new IllegalArgumentException("No settings for initial mode " + initialMode);
        }
    }

    public static ControllerSettings defaults() {
        Map<ModeName, OptimizationMode> modes = new EnumMap<>(ModeName.class);
        modes.put(ModeName.CONSERVATIVE, OptimizationMode.conservative());
        modes.put(ModeName.BALANCED,     OptimizationMode.balanced());
        modes.put(ModeName.AGGRESSIVE,   OptimizationMode.aggressive());
        return new ControllerSettings(Duration.ofSeconds(2), 30, 0.05, modes, ModeName.BALANCED,
            Duration.ofSeconds(5));
    }
}
