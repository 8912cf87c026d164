package com.poweragent.agent.monitor;

import com.poweragent.common.exception.SensorUnavailableException;

/**
 * Raw readings for one monitor cycle. Each reader either returns a value or throws
 * {@link SensorUnavailableException}; the sampler substitutes the metric's default.
 */
public interface MetricSource {

    double batteryPercent();

    /** Watts; positive while discharging, negative while charging. */
    double batteryPowerDraw();

    boolean powerPlugged();

    double cpuPercent();

    double cpuFreq();

    double memoryPercent();

    double gpuPercent();

    double gpuMemoryPercent();

    long networkBytesSent();

    long networkBytesRecv();

    long diskIoRead();

    long diskIoWrite();

    int screenBrightness();

    int activeProcessCount();

    double targetAppCpu();

    double targetAppMemory();
}
