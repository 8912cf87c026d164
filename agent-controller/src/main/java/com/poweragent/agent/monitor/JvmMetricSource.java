package com.poweragent.agent.monitor;

import com.poweragent.common.exception.SensorUnavailableException;

import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;

/**
 * Portable readings available to any JVM: system and process CPU load, physical memory
 * and process count. Battery, display, GPU, network and disk counters have no portable
 * API and always report as unavailable.
 */
public class JvmMetricSource implements MetricSource {

    private final OperatingSystemMXBean os = ManagementFactory.getOperatingSystemMXBean();

    @Override
    public double batteryPercent() {
        throw unavailable("battery_percent");
    }

    @Override
    public double batteryPowerDraw() {
        throw unavailable("battery_power_draw");
    }

    @Override
    public boolean powerPlugged() {
        throw unavailable("power_plugged");
    }

    @Override
    public double cpuPercent() {
        com.sun.management.OperatingSystemMXBean sun = sunBean("cpu_percent");
        double load = sun.getCpuLoad();
        if (load < 0) {
            throw new SensorUnavailableException("cpu_percent", "load not yet sampled");
        }
        return load * 100.0;
    }

    @Override
    public double cpuFreq() {
        throw unavailable("cpu_freq");
    }

    @Override
    public double memoryPercent() {
        com.sun.management.OperatingSystemMXBean sun = sunBean("memory_percent");
        long total = sun.getTotalMemorySize();
        if (total <= 0) {
            throw new SensorUnavailableException("memory_percent", "total memory unknown");
        }
        return 100.0 * (total - sun.getFreeMemorySize()) / total;
    }

    @Override
    public double gpuPercent() {
        throw unavailable("gpu_percent");
    }

    @Override
    public double gpuMemoryPercent() {
        throw unavailable("gpu_memory_percent");
    }

    @Override
    public long networkBytesSent() {
        throw unavailable("network_bytes_sent");
    }

    @Override
    public long networkBytesRecv() {
        throw unavailable("network_bytes_recv");
    }

    @Override
    public long diskIoRead() {
        throw unavailable("disk_io_read");
    }

    @Override
    public long diskIoWrite() {
        throw unavailable("disk_io_write");
    }

    @Override
    public int screenBrightness() {
        throw unavailable("screen_brightness");
    }

    @Override
    public int activeProcessCount() {
        return (int) ProcessHandle.allProcesses().count();
    }

    @Override
    public double targetAppCpu() {
        com.sun.management.OperatingSystemMXBean sun = sunBean("target_app_cpu");
        double load = sun.getProcessCpuLoad();
        if (load < 0) {
            throw new SensorUnavailableException("target_app_cpu", "load not yet sampled");
        }
        return load * 100.0;
    }

    @Override
    public double targetAppMemory() {
        com.sun.management.OperatingSystemMXBean sun = sunBean("target_app_memory");
        long total = sun.getTotalMemorySize();
        if (total <= 0) {
            throw new SensorUnavailableException("target_app_memory", "total memory unknown");
        }
        Runtime rt = Runtime.getRuntime();
        return 100.0 * (rt.totalMemory() - rt.freeMemory()) / total;
    }

    private com.sun.management.OperatingSystemMXBean sunBean(String sensor) {
        if (os instanceof com.sun.management.OperatingSystemMXBean) {
            return (com.sun.management.OperatingSystemMXBean) os;
        }
        throw new SensorUnavailableException(sensor, "platform MXBean not available");
    }

    private static SensorUnavailableException unavailable(String sensor) {
        return new SensorUnavailableException(sensor, "no portable reader");
    }
}
