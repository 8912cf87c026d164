package com.poweragent.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Set;

/**
 * One sample of machine state produced by a monitor cycle. Immutable once produced.
 *
 * <p>{@code batteryPowerDraw} is positive while discharging and negative while charging.
 * {@code unavailableSensors} lists the metrics whose value is a substituted default because
 * the sensor could not be read in this cycle.
 */
public record SystemSnapshot(
    @JsonProperty("timestamp")          Instant     timestamp,
    @JsonProperty("batteryPercent")     double      batteryPercent,
    @JsonProperty("batteryPowerDraw")   double      batteryPowerDraw,
    @JsonProperty("powerPlugged")       boolean     powerPlugged,
    @JsonProperty("cpuPercent")         double      cpuPercent,
    @JsonProperty("cpuFreq")            double      cpuFreq,
    @JsonProperty("memoryPercent")      double      memoryPercent,
    @JsonProperty("gpuPercent")         double      gpuPercent,
    @JsonProperty("gpuMemoryPercent")   double      gpuMemoryPercent,
    @JsonProperty("networkBytesSent")   long        networkBytesSent,
    @JsonProperty("networkBytesRecv")   long        networkBytesRecv,
    @JsonProperty("diskIoRead")         long        diskIoRead,
    @JsonProperty("diskIoWrite")        long        diskIoWrite,
    @JsonProperty("screenBrightness")   int         screenBrightness,
    @JsonProperty("activeProcessCount") int         activeProcessCount,
    @JsonProperty("targetAppCpu")       double      targetAppCpu,
    @JsonProperty("targetAppMemory")    double      targetAppMemory,
    @JsonProperty("unavailableSensors") Set<String> unavailableSensors
) {

    public SystemSnapshot {
        unavailableSensors = unavailableSensors == null ? Set.of() : Set.copyOf(unavailableSensors);
    }

    /** Megabytes moved over the network (sent + received) since the monitor baseline. */
    public double networkActivityMb() {
        return (networkBytesSent + networkBytesRecv) / 1024.0 / 1024.0;
    }

    public boolean isDegraded() {
        return !unavailableSensors.isEmpty();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Instant timestamp = Instant.now();
        private double batteryPercent = 100.0;
        private double batteryPowerDraw;
        private boolean powerPlugged;
        private double cpuPercent;
        private double cpuFreq;
        private double memoryPercent;
        private double gpuPercent;
        private double gpuMemoryPercent;
        private long networkBytesSent;
        private long networkBytesRecv;
        private long diskIoRead;
        private long diskIoWrite;
        private int screenBrightness = 70;
        private int activeProcessCount;
        private double targetAppCpu;
        private double targetAppMemory;
        private Set<String> unavailableSensors = Set.of();

        private Builder() {}

        public Builder timestamp(Instant v)          { this.timestamp = v; return this; }
        public Builder batteryPercent(double v)      { this.batteryPercent = v; return this; }
        public Builder batteryPowerDraw(double v)    { this.batteryPowerDraw = v; return this; }
        public Builder powerPlugged(boolean v)       { this.powerPlugged = v; return this; }
        public Builder cpuPercent(double v)          { this.cpuPercent = v; return this; }
        public Builder cpuFreq(double v)             { this.cpuFreq = v; return this; }
        public Builder memoryPercent(double v)       { this.memoryPercent = v; return this; }
        public Builder gpuPercent(double v)          { this.gpuPercent = v; return this; }
        public Builder gpuMemoryPercent(double v)    { this.gpuMemoryPercent = v; return this; }
        public Builder networkBytesSent(long v)      { this.networkBytesSent = v; return this; }
        public Builder networkBytesRecv(long v)      { this.networkBytesRecv = v; return this; }
        public Builder diskIoRead(long v)            { this.diskIoRead = v; return this; }
        public Builder diskIoWrite(long v)           { this.diskIoWrite = v; return this; }
        public Builder screenBrightness(int v)       { this.screenBrightness = v; return this; }
        public Builder activeProcessCount(int v)     { this.activeProcessCount = v; return this; }
        public Builder targetAppCpu(double v)        { this.targetAppCpu = v; return this; }
        public Builder targetAppMemory(double v)     { this.targetAppMemory = v; return this; }
        public Builder unavailableSensors(Set<String> v) { this.unavailableSensors = v; return this; }

        public SystemSnapshot build() {
            return new SystemSnapshot(timestamp, batteryPercent, batteryPowerDraw, powerPlugged,
                cpuPercent, cpuFreq, memoryPercent, gpuPercent, gpuMemoryPercent,
                networkBytesSent, networkBytesRecv, diskIoRead, diskIoWrite,
                screenBrightness, activeProcessCount, targetAppCpu, targetAppMemory,
                unavailableSensors);
        }
    }
}
