package com.poweragent.common.decision;

import com.poweragent.common.model.ContextState;
import com.poweragent.common.model.PowerSource;
import com.poweragent.common.model.SystemSnapshot;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Immutable 11-value input to both decision strategies, in {@link FeatureMetric} order.
 */
public final class FeatureVector {

    private final double[] values;

    private FeatureVector(double[] values) {
        this.values = values;
    }

    public static FeatureVector of(double... values) {
        if (values.length != FeatureMetric.COUNT) {
            throw new IllegalArgumentException(
                "Expected " + FeatureMetric.COUNT + " features but got " + values.length);
        }
        return new FeatureVector(values.clone());
    }

    public static FeatureVector fromList(List<Double> values) {
        double[] raw = new double[values.size()];
        for (int i = 0; i < raw.length; i++) {
            raw[i] = values.get(i);
        }
        return of(raw);
    }

    public static FeatureVector extract(SystemSnapshot snapshot, ContextState context, int hourOfDay) {
        double[] v = new double[FeatureMetric.COUNT];
        v[FeatureMetric.BATTERY_PERCENT.index()]   = snapshot.batteryPercent();
        v[FeatureMetric.CPU_PERCENT.index()]       = snapshot.cpuPercent();
        v[FeatureMetric.MEMORY_PERCENT.index()]    = snapshot.memoryPercent();
        v[FeatureMetric.GPU_PERCENT.index()]       = snapshot.gpuPercent();
        v[FeatureMetric.NETWORK_ACTIVITY.index()]  = snapshot.networkActivityMb();
        v[FeatureMetric.SCREEN_BRIGHTNESS.index()] = snapshot.screenBrightness();
        v[FeatureMetric.TIME_OF_DAY.index()]       = hourOfDay;
        v[FeatureMetric.POWER_PLUGGED.index()]     = context.powerSource() == PowerSource.PLUGGED ? 1.0 : 0.0;
        v[FeatureMetric.TARGET_APP_CPU.index()]    = snapshot.targetAppCpu();
        v[FeatureMetric.TARGET_APP_MEMORY.index()] = snapshot.targetAppMemory();
        v[FeatureMetric.CONTEXT_SCORE.index()]     = context.contextScore();
        return new FeatureVector(v);
    }

    public double get(FeatureMetric metric) {
        return values[metric.index()];
    }

    public double[] toArray() {
        return values.clone();
    }

    public List<Double> toList() {
        List<Double> list = new ArrayList<>(values.length);
        for (double value : values) {
            list.add(value);
        }
        return list;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FeatureVector)) return false;
        return Arrays.equals(values, ((FeatureVector) o).values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "FeatureVector" + Arrays.toString(values);
    }
}
