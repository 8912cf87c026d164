package com.poweragent.common.classifier;

import com.poweragent.common.context.ContextAnalyzer;
import com.poweragent.common.decision.FeatureVector;
import com.poweragent.common.model.SeverityClass;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Synthetic training rows used to bootstrap the severity classifier before any live
 * outcome has been labelled.
 *
 * <h3>Sampling</h3>
 * <pre>
 *   battery     U(5, 100)     cpu        U(0, 100)    memory      U(20, 95)
 *   gpu         U(0, 80)      network    U(0, 100)    brightness  U(10, 100)
 *   hour        U(0, 24)      plugged    {0, 1}       targetCpu   U(0, cpu)
 *   targetMem   U(0, 50)      score      from {@link ContextAnalyzer#contextScore}
 * </pre>
 *
 * <h3>Labelling</h3>
 * <pre>
 *   plugged                      → NONE
 *   battery &lt; 15                → AGGRESSIVE
 *   battery &lt; 30                → MODERATE if cpu &gt; 70 or memory &gt; 80, else LIGHT
 *   battery &lt; 60                → LIGHT if cpu &gt; 90, else NONE
 *   otherwise                    → NONE
 * </pre>
 *
 * <p>The same seed always produces the same rows, so a missing persisted model can be
 * regenerated identically.
 */
public final class BootstrapDataGenerator {

    public static final long DEFAULT_SEED    = 42L;
    public static final int  DEFAULT_SAMPLES = 1000;

    private final ContextAnalyzer contextAnalyzer;

    public BootstrapDataGenerator(ContextAnalyzer contextAnalyzer) {
        this.contextAnalyzer = contextAnalyzer;
    }

    public List<TrainingSample> generate(int samples, long seed) {
        Random random = new Random(seed);
        List<TrainingSample> out = new ArrayList<>(samples);
        for (int i = 0; i < samples; i++) {
            double  battery    = uniform(random, 5, 100);
            double  cpu        = uniform(random, 0, 100);
            double  memory     = uniform(random, 20, 95);
            double  gpu        = uniform(random, 0, 80);
            double  network    = uniform(random, 0, 100);
            double  brightness = uniform(random, 10, 100);
            double  hour       = uniform(random, 0, 24);
            boolean plugged    = random.nextBoolean();
            double  targetCpu  = uniform(random, 0, cpu);
            double  targetMem  = uniform(random, 0, 50);

            double score = contextAnalyzer.contextScore(battery, cpu + gpu, plugged,
                contextAnalyzer.isQuiet(cpu, targetCpu));

            FeatureVector features = FeatureVector.of(battery, cpu, memory, gpu, network, brightness,
                hour, plugged ? 1.0 : 0.0, targetCpu, targetMem, score);
            out.add(new TrainingSample(features, label(battery, cpu, memory, plugged)));
        }
        return out;
    }

    public List<TrainingSample> generateDefault() {
        return generate(DEFAULT_SAMPLES, DEFAULT_SEED);
    }

    static SeverityClass label(double battery, double cpu, double memory, boolean plugged) {
        if (plugged)       return SeverityClass.NONE;
        if (battery < 15)  return SeverityClass.AGGRESSIVE;
        if (battery < 30)  return (cpu > 70 || memory > 80) ? SeverityClass.MODERATE : SeverityClass.LIGHT;
        if (battery < 60)  return cpu > 90 ? SeverityClass.LIGHT : SeverityClass.NONE;
        return SeverityClass.NONE;
    }

    private static double uniform(Random random, double low, double high) {
        return low + (high - low) * random.nextDouble();
    }
}
