package com.poweragent.common.classifier;

import com.poweragent.common.decision.FeatureMetric;
import com.poweragent.common.decision.FeatureVector;
import com.poweragent.common.model.SeverityClass;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Immutable multinomial logistic classifier over the decision feature vector.
 *
 * <p>Inputs are standardised with the per-feature mean and scale captured at training time,
 * then {@code p(k) = softmax(W[k] · x + b[k])}. Instances are never mutated after
 * construction, so a reference can be swapped atomically while other threads predict.
 */
public final class SeverityModel {

    static final int CLASS_COUNT = SeverityClass.values().length;

    private final long       version;
    private final double[][] weights;
    private final double[]   means;
    private final double[]   scales;
    private final int        trainingSamples;
    private final double     trainingAccuracy;
    private final Instant    trainedAt;

    SeverityModel(long version, double[][] weights, double[] means, double[] scales,
                  int trainingSamples, double trainingAccuracy, Instant trainedAt) {
        if (weights.length != CLASS_COUNT) {
            throw new IllegalArgumentException("Expected " + CLASS_COUNT + " weight rows but got " + weights.length);
        }
        if (means.length != FeatureMetric.COUNT || scales.length != FeatureMetric.COUNT) {
            throw new IllegalArgumentException("Standardisation vectors must have " + FeatureMetric.COUNT + " entries");
        }
        this.version          = version;
        this.weights          = deepCopy(weights);
        this.means            = means.clone();
        this.scales           = scales.clone();
        this.trainingSamples  = trainingSamples;
        this.trainingAccuracy = trainingAccuracy;
        this.trainedAt        = trainedAt;
    }

    /**
     * Per-class probabilities in {@link SeverityClass} order; they sum to 1.
     */
    public double[] predictProbabilities(FeatureVector features) {
        return probabilities(standardise(features.toArray()));
    }

    public SeverityClass predict(FeatureVector features) {
        return SeverityClass.fromLevel(argMax(predictProbabilities(features)));
    }

    double[] standardise(double[] raw) {
        double[] x = new double[raw.length];
        for (int i = 0; i < raw.length; i++) {
            x[i] = (raw[i] - means[i]) / scales[i];
        }
        return x;
    }

    double[] probabilities(double[] standardised) {
        return softmax(weights, standardised);
    }

    static double[] softmax(double[][] weights, double[] x) {
        double[] logits = new double[weights.length];
        double max = Double.NEGATIVE_INFINITY;
        for (int k = 0; k < weights.length; k++) {
            double z = weights[k][x.length];
            for (int i = 0; i < x.length; i++) {
                z += weights[k][i] * x[i];
            }
            logits[k] = z;
            max = Math.max(max, z);
        }
        double sum = 0.0;
        for (int k = 0; k < logits.length; k++) {
            logits[k] = Math.exp(logits[k] - max);
            sum += logits[k];
        }
        for (int k = 0; k < logits.length; k++) {
            logits[k] /= sum;
        }
        return logits;
    }

    static int argMax(double[] values) {
        int best = 0;
        for (int i = 1; i < values.length; i++) {
            if (values[i] > values[best]) best = i;
        }
        return best;
    }

    public long version()            { return version; }
    public int trainingSamples()     { return trainingSamples; }
    public double trainingAccuracy() { return trainingAccuracy; }
    public Instant trainedAt()       { return trainedAt; }

    // ── persistence ────────────────────────────────────────────────────────

    public SeverityModelParameters toParameters() {
        List<List<Double>> rows = new ArrayList<>(weights.length);
        for (double[] row : weights) {
            rows.add(toList(row));
        }
        return new SeverityModelParameters(version, rows, toList(means), toList(scales),
            trainingSamples, trainingAccuracy, trainedAt);
    }

    public static SeverityModel fromParameters(SeverityModelParameters p) {
        double[][] w = new double[p.weights().size()][];
        for (int k = 0; k < w.length; k++) {
            w[k] = toArray(p.weights().get(k));
        }
        return new SeverityModel(p.version(), w, toArray(p.means()), toArray(p.scales()),
            p.trainingSamples(), p.trainingAccuracy(), p.trainedAt());
    }

    private static List<Double> toList(double[] values) {
        List<Double> list = new ArrayList<>(values.length);
        for (double v : values) list.add(v);
        return list;
    }

    private static double[] toArray(List<Double> values) {
        double[] out = new double[values.size()];
        for (int i = 0; i < out.length; i++) out[i] = values.get(i);
        return out;
    }

    private static double[][] deepCopy(double[][] source) {
        double[][] copy = new double[source.length][];
        for (int i = 0; i < source.length; i++) {
            copy[i] = source[i].clone();
        }
        return copy;
    }
}
