package com.poweragent.common.classifier;

import com.poweragent.common.decision.FeatureMetric;
import com.poweragent.common.exception.RetrainException;

import java.time.Clock;
import java.util.Arrays;
import java.util.List;

/**
 * Fits a {@link SeverityModel} with full-batch gradient descent on the cross-entropy loss
 * plus an L2 penalty on the weights (not the bias).
 *
 * <p>Weights start at zero and samples are visited in list order, so the same input
 * always yields the same model.
 */
public final class SeverityModelTrainer {

    private static final double MIN_SCALE = 1e-6;

    private final int    epochs;
    private final double learningRate;
    private final double l2;
    private final Clock  clock;

    public SeverityModelTrainer(int epochs, double learningRate, double l2, Clock clock) {
        this.epochs       = epochs;
        this.learningRate = learningRate;
        this.l2           = l2;
        this.clock        = clock;
    }

    public static SeverityModelTrainer withDefaults(Clock clock) {
        return new SeverityModelTrainer(1000, 0.5, 1e-4, clock);
    }

    public SeverityModel train(List<TrainingSample> samples, long version) {
        if (samples == null || samples.isEmpty()) {
            throw new RetrainException("No training samples available");
        }

        int n = samples.size();
        int d = FeatureMetric.COUNT;
        int k = SeverityModel.CLASS_COUNT;

        double[][] raw = new double[n][];
        int[] labels = new int[n];
        for (int s = 0; s < n; s++) {
            raw[s] = samples.get(s).features().toArray();
            labels[s] = samples.get(s).label().level();
        }

        double[] means  = new double[d];
        double[] scales = new double[d];
        for (int i = 0; i < d; i++) {
            double sum = 0.0;
            for (double[] row : raw) sum += row[i];
            means[i] = sum / n;
            double var = 0.0;
            for (double[] row : raw) var += (row[i] - means[i]) * (row[i] - means[i]);
            scales[i] = Math.max(MIN_SCALE, Math.sqrt(var / n));
        }

        double[][] x = new double[n][d];
        for (int s = 0; s < n; s++) {
            for (int i = 0; i < d; i++) {
                x[s][i] = (raw[s][i] - means[i]) / scales[i];
            }
        }

        double[][] w = new double[k][d + 1];
        double[][] grad = new double[k][d + 1];
        for (int epoch = 0; epoch < epochs; epoch++) {
            for (double[] row : grad) Arrays.fill(row, 0.0);

            for (int s = 0; s < n; s++) {
                double[] p = SeverityModel.softmax(w, x[s]);
                for (int c = 0; c < k; c++) {
                    double err = p[c] - (labels[s] == c ? 1.0 : 0.0);
                    for (int i = 0; i < d; i++) {
                        grad[c][i] += err * x[s][i];
                    }
                    grad[c][d] += err;
                }
            }

            for (int c = 0; c < k; c++) {
                for (int i = 0; i < d; i++) {
                    w[c][i] -= learningRate * (grad[c][i] / n + l2 * w[c][i]);
                }
                w[c][d] -= learningRate * grad[c][d] / n;
            }
        }

        int correct = 0;
        for (int s = 0; s < n; s++) {
            if (SeverityModel.argMax(SeverityModel.softmax(w, x[s])) == labels[s]) correct++;
        }

        return new SeverityModel(version, w, means, scales, n, (double) correct / n, clock.instant());
    }
}
