package com.poweragent.common.decision;

import com.poweragent.common.classifier.SeverityModel;
import com.poweragent.common.model.DecisionPath;
import com.poweragent.common.model.SeverityClass;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Classifier-backed source. Declines to answer when no model is loaded, when the model
 * was trained on fewer than {@code minTrainingSamples} rows, or when its top-class
 * probability is below {@code probabilityFloor}.
 */
public final class LearnedDecisionSource implements DecisionSource {

    private final ModelProvider models;
    private final int           minTrainingSamples;
    private final double        probabilityFloor;

    public LearnedDecisionSource(ModelProvider models, int minTrainingSamples, double probabilityFloor) {
        this.models             = models;
        this.minTrainingSamples = minTrainingSamples;
        this.probabilityFloor   = probabilityFloor;
    }

    @Override
    public Optional<SeverityDecision> evaluate(FeatureVector features) {
        Optional<SeverityModel> current = models.currentModel();
        if (current.isEmpty()) {
            return Optional.empty();
        }
        SeverityModel model = current.get();
        if (model.trainingSamples() < minTrainingSamples) {
            return Optional.empty();
        }

        double[] p = model.predictProbabilities(features);
        int best = 0;
        for (int i = 1; i < p.length; i++) {
            if (p[i] > p[best]) best = i;
        }
        if (p[best] < probabilityFloor) {
            return Optional.empty();
        }

        List<Double> probabilities = new ArrayList<>(p.length);
        for (double v : p) probabilities.add(v);
        return Optional.of(new SeverityDecision(SeverityClass.fromLevel(best), p[best], probabilities,
            DecisionPath.LEARNED));
    }
}
