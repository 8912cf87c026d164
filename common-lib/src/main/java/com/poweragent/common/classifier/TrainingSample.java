package com.poweragent.common.classifier;

import com.poweragent.common.decision.FeatureVector;
import com.poweragent.common.model.SeverityClass;

/**
 * One labelled row for the severity classifier.
 */
public record TrainingSample(FeatureVector features, SeverityClass label) {}
