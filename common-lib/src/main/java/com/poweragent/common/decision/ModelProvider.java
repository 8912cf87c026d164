package com.poweragent.common.decision;

import com.poweragent.common.classifier.SeverityModel;
import com.poweragent.common.model.Calibration;

import java.util.Optional;

/**
 * Read side of the learning loop as seen by the {@link DecisionEngine}.
 */
public interface ModelProvider {

    /** The most recently completed model, if any has been trained or loaded. */
    Optional<SeverityModel> currentModel();

    Calibration calibration();
}
