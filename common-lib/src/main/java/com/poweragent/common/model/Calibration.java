package com.poweragent.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Read contract between the feedback learner and the decision engine.
 *
 * <ul>
 *   <li>{@code historicalAccuracy}: exponentially weighted share of past decisions whose
 *       severity matched the label derived from their outcome ([0.0, 1.0]).</li>
 *   <li>{@code sampleCount}: number of labelled live samples behind that figure.</li>
 * </ul>
 */
public record Calibration(
    @JsonProperty("historicalAccuracy") double historicalAccuracy,
    @JsonProperty("sampleCount")        int    sampleCount
) {

    public Calibration {
        historicalAccuracy = Math.max(0.0, Math.min(1.0, historicalAccuracy));
        sampleCount        = Math.max(0, sampleCount);
    }

    /** No evidence yet: confidence is left unscaled. */
    public static Calibration neutral() {
        return new Calibration(1.0, 0);
    }
}
