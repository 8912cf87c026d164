package com.poweragent.common.classifier;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Serialisable form of a {@link SeverityModel}. {@code weights} holds one row per severity
 * class; the last column of each row is the bias.
 */
public record SeverityModelParameters(
    @JsonProperty("version")          long               version,
    @JsonProperty("weights")          List<List<Double>> weights,
    @JsonProperty("means")            List<Double>       means,
    @JsonProperty("scales")           List<Double>       scales,
    @JsonProperty("trainingSamples")  int                trainingSamples,
    @JsonProperty("trainingAccuracy") double             trainingAccuracy,
    @JsonProperty("trainedAt")        Instant            trainedAt
) {}
