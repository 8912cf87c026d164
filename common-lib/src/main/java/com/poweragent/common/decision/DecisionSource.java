package com.poweragent.common.decision;

import java.util.Optional;

/**
 * Strategy contract for mapping a feature vector to a severity class.
 *
 * <p>Implementations must be side-effect free and safe to call from the tick thread while
 * the model handle is being swapped. An empty result means "cannot answer", in which case
 * the {@link DecisionEngine} falls through to the next source.
 */
public interface DecisionSource {

    Optional<SeverityDecision> evaluate(FeatureVector features);
}
