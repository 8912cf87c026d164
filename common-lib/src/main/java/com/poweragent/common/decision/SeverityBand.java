package com.poweragent.common.decision;

/**
 * The dominant metric of a severity class and the values at which the class starts
 * ({@code mildBoundary}) and where it is fully expressed ({@code severeBoundary}).
 * The boundaries may be in either order, e.g. battery 15 → 0 or cpu 70 → 100.
 */
public record SeverityBand(FeatureMetric metric, double mildBoundary, double severeBoundary) {

    /**
     * Linear position of {@code value} inside the band, 0 at the mild edge and 1 at the
     * severe edge, clamped to [0, 1].
     */
    public double position(double value) {
        double span = severeBoundary - mildBoundary;
        if (span == 0.0) {
            return 1.0;
        }
        double t = (value - mildBoundary) / span;
        return Math.max(0.0, Math.min(1.0, t));
    }
}
