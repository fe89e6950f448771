package com.adaptivetutor.core.engine;

import java.util.Map;

/**
 * Outcome of one periodic review of a session's recent trajectory.
 *
 * @param slope         least-squares slope of level per sample over the review window
 * @param recentMean    mean level over the review window
 * @param stability     1 minus the population standard deviation of the window, in [0, 1]
 * @param effectiveness combined estimate in [0, 1]
 * @param sampleCount   number of samples the review looked at
 * @param nudges        parameter name to new value, only for parameters that actually change
 */
public record EffectivenessReview(
        double slope,
        double recentMean,
        double stability,
        double effectiveness,
        int sampleCount,
        Map<String, Double> nudges) {

    public boolean isDeclining() {
        return slope < EffectivenessReviewer.DECLINING_SLOPE;
    }

    public boolean isImproving() {
        return slope > EffectivenessReviewer.IMPROVING_SLOPE;
    }

    public boolean hasNudges() {
        return !nudges.isEmpty();
    }
}
