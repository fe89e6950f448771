package com.adaptivetutor.core.engine;

import com.adaptivetutor.adaptation.ModeParameters;
import com.adaptivetutor.core.processor.SignalClassifier;
import com.adaptivetutor.domain.model.TrajectorySample;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Scores how well a session's current parameters are working and proposes small corrections.
 *
 * <p>Looks only at the last {@value #WINDOW} trajectory samples:
 * <pre>
 *   effectiveness = clamp(0.5 * mean + 0.3 * stability + 0.2 * clamp(0.5 + 5 * slope))
 * </pre>
 *
 * <p>Nudges are {@value #NUDGE} steps on the active parameters:
 * <ul>
 *   <li>declining trend: more guidance, less content density</li>
 *   <li>improving trend with effectiveness at least 0.7: more density and more hands-on work</li>
 *   <li>effectiveness below 0.4 without a declining trend: more interaction</li>
 * </ul>
 * A nudge that would leave a parameter unchanged (already at a bound) is omitted.
 *
 * <p>Stateless; the caller holds the session lock.
 */
@Component
public class EffectivenessReviewer {

    public static final int WINDOW = 10;
    public static final double NUDGE = 0.1;
    public static final double DECLINING_SLOPE = -0.02;
    public static final double IMPROVING_SLOPE = 0.02;
    public static final double HIGH_EFFECTIVENESS = 0.7;
    public static final double LOW_EFFECTIVENESS = 0.4;

    private static final double DEFAULT_PARAMETER = 0.5;

    public EffectivenessReview review(List<TrajectorySample> trajectory, Map<String, Double> activeParameters) {
        if (trajectory.isEmpty()) {
            throw new IllegalArgumentException("Cannot review an empty trajectory");
        }

        List<TrajectorySample> window = trajectory.subList(Math.max(0, trajectory.size() - WINDOW), trajectory.size());
        double[] levels = window.stream().mapToDouble(TrajectorySample::level).toArray();

        double mean = mean(levels);
        double slope = slope(levels, mean);
        double stability = SignalClassifier.clamp(1.0 - standardDeviation(levels, mean));
        double trendScore = SignalClassifier.clamp(0.5 + 5 * slope);
        double effectiveness = SignalClassifier.clamp(0.5 * mean + 0.3 * stability + 0.2 * trendScore);

        Map<String, Double> nudges = new LinkedHashMap<>();
        if (slope < DECLINING_SLOPE) {
            nudge(nudges, activeParameters, ModeParameters.GUIDANCE_LEVEL, NUDGE);
            nudge(nudges, activeParameters, ModeParameters.CONTENT_DENSITY, -NUDGE);
        } else {
            if (slope > IMPROVING_SLOPE && effectiveness >= HIGH_EFFECTIVENESS) {
                nudge(nudges, activeParameters, ModeParameters.CONTENT_DENSITY, NUDGE);
                nudge(nudges, activeParameters, ModeParameters.HANDS_ON_RATIO, NUDGE);
            }
            if (effectiveness < LOW_EFFECTIVENESS) {
                nudge(nudges, activeParameters, ModeParameters.INTERACTION_FREQUENCY, NUDGE);
            }
        }

        return new EffectivenessReview(slope, mean, stability, effectiveness, levels.length, Map.copyOf(nudges));
    }

    private static void nudge(Map<String, Double> nudges, Map<String, Double> current, String name, double delta) {
        double before = current.getOrDefault(name, DEFAULT_PARAMETER);
        double after = round(SignalClassifier.clamp(before + delta));
        if (Double.compare(after, before) != 0) {
            nudges.put(name, after);
        }
    }

    static double mean(double[] values) {
        double sum = 0;
        for (double value : values) {
            sum += value;
        }
        return sum / values.length;
    }

    /** Least-squares slope against sample index. Zero for fewer than two samples. */
    static double slope(double[] values, double mean) {
        int n = values.length;
        if (n < 2) {
            return 0.0;
        }
        double xMean = (n - 1) / 2.0;
        double numerator = 0;
        double denominator = 0;
        for (int i = 0; i < n; i++) {
            double dx = i - xMean;
            numerator += dx * (values[i] - mean);
            denominator += dx * dx;
        }
        return numerator / denominator;
    }

    static double standardDeviation(double[] values, double mean) {
        double sumSquares = 0;
        for (double value : values) {
            double diff = value - mean;
            sumSquares += diff * diff;
        }
        return Math.sqrt(sumSquares / values.length);
    }

    // 0.3 + 0.1 must stay 0.4
    private static double round(double value) {
        return Math.round(value * 10_000) / 10_000.0;
    }
}
