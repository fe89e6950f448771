package com.adaptivetutor.core.processor;

import com.adaptivetutor.domain.enums.CognitiveState;
import com.adaptivetutor.domain.enums.LearningMode;
import java.util.Map;

/**
 * Pure classification of a signal level (and activity breakdown) into a learning mode
 * and a cognitive-load state.
 *
 * <p>Mode bands (lower bound inclusive):
 * <pre>
 *   [0.0, 0.3) EXPLORATION | [0.3, 0.6) FOCUSED | [0.6, 0.8) INTENSIVE | [0.8, 1.0] BREAKTHROUGH
 * </pre>
 *
 * <p>Cognitive load score: {@code 0.4*level + 0.3*executive + 0.2*memory + 0.1*sensory}, each
 * activity defaulting to 0.5 when absent. Buckets are evaluated in order OVERLOADED (>= 0.8),
 * FATIGUED (<= 0.2), UNDERUTILIZED (<= 0.3), OPTIMAL. FATIGUED is checked before
 * UNDERUTILIZED because both bucket conditions hold at or below 0.2.
 *
 * <p>Stateless: identical inputs always classify identically.
 */
public final class SignalClassifier {

    public static final double FOCUSED_THRESHOLD = 0.3;
    public static final double INTENSIVE_THRESHOLD = 0.6;
    public static final double BREAKTHROUGH_THRESHOLD = 0.8;

    public static final String EXECUTIVE = "executive";
    public static final String MEMORY = "memory";
    public static final String SENSORY = "sensory";

    static final double LEVEL_WEIGHT = 0.4;
    static final double EXECUTIVE_WEIGHT = 0.3;
    static final double MEMORY_WEIGHT = 0.2;
    static final double SENSORY_WEIGHT = 0.1;
    static final double DEFAULT_ACTIVITY = 0.5;

    static final double OVERLOADED_SCORE = 0.8;
    static final double FATIGUED_SCORE = 0.2;
    static final double UNDERUTILIZED_SCORE = 0.3;

    private SignalClassifier() {}

    public static LearningMode classifyMode(double level) {
        if (level >= BREAKTHROUGH_THRESHOLD) {
            return LearningMode.BREAKTHROUGH;
        }
        if (level >= INTENSIVE_THRESHOLD) {
            return LearningMode.INTENSIVE;
        }
        if (level >= FOCUSED_THRESHOLD) {
            return LearningMode.FOCUSED;
        }
        return LearningMode.EXPLORATION;
    }

    public static CognitiveState classifyCognitiveState(double level, Map<String, Double> activities) {
        double score = loadScore(level, activities);
        if (score >= OVERLOADED_SCORE) {
            return CognitiveState.OVERLOADED;
        }
        if (score <= FATIGUED_SCORE) {
            return CognitiveState.FATIGUED;
        }
        if (score <= UNDERUTILIZED_SCORE) {
            return CognitiveState.UNDERUTILIZED;
        }
        return CognitiveState.OPTIMAL;
    }

    /**
     * Weighted cognitive load score in [0, 1]. Activity values are clamped into [0, 1];
     * missing or non-finite values count as 0.5.
     */
    public static double loadScore(double level, Map<String, Double> activities) {
        Map<String, Double> safe = activities != null ? activities : Map.of();
        return LEVEL_WEIGHT * clamp(level)
                + EXECUTIVE_WEIGHT * activity(safe, EXECUTIVE)
                + MEMORY_WEIGHT * activity(safe, MEMORY)
                + SENSORY_WEIGHT * activity(safe, SENSORY);
    }

    /** True when the value is a usable number: not null, not NaN, not infinite. */
    public static boolean isValidLevel(Double value) {
        return value != null && Double.isFinite(value);
    }

    public static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    private static double activity(Map<String, Double> activities, String key) {
        Double value = activities.get(key);
        return isValidLevel(value) ? clamp(value) : DEFAULT_ACTIVITY;
    }
}
