package com.adaptivetutor.adaptation;

import com.adaptivetutor.domain.enums.CognitiveState;
import com.adaptivetutor.domain.enums.LearningMode;

/**
 * Lookup of the parameter set for a learning mode and the adjustment for a cognitive state.
 *
 * <p>Implementations are pure data: every enum value has an entry and nothing is rejected.
 * The engine depends only on this interface, so a different table is a different bean.
 */
public interface AdaptationStrategyTable {

    String TARGET_DIFFICULTY = "target_difficulty";

    ModeParameters parametersFor(LearningMode mode);

    CognitiveAdjustment adjustmentFor(CognitiveState state);

    /**
     * Content difficulty matched to the signal level with a small challenge margin:
     * {@code min(1, 0.8*level + 0.1 + 0.2*level)}.
     */
    default double targetDifficulty(double level) {
        double base = level * 0.8;
        double challenge = 0.1 + level * 0.2;
        return Math.min(1.0, base + challenge);
    }
}
