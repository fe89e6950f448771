package com.adaptivetutor.domain.enums;

/**
 * Operating mode of a learning session, derived from the signal level.
 * Bands: EXPLORATION [0, 0.3), FOCUSED [0.3, 0.6), INTENSIVE [0.6, 0.8), BREAKTHROUGH [0.8, 1].
 * Governs content density and pacing parameters.
 */
public enum LearningMode {

    /** Low engagement -- broad, guided, low-density material. */
    EXPLORATION,

    /** Moderate engagement -- balanced practice and theory. */
    FOCUSED,

    /** High engagement -- challenge-heavy, less guidance. */
    INTENSIVE,

    /** Peak engagement -- advanced concepts and assessments. */
    BREAKTHROUGH
}
