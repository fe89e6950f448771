package com.adaptivetutor.domain.enums;

/**
 * What triggered an adaptation record.
 */
public enum AdaptationKind {

    /** The session moved to a different {@link LearningMode}. */
    MODE_CHANGE,

    /** The session moved to a different {@link CognitiveState}. */
    COGNITIVE_CHANGE,

    /** Parameter nudge produced by the periodic effectiveness review. */
    OPTIMIZATION,

    /** A rate-limited breakthrough opportunity fired. */
    BREAKTHROUGH
}
