package com.adaptivetutor.domain.enums;

/**
 * Cognitive-load state of a learner, derived from the signal level and the activity breakdown.
 */
public enum CognitiveState {

    /** Too much information -- load should be reduced. */
    OVERLOADED,

    /** Load is in the productive range. */
    OPTIMAL,

    /** Capacity is unused -- complexity can be raised. */
    UNDERUTILIZED,

    /** Learner is worn out -- offer a recovery break. */
    FATIGUED
}
