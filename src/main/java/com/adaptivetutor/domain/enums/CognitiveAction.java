package com.adaptivetutor.domain.enums;

/**
 * Action taken in response to a cognitive state.
 */
public enum CognitiveAction {
    REDUCE_LOAD,
    MAINTAIN,
    INCREASE_COMPLEXITY,
    OFFER_RECOVERY
}
