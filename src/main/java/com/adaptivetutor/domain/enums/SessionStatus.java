package com.adaptivetutor.domain.enums;

/**
 * Lifecycle status of a learning session.
 * Transitions: ACTIVE -> ENDED. ENDED is terminal; no mutation is permitted afterwards.
 */
public enum SessionStatus {
    ACTIVE,
    ENDED
}
