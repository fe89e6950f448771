package com.adaptivetutor.domain.enums;

/**
 * Why a session was ended.
 */
public enum EndReason {

    /** Caller invoked end. */
    EXPLICIT,

    /** No signal update arrived within the configured idle timeout. */
    IDLE_TIMEOUT,

    /** Session exceeded the configured maximum duration. */
    MAX_DURATION,

    /** Application is shutting down. */
    SHUTDOWN
}
