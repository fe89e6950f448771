package com.adaptivetutor.event;

/**
 * Classifies the lifecycle change carried by a {@link SessionLifecycleEvent}.
 */
public enum SessionEventType {

    /** Session created and its first tick scheduled. */
    STARTED,

    /** Session ended (explicitly, by timeout, or on shutdown). Terminal. */
    ENDED
}
