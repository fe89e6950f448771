package com.adaptivetutor.event;

import com.adaptivetutor.domain.model.SessionSnapshot;
import org.springframework.context.ApplicationEvent;

/**
 * Published when a learning session starts or ends.
 *
 * <p>The snapshot is taken while the engine holds the session lock, so for ENDED it is the
 * session's final state.
 */
public class SessionLifecycleEvent extends ApplicationEvent {

    private final SessionEventType eventType;
    private final String sessionId;
    private final SessionSnapshot snapshot;

    public SessionLifecycleEvent(Object source, SessionEventType eventType, String sessionId, SessionSnapshot snapshot) {
        super(source);
        this.eventType = eventType;
        this.sessionId = sessionId;
        this.snapshot = snapshot;
    }

    public SessionEventType getEventType() {
        return eventType;
    }

    public String getSessionId() {
        return sessionId;
    }

    public SessionSnapshot getSnapshot() {
        return snapshot;
    }
}
