package com.adaptivetutor.event;

import com.adaptivetutor.domain.model.Adaptation;
import org.springframework.context.ApplicationEvent;

/**
 * Published for every MODE_CHANGE, COGNITIVE_CHANGE and OPTIMIZATION adaptation appended to a
 * session. Breakthroughs are announced through {@link BreakthroughDetectedEvent} instead.
 *
 * <p>Delivered after the engine has released the session lock, in the order the session's
 * adaptations were appended. A listener may call back into the engine for the same session.
 */
public class AdaptationEmittedEvent extends ApplicationEvent {

    private final Adaptation adaptation;

    public AdaptationEmittedEvent(Object source, Adaptation adaptation) {
        super(source);
        this.adaptation = adaptation;
    }

    public Adaptation getAdaptation() {
        return adaptation;
    }

    public String getSessionId() {
        return adaptation.getSessionId();
    }
}
