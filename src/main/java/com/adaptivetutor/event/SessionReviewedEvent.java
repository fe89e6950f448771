package com.adaptivetutor.event;

import com.adaptivetutor.core.engine.EffectivenessReview;
import org.springframework.context.ApplicationEvent;

/**
 * Published after each successful periodic review of a session.
 *
 * <p>{@code durationNanos} is the wall time of the review, lock wait included.
 */
public class SessionReviewedEvent extends ApplicationEvent {

    private final String sessionId;
    private final EffectivenessReview review;
    private final long durationNanos;

    public SessionReviewedEvent(Object source, String sessionId, EffectivenessReview review, long durationNanos) {
        super(source);
        this.sessionId = sessionId;
        this.review = review;
        this.durationNanos = durationNanos;
    }

    public String getSessionId() {
        return sessionId;
    }

    public EffectivenessReview getReview() {
        return review;
    }

    public long getDurationNanos() {
        return durationNanos;
    }
}
