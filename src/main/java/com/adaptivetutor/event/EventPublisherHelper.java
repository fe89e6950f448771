package com.adaptivetutor.event;

import com.adaptivetutor.core.engine.EffectivenessReview;
import com.adaptivetutor.domain.model.Adaptation;
import com.adaptivetutor.domain.model.BreakthroughOpportunity;
import com.adaptivetutor.domain.model.SessionSnapshot;
import com.adaptivetutor.domain.model.SignalUpdate;
import com.adaptivetutor.exception.TransientProcessingFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEvent;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Convenience wrapper around Spring's {@link ApplicationEventPublisher} with typed factory
 * methods for the session engine's events.
 *
 * <p>Listeners are synchronous and the engine delivers outbound events from its session
 * outboxes. Outbound publications are isolated: a failure is wrapped in
 * {@link TransientProcessingFailureException}, logged, and dropped.
 * Inbound signal publication is not isolated, since the caller needs to know delivery failed.
 */
@Component
public class EventPublisherHelper {

    private static final Logger log = LoggerFactory.getLogger(EventPublisherHelper.class);

    private final ApplicationEventPublisher applicationEventPublisher;

    public EventPublisherHelper(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    // ---- Inbound ----

    public void publishSignalUpdate(Object source, SignalUpdate update) {
        applicationEventPublisher.publishEvent(new SignalUpdateEvent(source, update));
    }

    // ---- Lifecycle ----

    public void publishSessionStarted(Object source, SessionSnapshot snapshot) {
        publishIsolated(new SessionLifecycleEvent(source, SessionEventType.STARTED, snapshot.getId(), snapshot));
    }

    public void publishSessionEnded(Object source, SessionSnapshot snapshot) {
        publishIsolated(new SessionLifecycleEvent(source, SessionEventType.ENDED, snapshot.getId(), snapshot));
    }

    // ---- Adaptation ----

    public void publishAdaptation(Object source, Adaptation adaptation) {
        publishIsolated(new AdaptationEmittedEvent(source, adaptation));
    }

    public void publishBreakthrough(Object source, BreakthroughOpportunity opportunity) {
        publishIsolated(new BreakthroughDetectedEvent(
                source, opportunity.sessionId(), opportunity.triggerLevel(), opportunity.timestamp()));
    }

    // ---- Review ----

    public void publishSessionReviewed(Object source, String sessionId, EffectivenessReview review, long durationNanos) {
        publishIsolated(new SessionReviewedEvent(source, sessionId, review, durationNanos));
    }

    /**
     * Publishes the event and contains any listener failure.
     *
     * @return true if every listener completed normally
     */
    boolean publishIsolated(ApplicationEvent event) {
        try {
            applicationEventPublisher.publishEvent(event);
            return true;
        } catch (RuntimeException e) {
            TransientProcessingFailureException failure = new TransientProcessingFailureException(
                    "Listener failed for " + event.getClass().getSimpleName(), e);
            log.error("{}: {}", failure.getMessage(), e.getMessage(), failure);
            return false;
        }
    }
}
