package com.adaptivetutor.event;

import java.time.LocalDateTime;
import org.springframework.context.ApplicationEvent;

/**
 * Published when the breakthrough detector fires for a session. At most one per session
 * per cool-down window.
 */
public class BreakthroughDetectedEvent extends ApplicationEvent {

    private final String sessionId;
    private final double triggerLevel;
    private final LocalDateTime detectedAt;

    public BreakthroughDetectedEvent(Object source, String sessionId, double triggerLevel, LocalDateTime detectedAt) {
        super(source);
        this.sessionId = sessionId;
        this.triggerLevel = triggerLevel;
        this.detectedAt = detectedAt;
    }

    public String getSessionId() {
        return sessionId;
    }

    public double getTriggerLevel() {
        return triggerLevel;
    }

    public LocalDateTime getDetectedAt() {
        return detectedAt;
    }
}
