package com.adaptivetutor.domain.model;

import java.time.LocalDateTime;

/**
 * Descriptor returned by the breakthrough detector when a session qualifies.
 */
public record BreakthroughOpportunity(String sessionId, double triggerLevel, LocalDateTime timestamp) {}
