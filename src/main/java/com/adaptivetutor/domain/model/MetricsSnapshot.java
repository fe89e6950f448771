package com.adaptivetutor.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Point-in-time view of cross-session counters. Pollable, never pushed.
 */
@Value
@Builder
public class MetricsSnapshot {

    long activeSessions;

    /** Adaptations emitted across all sessions in the trailing minute. */
    long adaptationsPerMinute;

    long breakthroughEvents;

    /** Mean of all effectiveness estimates reported by periodic reviews. */
    double avgEffectiveness;

    long sessionsStarted;
    long sessionsEnded;
    long adaptationsEmitted;

    /** Exponential moving average of per-session adaptations per minute, folded in at session end. */
    double avgSessionAdaptationRate;
}
