package com.adaptivetutor.domain.model;

import java.time.LocalDateTime;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Inbound engagement signal for a single session, as delivered by the instrumentation feed.
 *
 * <p>{@code level} is boxed so that an undefined value can be represented and rejected.
 * {@code activities} holds the optional activity breakdown (keys {@code executive},
 * {@code memory}, {@code sensory}); a missing key is treated as 0.5 by the classifier.
 * A null {@code timestamp} means "now" at the time the engine processes the update.
 */
@Value
@Builder
public class SignalUpdate {

    String sessionId;
    Double level;
    Map<String, Double> activities;
    LocalDateTime timestamp;

    public Map<String, Double> activitiesOrEmpty() {
        return activities != null ? activities : Map.of();
    }
}
