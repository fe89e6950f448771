package com.adaptivetutor.domain.model;

import com.adaptivetutor.domain.enums.AdaptationKind;
import java.time.LocalDateTime;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Immutable record of one parameter change applied to a session.
 *
 * <p>{@code fromValue}/{@code toValue} carry the previous and new mode or cognitive
 * state name for MODE_CHANGE and COGNITIVE_CHANGE records; they are null for other kinds.
 *
 * <p>The effectiveness score starts at 0 and may be back-filled later through
 * {@link #withEffectivenessScore(double)}, which returns a copy. Nothing else about an
 * adaptation ever changes after creation.
 */
@Value
@Builder(toBuilder = true)
public class Adaptation {

    String id;
    String sessionId;
    AdaptationKind kind;
    String fromValue;
    String toValue;
    double triggerLevel;
    Map<String, Object> parameters;
    double effectivenessScore;
    LocalDateTime timestamp;

    public Adaptation withEffectivenessScore(double score) {
        return toBuilder().effectivenessScore(score).build();
    }
}
