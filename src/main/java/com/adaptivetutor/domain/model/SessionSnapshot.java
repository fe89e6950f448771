package com.adaptivetutor.domain.model;

import com.adaptivetutor.domain.enums.AdaptationKind;
import com.adaptivetutor.domain.enums.CognitiveState;
import com.adaptivetutor.domain.enums.EndReason;
import com.adaptivetutor.domain.enums.LearningMode;
import com.adaptivetutor.domain.enums.SessionStatus;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Read-only deep copy of a {@link LearningSession}. Handed to callers instead of the live record.
 */
@Value
@Builder
public class SessionSnapshot {

    String id;
    String userId;
    String lessonId;
    SessionStatus status;
    double signalLevel;
    LearningMode mode;
    CognitiveState cognitiveState;
    List<TrajectorySample> trajectory;
    List<Adaptation> adaptations;
    Map<String, Double> performanceMetrics;
    Map<String, Double> activeParameters;
    LocalDateTime startedAt;
    LocalDateTime lastActivityAt;
    LocalDateTime endedAt;
    EndReason endReason;

    public long countAdaptations(AdaptationKind kind) {
        return adaptations.stream().filter(a -> a.getKind() == kind).count();
    }
}
