package com.adaptivetutor.api.dto.response;

import com.adaptivetutor.domain.enums.CognitiveAction;
import com.adaptivetutor.domain.enums.CognitiveState;
import com.adaptivetutor.domain.enums.ContentType;
import com.adaptivetutor.domain.enums.LearningMode;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;

/**
 * What the tutoring front end should render next for a session: content mix, parameters in
 * force, break cadence and difficulty.
 */
@Getter
@Builder
public class RecommendationResponse {

    private final String sessionId;
    private final LearningMode mode;
    private final CognitiveState cognitiveState;
    private final List<ContentType> contentTypes;
    private final Map<String, Double> activeParameters;
    private final CognitiveAction cognitiveAction;
    private final int sessionDurationMinutes;
    private final int shortBreakMinutes;
    private final int longBreakMinutes;
    private final double targetDifficulty;
}
