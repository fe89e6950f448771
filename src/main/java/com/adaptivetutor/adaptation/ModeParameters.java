package com.adaptivetutor.adaptation;

import com.adaptivetutor.domain.enums.ContentType;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Parameter set applied to a session when it enters a learning mode.
 */
@Value
@Builder
public class ModeParameters {

    public static final String CONTENT_DENSITY = "content_density";
    public static final String INTERACTION_FREQUENCY = "interaction_frequency";
    public static final String GUIDANCE_LEVEL = "guidance_level";
    public static final String HANDS_ON_RATIO = "hands_on_ratio";
    public static final String SESSION_DURATION_MINUTES = "session_duration_minutes";
    public static final String CONTENT_TYPES = "content_types";

    double contentDensity;
    double interactionFrequency;
    double guidanceLevel;
    double handsOnRatio;
    int sessionDurationMinutes;
    List<ContentType> contentTypes;

    /** The numeric tunables, keyed by parameter name. These are what optimizations nudge. */
    public Map<String, Double> tunables() {
        Map<String, Double> values = new LinkedHashMap<>();
        values.put(CONTENT_DENSITY, contentDensity);
        values.put(INTERACTION_FREQUENCY, interactionFrequency);
        values.put(GUIDANCE_LEVEL, guidanceLevel);
        values.put(HANDS_ON_RATIO, handsOnRatio);
        return values;
    }

    /** Full parameter map as carried by a MODE_CHANGE adaptation. */
    public Map<String, Object> toParameterMap() {
        Map<String, Object> values = new LinkedHashMap<>(tunables());
        values.put(SESSION_DURATION_MINUTES, sessionDurationMinutes);
        values.put(CONTENT_TYPES, contentTypes.stream().map(Enum::name).toList());
        return values;
    }
}
