package com.adaptivetutor.adaptation;

import com.adaptivetutor.domain.enums.CognitiveAction;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Value;

/**
 * Response to a cognitive state: the action, how much to shift target difficulty,
 * and the recommended break cadence in minutes.
 */
@Value
public class CognitiveAdjustment {

    public static final String ACTION = "action";
    public static final String COMPLEXITY_DELTA = "complexity_delta";
    public static final String SHORT_BREAK_MINUTES = "short_break_minutes";
    public static final String LONG_BREAK_MINUTES = "long_break_minutes";

    CognitiveAction action;
    double complexityDelta;
    int shortBreakMinutes;
    int longBreakMinutes;

    public Map<String, Object> toParameterMap() {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put(ACTION, action.name());
        values.put(COMPLEXITY_DELTA, complexityDelta);
        values.put(SHORT_BREAK_MINUTES, shortBreakMinutes);
        values.put(LONG_BREAK_MINUTES, longBreakMinutes);
        return values;
    }
}
