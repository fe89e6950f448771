package com.adaptivetutor.adaptation.impl;

import com.adaptivetutor.adaptation.AdaptationStrategyTable;
import com.adaptivetutor.adaptation.CognitiveAdjustment;
import com.adaptivetutor.adaptation.ModeParameters;
import com.adaptivetutor.domain.enums.CognitiveAction;
import com.adaptivetutor.domain.enums.CognitiveState;
import com.adaptivetutor.domain.enums.ContentType;
import com.adaptivetutor.domain.enums.LearningMode;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Built-in strategy table.
 *
 * <p>Entries are built once through exhaustive switch expressions, so a new
 * {@link LearningMode} or {@link CognitiveState} constant fails compilation here until it is
 * given an entry.
 */
@Component
public class DefaultAdaptationStrategyTable implements AdaptationStrategyTable {

    private final Map<LearningMode, ModeParameters> modeTable = new EnumMap<>(LearningMode.class);
    private final Map<CognitiveState, CognitiveAdjustment> cognitiveTable = new EnumMap<>(CognitiveState.class);

    public DefaultAdaptationStrategyTable() {
        for (LearningMode mode : LearningMode.values()) {
            modeTable.put(mode, buildModeEntry(mode));
        }
        for (CognitiveState state : CognitiveState.values()) {
            cognitiveTable.put(state, buildCognitiveEntry(state));
        }
    }

    @Override
    public ModeParameters parametersFor(LearningMode mode) {
        return modeTable.get(mode);
    }

    @Override
    public CognitiveAdjustment adjustmentFor(CognitiveState state) {
        return cognitiveTable.get(state);
    }

    private static ModeParameters buildModeEntry(LearningMode mode) {
        return switch (mode) {
            case EXPLORATION -> ModeParameters.builder()
                    .contentDensity(0.3)
                    .interactionFrequency(0.7)
                    .guidanceLevel(0.8)
                    .handsOnRatio(0.3)
                    .sessionDurationMinutes(20)
                    .contentTypes(List.of(ContentType.THEORY, ContentType.GUIDED_WALKTHROUGH))
                    .build();
            case FOCUSED -> ModeParameters.builder()
                    .contentDensity(0.5)
                    .interactionFrequency(0.5)
                    .guidanceLevel(0.5)
                    .handsOnRatio(0.5)
                    .sessionDurationMinutes(30)
                    .contentTypes(List.of(ContentType.PRACTICAL, ContentType.THEORY, ContentType.ASSESSMENT))
                    .build();
            case INTENSIVE -> ModeParameters.builder()
                    .contentDensity(0.7)
                    .interactionFrequency(0.4)
                    .guidanceLevel(0.3)
                    .handsOnRatio(0.7)
                    .sessionDurationMinutes(45)
                    .contentTypes(List.of(ContentType.CHALLENGE, ContentType.PRACTICAL, ContentType.ASSESSMENT))
                    .build();
            case BREAKTHROUGH -> ModeParameters.builder()
                    .contentDensity(0.9)
                    .interactionFrequency(0.3)
                    .guidanceLevel(0.1)
                    .handsOnRatio(0.8)
                    .sessionDurationMinutes(60)
                    .contentTypes(List.of(ContentType.CHALLENGE, ContentType.ASSESSMENT))
                    .build();
        };
    }

    private static CognitiveAdjustment buildCognitiveEntry(CognitiveState state) {
        return switch (state) {
            case OVERLOADED -> new CognitiveAdjustment(CognitiveAction.REDUCE_LOAD, -0.2, 10, 30);
            case OPTIMAL -> new CognitiveAdjustment(CognitiveAction.MAINTAIN, 0.0, 15, 60);
            case UNDERUTILIZED -> new CognitiveAdjustment(CognitiveAction.INCREASE_COMPLEXITY, 0.2, 25, 90);
            case FATIGUED -> new CognitiveAdjustment(CognitiveAction.OFFER_RECOVERY, -0.3, 5, 20);
        };
    }
}
