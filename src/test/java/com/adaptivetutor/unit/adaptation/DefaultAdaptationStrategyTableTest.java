package com.adaptivetutor.unit.adaptation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.adaptivetutor.adaptation.AdaptationStrategyTable;
import com.adaptivetutor.adaptation.CognitiveAdjustment;
import com.adaptivetutor.adaptation.ModeParameters;
import com.adaptivetutor.adaptation.impl.DefaultAdaptationStrategyTable;
import com.adaptivetutor.domain.enums.CognitiveAction;
import com.adaptivetutor.domain.enums.CognitiveState;
import com.adaptivetutor.domain.enums.ContentType;
import com.adaptivetutor.domain.enums.LearningMode;
import java.util.Map;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class DefaultAdaptationStrategyTableTest {

    private final AdaptationStrategyTable table = new DefaultAdaptationStrategyTable();

    @Nested
    @DisplayName("Mode parameters")
    class ModeEntries {

        @Test
        @DisplayName("Every mode has an entry")
        void totalOverModes() {
            for (LearningMode mode : LearningMode.values()) {
                assertThat(table.parametersFor(mode)).as("entry for %s", mode).isNotNull();
            }
        }

        @Test
        @DisplayName("EXPLORATION is light and guided")
        void exploration() {
            ModeParameters parameters = table.parametersFor(LearningMode.EXPLORATION);

            assertThat(parameters.getContentDensity()).isEqualTo(0.3);
            assertThat(parameters.getGuidanceLevel()).isEqualTo(0.8);
            assertThat(parameters.getSessionDurationMinutes()).isEqualTo(20);
            assertThat(parameters.getContentTypes())
                    .containsExactly(ContentType.THEORY, ContentType.GUIDED_WALKTHROUGH);
        }

        @Test
        @DisplayName("BREAKTHROUGH is dense, hands-on and challenge-led")
        void breakthrough() {
            ModeParameters parameters = table.parametersFor(LearningMode.BREAKTHROUGH);

            assertThat(parameters.getContentDensity()).isEqualTo(0.9);
            assertThat(parameters.getHandsOnRatio()).isEqualTo(0.8);
            assertThat(parameters.getGuidanceLevel()).isEqualTo(0.1);
            assertThat(parameters.getContentTypes()).containsExactly(ContentType.CHALLENGE, ContentType.ASSESSMENT);
        }

        @Test
        @DisplayName("Density rises and guidance falls as the mode intensifies")
        void orderedAcrossModes() {
            double previousDensity = -1;
            double previousGuidance = 2;
            for (LearningMode mode : LearningMode.values()) {
                ModeParameters parameters = table.parametersFor(mode);
                assertThat(parameters.getContentDensity()).isGreaterThan(previousDensity);
                assertThat(parameters.getGuidanceLevel()).isLessThan(previousGuidance);
                previousDensity = parameters.getContentDensity();
                previousGuidance = parameters.getGuidanceLevel();
            }
        }

        @Test
        @DisplayName("Tunables hold only the four numeric parameters")
        void tunables() {
            Map<String, Double> tunables = table.parametersFor(LearningMode.FOCUSED).tunables();

            assertThat(tunables)
                    .containsOnlyKeys(
                            ModeParameters.CONTENT_DENSITY,
                            ModeParameters.INTERACTION_FREQUENCY,
                            ModeParameters.GUIDANCE_LEVEL,
                            ModeParameters.HANDS_ON_RATIO);
        }

        @Test
        @DisplayName("Parameter map carries duration and content type names")
        void parameterMap() {
            Map<String, Object> values = table.parametersFor(LearningMode.INTENSIVE).toParameterMap();

            assertThat(values).containsEntry(ModeParameters.SESSION_DURATION_MINUTES, 45);
            assertThat(values.get(ModeParameters.CONTENT_TYPES))
                    .asInstanceOf(InstanceOfAssertFactories.list(String.class))
                    .containsExactly("CHALLENGE", "PRACTICAL", "ASSESSMENT");
        }
    }

    @Nested
    @DisplayName("Cognitive adjustments")
    class CognitiveEntries {

        @Test
        @DisplayName("Every cognitive state has an adjustment")
        void totalOverStates() {
            for (CognitiveState state : CognitiveState.values()) {
                assertThat(table.adjustmentFor(state)).as("entry for %s", state).isNotNull();
            }
        }

        @Test
        @DisplayName("States map to their actions")
        void actions() {
            assertThat(table.adjustmentFor(CognitiveState.OVERLOADED).getAction()).isEqualTo(CognitiveAction.REDUCE_LOAD);
            assertThat(table.adjustmentFor(CognitiveState.OPTIMAL).getAction()).isEqualTo(CognitiveAction.MAINTAIN);
            assertThat(table.adjustmentFor(CognitiveState.UNDERUTILIZED).getAction())
                    .isEqualTo(CognitiveAction.INCREASE_COMPLEXITY);
            assertThat(table.adjustmentFor(CognitiveState.FATIGUED).getAction())
                    .isEqualTo(CognitiveAction.OFFER_RECOVERY);
        }

        @Test
        @DisplayName("Fatigue gets the shortest break cadence")
        void fatigueBreaks() {
            CognitiveAdjustment fatigued = table.adjustmentFor(CognitiveState.FATIGUED);

            assertThat(fatigued.getShortBreakMinutes()).isEqualTo(5);
            assertThat(fatigued.getLongBreakMinutes()).isEqualTo(20);
            assertThat(fatigued.getComplexityDelta()).isNegative();
        }
    }

    @Test
    @DisplayName("Target difficulty tracks the level with a challenge margin, capped at 1")
    void targetDifficulty() {
        assertThat(table.targetDifficulty(0.0)).isCloseTo(0.1, within(1e-9));
        assertThat(table.targetDifficulty(0.5)).isCloseTo(0.6, within(1e-9));
        assertThat(table.targetDifficulty(1.0)).isEqualTo(1.0);
    }
}
