package com.adaptivetutor.unit.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.adaptivetutor.adaptation.ModeParameters;
import com.adaptivetutor.core.engine.EffectivenessReview;
import com.adaptivetutor.core.engine.EffectivenessReviewer;
import com.adaptivetutor.domain.model.TrajectorySample;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for EffectivenessReviewer: trend statistics and the nudges they produce.
 */
class EffectivenessReviewerTest {

    private static final LocalDateTime T0 = LocalDateTime.of(2025, 3, 10, 10, 0, 0);

    private final EffectivenessReviewer reviewer = new EffectivenessReviewer();

    private static List<TrajectorySample> trajectory(double... levels) {
        List<TrajectorySample> samples = new ArrayList<>();
        for (int i = 0; i < levels.length; i++) {
            samples.add(new TrajectorySample(T0.plusSeconds(i), levels[i]));
        }
        return samples;
    }

    private static Map<String, Double> parameters(double density, double interaction, double guidance, double handsOn) {
        Map<String, Double> values = new LinkedHashMap<>();
        values.put(ModeParameters.CONTENT_DENSITY, density);
        values.put(ModeParameters.INTERACTION_FREQUENCY, interaction);
        values.put(ModeParameters.GUIDANCE_LEVEL, guidance);
        values.put(ModeParameters.HANDS_ON_RATIO, handsOn);
        return values;
    }

    @Nested
    @DisplayName("Statistics")
    class Statistics {

        @Test
        @DisplayName("Single sample has zero slope and full stability")
        void singleSample() {
            EffectivenessReview review = reviewer.review(trajectory(0.5), parameters(0.5, 0.5, 0.5, 0.5));

            assertThat(review.slope()).isEqualTo(0.0);
            assertThat(review.stability()).isEqualTo(1.0);
            assertThat(review.recentMean()).isEqualTo(0.5);
            // 0.5*0.5 + 0.3*1.0 + 0.2*0.5
            assertThat(review.effectiveness()).isCloseTo(0.65, within(1e-9));
            assertThat(review.sampleCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("Linear ramp recovers its per-sample slope")
        void linearSlope() {
            EffectivenessReview review =
                    reviewer.review(trajectory(0.1, 0.2, 0.3, 0.4, 0.5), parameters(0.5, 0.5, 0.5, 0.5));

            assertThat(review.slope()).isCloseTo(0.1, within(1e-9));
            assertThat(review.isImproving()).isTrue();
        }

        @Test
        @DisplayName("Only the last ten samples are reviewed")
        void windowOfTen() {
            double[] levels = new double[15];
            for (int i = 0; i < 5; i++) {
                levels[i] = 0.0;
            }
            for (int i = 5; i < 15; i++) {
                levels[i] = 0.7;
            }

            EffectivenessReview review = reviewer.review(trajectory(levels), parameters(0.5, 0.5, 0.5, 0.5));

            assertThat(review.sampleCount()).isEqualTo(EffectivenessReviewer.WINDOW);
            assertThat(review.recentMean()).isCloseTo(0.7, within(1e-9));
            assertThat(review.slope()).isCloseTo(0.0, within(1e-9));
        }

        @Test
        @DisplayName("Empty trajectory is rejected")
        void emptyRejected() {
            assertThatThrownBy(() -> reviewer.review(List.of(), Map.of()))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Nudges")
    class Nudges {

        @Test
        @DisplayName("Declining trend raises guidance and lowers density")
        void declining() {
            EffectivenessReview review =
                    reviewer.review(trajectory(0.8, 0.7, 0.6, 0.5, 0.4), parameters(0.5, 0.5, 0.5, 0.5));

            assertThat(review.isDeclining()).isTrue();
            assertThat(review.nudges())
                    .containsEntry(ModeParameters.GUIDANCE_LEVEL, 0.6)
                    .containsEntry(ModeParameters.CONTENT_DENSITY, 0.4)
                    .doesNotContainKey(ModeParameters.INTERACTION_FREQUENCY);
        }

        @Test
        @DisplayName("Strong improvement raises density and hands-on work")
        void improving() {
            EffectivenessReview review =
                    reviewer.review(trajectory(0.6, 0.7, 0.8, 0.9, 1.0), parameters(0.7, 0.4, 0.3, 0.7));

            assertThat(review.effectiveness()).isGreaterThanOrEqualTo(EffectivenessReviewer.HIGH_EFFECTIVENESS);
            assertThat(review.nudges())
                    .containsEntry(ModeParameters.CONTENT_DENSITY, 0.8)
                    .containsEntry(ModeParameters.HANDS_ON_RATIO, 0.8)
                    .hasSize(2);
        }

        @Test
        @DisplayName("Flat low engagement raises interaction")
        void lowEffectiveness() {
            // symmetric spikes: slope 0, mean 0.2, stability 0.6, effectiveness 0.38
            EffectivenessReview review = reviewer.review(
                    trajectory(0.0, 0.0, 0.0, 1.0, 0.0, 0.0, 1.0, 0.0, 0.0, 0.0), parameters(0.3, 0.7, 0.8, 0.3));

            assertThat(review.effectiveness()).isLessThan(EffectivenessReviewer.LOW_EFFECTIVENESS);
            assertThat(review.isDeclining()).isFalse();
            assertThat(review.nudges()).containsEntry(ModeParameters.INTERACTION_FREQUENCY, 0.8);
        }

        @Test
        @DisplayName("Nudges at a bound are dropped")
        void boundDropped() {
            EffectivenessReview review =
                    reviewer.review(trajectory(0.8, 0.7, 0.6, 0.5, 0.4), parameters(0.0, 0.5, 1.0, 0.5));

            assertThat(review.isDeclining()).isTrue();
            assertThat(review.hasNudges()).isFalse();
        }

        @Test
        @DisplayName("Steady healthy session gets no nudges")
        void steady() {
            EffectivenessReview review =
                    reviewer.review(trajectory(0.5, 0.5, 0.5, 0.5, 0.5), parameters(0.5, 0.5, 0.5, 0.5));

            assertThat(review.hasNudges()).isFalse();
        }
    }
}
