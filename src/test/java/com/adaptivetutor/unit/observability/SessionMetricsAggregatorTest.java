package com.adaptivetutor.unit.observability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.adaptivetutor.core.engine.EffectivenessReview;
import com.adaptivetutor.domain.enums.AdaptationKind;
import com.adaptivetutor.domain.enums.EndReason;
import com.adaptivetutor.domain.enums.SessionStatus;
import com.adaptivetutor.domain.model.Adaptation;
import com.adaptivetutor.domain.model.MetricsSnapshot;
import com.adaptivetutor.domain.model.SessionSnapshot;
import com.adaptivetutor.event.AdaptationEmittedEvent;
import com.adaptivetutor.event.BreakthroughDetectedEvent;
import com.adaptivetutor.event.SessionEventType;
import com.adaptivetutor.event.SessionLifecycleEvent;
import com.adaptivetutor.event.SessionReviewedEvent;
import com.adaptivetutor.observability.SessionMetricsAggregator;
import com.adaptivetutor.support.MutableClock;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for SessionMetricsAggregator: counters, the trailing-minute adaptation window,
 * the per-session rate EMA, and the Micrometer meters behind them.
 */
class SessionMetricsAggregatorTest {

    private static final LocalDateTime T0 = LocalDateTime.of(2025, 3, 10, 10, 0, 0);

    private MeterRegistry meterRegistry;
    private MutableClock clock;
    private SessionMetricsAggregator aggregator;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        clock = new MutableClock(T0);
        aggregator = new SessionMetricsAggregator(meterRegistry, clock);
    }

    private static Adaptation adaptation(AdaptationKind kind) {
        return Adaptation.builder()
                .id("A-" + kind)
                .sessionId("S1")
                .kind(kind)
                .triggerLevel(0.5)
                .parameters(Map.of())
                .timestamp(T0)
                .build();
    }

    private static SessionSnapshot endedSession(String id, int adaptations, Duration length) {
        List<Adaptation> history = new ArrayList<>();
        for (int i = 0; i < adaptations; i++) {
            history.add(adaptation(AdaptationKind.MODE_CHANGE));
        }
        return SessionSnapshot.builder()
                .id(id)
                .userId("u1")
                .lessonId("l1")
                .status(SessionStatus.ENDED)
                .trajectory(List.of())
                .adaptations(history)
                .performanceMetrics(Map.of())
                .activeParameters(Map.of())
                .startedAt(T0)
                .lastActivityAt(T0)
                .endedAt(T0.plus(length))
                .endReason(EndReason.EXPLICIT)
                .build();
    }

    private void started(String id) {
        aggregator.onSessionLifecycle(new SessionLifecycleEvent(this, SessionEventType.STARTED, id, null));
    }

    private void ended(SessionSnapshot snapshot) {
        aggregator.onSessionLifecycle(
                new SessionLifecycleEvent(this, SessionEventType.ENDED, snapshot.getId(), snapshot));
    }

    // ========================
    // COUNTERS
    // ========================

    @Nested
    @DisplayName("Counters")
    class Counters {

        @Test
        @DisplayName("Active sessions is started minus ended, also exposed as a gauge")
        void activeSessions() {
            started("S1");
            started("S2");
            ended(endedSession("S1", 0, Duration.ofMinutes(1)));

            MetricsSnapshot snapshot = aggregator.snapshot();
            assertThat(snapshot.getActiveSessions()).isEqualTo(1);
            assertThat(snapshot.getSessionsStarted()).isEqualTo(2);
            assertThat(snapshot.getSessionsEnded()).isEqualTo(1);
            assertThat(meterRegistry.get("sessions.active").gauge().value()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Adaptations are counted per kind; breakthroughs count as adaptations too")
        void adaptationsPerKind() {
            aggregator.onAdaptationEmitted(new AdaptationEmittedEvent(this, adaptation(AdaptationKind.MODE_CHANGE)));
            aggregator.onAdaptationEmitted(
                    new AdaptationEmittedEvent(this, adaptation(AdaptationKind.COGNITIVE_CHANGE)));
            aggregator.onBreakthroughDetected(new BreakthroughDetectedEvent(this, "S1", 0.9, T0));

            MetricsSnapshot snapshot = aggregator.snapshot();
            assertThat(snapshot.getAdaptationsEmitted()).isEqualTo(3);
            assertThat(snapshot.getBreakthroughEvents()).isEqualTo(1);
            assertThat(meterRegistry.get("adaptations.emitted").tag("kind", "MODE_CHANGE").counter().count())
                    .isEqualTo(1.0);
            assertThat(meterRegistry.get("adaptations.emitted").tag("kind", "BREAKTHROUGH").counter().count())
                    .isEqualTo(1.0);
            assertThat(meterRegistry.get("breakthroughs.detected").counter().count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Average effectiveness is the mean of all reviews; ticks are timed")
        void averageEffectiveness() {
            aggregator.onSessionReviewed(new SessionReviewedEvent(
                    this, "S1", new EffectivenessReview(0.0, 0.5, 1.0, 0.6, 1, Map.of()), 2_000_000L));
            aggregator.onSessionReviewed(new SessionReviewedEvent(
                    this, "S2", new EffectivenessReview(0.0, 0.5, 1.0, 0.8, 1, Map.of()), 4_000_000L));

            assertThat(aggregator.snapshot().getAvgEffectiveness()).isCloseTo(0.7, within(1e-9));
            assertThat(meterRegistry.get("session.tick.latency").timer().count()).isEqualTo(2);
        }

        @Test
        @DisplayName("Fresh aggregator reports zeros")
        void emptySnapshot() {
            MetricsSnapshot snapshot = aggregator.snapshot();

            assertThat(snapshot.getActiveSessions()).isZero();
            assertThat(snapshot.getAdaptationsPerMinute()).isZero();
            assertThat(snapshot.getAvgEffectiveness()).isZero();
            assertThat(snapshot.getAvgSessionAdaptationRate()).isZero();
        }
    }

    // ========================
    // RATES
    // ========================

    @Nested
    @DisplayName("Rates")
    class Rates {

        @Test
        @DisplayName("Adaptations per minute only counts the trailing window")
        void trailingWindow() {
            aggregator.onAdaptationEmitted(new AdaptationEmittedEvent(this, adaptation(AdaptationKind.MODE_CHANGE)));
            clock.advance(Duration.ofSeconds(30));
            aggregator.onAdaptationEmitted(new AdaptationEmittedEvent(this, adaptation(AdaptationKind.OPTIMIZATION)));

            assertThat(aggregator.adaptationsPerMinute()).isEqualTo(2);

            clock.advance(Duration.ofSeconds(31));
            assertThat(aggregator.adaptationsPerMinute()).isEqualTo(1);

            clock.advance(Duration.ofSeconds(30));
            assertThat(aggregator.adaptationsPerMinute()).isZero();
            assertThat(aggregator.snapshot().getAdaptationsEmitted()).isEqualTo(2);
        }

        @Test
        @DisplayName("First ended session seeds the rate EMA; later ones are folded in")
        void sessionRateEma() {
            ended(endedSession("S1", 10, Duration.ofMinutes(5)));
            assertThat(aggregator.snapshot().getAvgSessionAdaptationRate()).isCloseTo(2.0, within(1e-9));

            ended(endedSession("S2", 12, Duration.ofMinutes(1)));
            assertThat(aggregator.snapshot().getAvgSessionAdaptationRate()).isCloseTo(3.0, within(1e-9));
        }

        @Test
        @DisplayName("Sessions shorter than a minute count as one minute")
        void shortSessionRate() {
            ended(endedSession("S1", 3, Duration.ofSeconds(10)));

            assertThat(aggregator.snapshot().getAvgSessionAdaptationRate()).isCloseTo(3.0, within(1e-9));
        }
    }

    @Test
    @DisplayName("Concurrent events from many sessions are all counted")
    void concurrentEvents() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch done = new CountDownLatch(8);
        try {
            for (int t = 0; t < 8; t++) {
                executor.submit(() -> {
                    try {
                        for (int i = 0; i < 500; i++) {
                            aggregator.onAdaptationEmitted(
                                    new AdaptationEmittedEvent(this, adaptation(AdaptationKind.MODE_CHANGE)));
                        }
                    } finally {
                        done.countDown();
                    }
                });
            }
            assertThat(done.await(10, TimeUnit.SECONDS)).isTrue();
        } finally {
            executor.shutdownNow();
        }

        assertThat(aggregator.snapshot().getAdaptationsEmitted()).isEqualTo(4000);
        assertThat(aggregator.adaptationsPerMinute()).isEqualTo(4000);
    }
}
