package com.adaptivetutor.unit.session;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.adaptivetutor.adaptation.impl.DefaultAdaptationStrategyTable;
import com.adaptivetutor.adaptation.impl.NoOpEffectivenessScorer;
import com.adaptivetutor.breakthrough.BreakthroughDetector;
import com.adaptivetutor.config.SessionEngineConfig;
import com.adaptivetutor.core.engine.EffectivenessReviewer;
import com.adaptivetutor.core.engine.SessionEngine;
import com.adaptivetutor.domain.enums.CognitiveState;
import com.adaptivetutor.domain.enums.EndReason;
import com.adaptivetutor.domain.enums.LearningMode;
import com.adaptivetutor.domain.enums.SessionStatus;
import com.adaptivetutor.domain.model.LearningSession;
import com.adaptivetutor.domain.model.SignalUpdate;
import com.adaptivetutor.event.EventPublisherHelper;
import com.adaptivetutor.exception.UnknownSessionException;
import com.adaptivetutor.feed.ApplicationEventSignalFeed;
import com.adaptivetutor.session.SessionStore;
import com.adaptivetutor.session.SessionTimeoutMonitor;
import com.adaptivetutor.support.MutableClock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.TaskScheduler;

class SessionTimeoutMonitorTest {

    private static final LocalDateTime T0 = LocalDateTime.of(2025, 3, 10, 10, 0, 0);

    private MutableClock clock;
    private SessionEngineConfig config;
    private SessionStore sessionStore;
    private SessionEngine sessionEngine;
    private SessionTimeoutMonitor monitor;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        config = new SessionEngineConfig();
        config.setIdleTimeout(Duration.ofMinutes(30));
        config.setMaxSessionDuration(Duration.ofHours(4));
        sessionStore = new SessionStore(100);
        sessionEngine = new SessionEngine(
                sessionStore,
                new DefaultAdaptationStrategyTable(),
                new BreakthroughDetector(config),
                new EffectivenessReviewer(),
                new NoOpEffectivenessScorer(),
                new ApplicationEventSignalFeed(),
                new EventPublisherHelper(event -> {}),
                mock(TaskScheduler.class),
                config,
                clock);
        monitor = new SessionTimeoutMonitor(sessionStore, sessionEngine, config, clock);
    }

    private void keepAlive(String sessionId) {
        sessionEngine.onSignalUpdate(SignalUpdate.builder().sessionId(sessionId).level(0.5).build());
    }

    @Test
    @DisplayName("Session without signals for the idle timeout is ended as IDLE_TIMEOUT")
    void idleTimeout() {
        String sessionId = sessionEngine.start("u1", "l1", 0.5);

        assertThat(monitor.sweep(T0.plusMinutes(29))).isZero();
        assertThat(monitor.sweep(T0.plusMinutes(30))).isEqualTo(1);

        assertThat(sessionEngine.getSnapshot(sessionId).getStatus()).isEqualTo(SessionStatus.ENDED);
        assertThat(sessionEngine.getSnapshot(sessionId).getEndReason()).isEqualTo(EndReason.IDLE_TIMEOUT);
    }

    @Test
    @DisplayName("Signals keep a session alive until the maximum duration")
    void maxDuration() {
        String sessionId = sessionEngine.start("u1", "l1", 0.5);
        for (int i = 0; i < 8; i++) {
            clock.advance(Duration.ofMinutes(29));
            keepAlive(sessionId);
            assertThat(monitor.sweep(clock.now())).isZero();
        }

        clock.advance(Duration.ofMinutes(8));
        assertThat(monitor.sweep(clock.now())).isEqualTo(1);

        assertThat(sessionEngine.getSnapshot(sessionId).getEndReason()).isEqualTo(EndReason.MAX_DURATION);
    }

    @Test
    @DisplayName("Only expired sessions are ended")
    void onlyExpired() {
        String stale = sessionEngine.start("u1", "l1", 0.5);
        clock.advance(Duration.ofMinutes(20));
        String fresh = sessionEngine.start("u2", "l1", 0.5);

        int ended = monitor.sweep(T0.plusMinutes(35));

        assertThat(ended).isEqualTo(1);
        assertThat(sessionEngine.getSnapshot(stale).getStatus()).isEqualTo(SessionStatus.ENDED);
        assertThat(sessionEngine.getSnapshot(fresh).getStatus()).isEqualTo(SessionStatus.ACTIVE);
    }

    @Test
    @DisplayName("Scheduled sweep reads the injected clock")
    void scheduledSweepUsesClock() {
        String sessionId = sessionEngine.start("u1", "l1", 0.5);
        clock.advance(Duration.ofHours(1));

        monitor.sweep();

        assertThat(sessionEngine.getSnapshot(sessionId).getStatus()).isEqualTo(SessionStatus.ENDED);
    }

    @Test
    @DisplayName("A session that vanishes mid-sweep is skipped")
    void vanishedSession() {
        SessionStore store = mock(SessionStore.class);
        SessionEngine engine = mock(SessionEngine.class);
        LearningSession session =
                new LearningSession("S1", "u1", "l1", 0.5, LearningMode.FOCUSED, CognitiveState.OPTIMAL, T0);
        when(store.liveSessions()).thenReturn(List.of(session));
        doThrow(new UnknownSessionException("S1")).when(engine).end("S1", EndReason.IDLE_TIMEOUT);
        SessionTimeoutMonitor isolated = new SessionTimeoutMonitor(store, engine, config, clock);

        assertThat(isolated.sweep(T0.plusHours(1))).isZero();
        verify(engine).end("S1", EndReason.IDLE_TIMEOUT);
    }
}
