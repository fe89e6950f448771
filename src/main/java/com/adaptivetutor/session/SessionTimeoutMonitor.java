package com.adaptivetutor.session;

import com.adaptivetutor.config.SessionEngineConfig;
import com.adaptivetutor.core.engine.SessionEngine;
import com.adaptivetutor.domain.enums.EndReason;
import com.adaptivetutor.domain.model.LearningSession;
import com.adaptivetutor.exception.UnknownSessionException;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Ends sessions nobody is driving any more.
 *
 * <p>Every minute, a live session is ended with {@link EndReason#MAX_DURATION} once it is older
 * than {@code maxSessionDuration}, or with {@link EndReason#IDLE_TIMEOUT} once no signal has
 * arrived for {@code idleTimeout}. Reads only volatile fields, so the sweep never takes a
 * session lock itself; {@link SessionEngine#end(String, EndReason)} does.
 */
@Component
public class SessionTimeoutMonitor {

    private static final Logger log = LoggerFactory.getLogger(SessionTimeoutMonitor.class);

    private final SessionStore sessionStore;
    private final SessionEngine sessionEngine;
    private final SessionEngineConfig sessionEngineConfig;
    private final Clock clock;

    public SessionTimeoutMonitor(
            SessionStore sessionStore,
            SessionEngine sessionEngine,
            SessionEngineConfig sessionEngineConfig,
            Clock clock) {
        this.sessionStore = sessionStore;
        this.sessionEngine = sessionEngine;
        this.sessionEngineConfig = sessionEngineConfig;
        this.clock = clock;
    }

    @Scheduled(fixedRate = 60_000)
    public void sweep() {
        sweep(LocalDateTime.now(clock));
    }

    /**
     * Ends every live session that has timed out as of {@code now}. Public for testability
     * since the test package differs from the source package.
     *
     * @return number of sessions ended by this sweep
     */
    public int sweep(LocalDateTime now) {
        Duration idleTimeout = sessionEngineConfig.getIdleTimeout();
        Duration maxDuration = sessionEngineConfig.getMaxSessionDuration();

        List<String> expired = new ArrayList<>();
        List<EndReason> reasons = new ArrayList<>();
        for (LearningSession session : sessionStore.liveSessions()) {
            if (session.isEnded()) {
                continue;
            }
            if (Duration.between(session.getStartedAt(), now).compareTo(maxDuration) >= 0) {
                expired.add(session.getId());
                reasons.add(EndReason.MAX_DURATION);
            } else if (Duration.between(session.getLastActivityAt(), now).compareTo(idleTimeout) >= 0) {
                expired.add(session.getId());
                reasons.add(EndReason.IDLE_TIMEOUT);
            }
        }

        int ended = 0;
        for (int i = 0; i < expired.size(); i++) {
            String sessionId = expired.get(i);
            try {
                sessionEngine.end(sessionId, reasons.get(i));
                ended++;
                log.info("Session {} timed out ({})", sessionId, reasons.get(i));
            } catch (UnknownSessionException e) {
                log.debug("Session {} vanished before timeout end: {}", sessionId, e.getMessage());
            }
        }
        return ended;
    }
}
