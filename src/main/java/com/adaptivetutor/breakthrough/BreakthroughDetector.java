package com.adaptivetutor.breakthrough;

import com.adaptivetutor.config.SessionEngineConfig;
import com.adaptivetutor.domain.model.BreakthroughOpportunity;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Flags rare high-signal moments per session, at most once per cool-down window.
 *
 * <p>Rule: fires when {@code level > threshold} (strictly) and the session has not fired
 * within the last {@code cooldown}. The eligibility check and the recording of the firing
 * happen inside one {@link ConcurrentHashMap#compute} call, so two concurrent qualifying
 * signals for the same session can never both fire.
 *
 * <p>Cool-down is measured against the timestamps the engine passes in (session wall-clock),
 * not against system time.
 */
@Component
public class BreakthroughDetector {

    private static final Logger log = LoggerFactory.getLogger(BreakthroughDetector.class);

    private final double threshold;
    private final Duration cooldown;

    /** Last firing time per session ID. */
    private final ConcurrentHashMap<String, LocalDateTime> lastFiredAt = new ConcurrentHashMap<>();

    @Autowired
    public BreakthroughDetector(SessionEngineConfig sessionEngineConfig) {
        this(sessionEngineConfig.getBreakthroughThreshold(), sessionEngineConfig.getBreakthroughCooldown());
    }

    public BreakthroughDetector(double threshold, Duration cooldown) {
        this.threshold = threshold;
        this.cooldown = cooldown;
    }

    /**
     * Evaluates one signal for a session and records the firing if it qualifies.
     *
     * @return the opportunity if the detector fired, empty otherwise
     */
    public Optional<BreakthroughOpportunity> evaluate(String sessionId, double level, LocalDateTime now) {
        if (level <= threshold) {
            return Optional.empty();
        }

        AtomicReference<BreakthroughOpportunity> fired = new AtomicReference<>();
        lastFiredAt.compute(sessionId, (id, previous) -> {
            if (previous != null && isWithinCooldown(previous, now)) {
                return previous;
            }
            fired.set(new BreakthroughOpportunity(id, level, now));
            return now;
        });

        if (fired.get() == null) {
            log.debug("Breakthrough suppressed for session {} (cool-down active), level={}", sessionId, level);
        }
        return Optional.ofNullable(fired.get());
    }

    public boolean isInCooldown(String sessionId, LocalDateTime now) {
        LocalDateTime previous = lastFiredAt.get(sessionId);
        return previous != null && isWithinCooldown(previous, now);
    }

    /** Forgets the session's firing history. Called when the session ends. */
    public void reset(String sessionId) {
        lastFiredAt.remove(sessionId);
    }

    public double getThreshold() {
        return threshold;
    }

    public Duration getCooldown() {
        return cooldown;
    }

    private boolean isWithinCooldown(LocalDateTime previous, LocalDateTime now) {
        return Duration.between(previous, now).compareTo(cooldown) < 0;
    }
}
