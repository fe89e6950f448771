package com.adaptivetutor.observability;

import com.adaptivetutor.domain.enums.AdaptationKind;
import com.adaptivetutor.domain.model.MetricsSnapshot;
import com.adaptivetutor.domain.model.SessionSnapshot;
import com.adaptivetutor.event.AdaptationEmittedEvent;
import com.adaptivetutor.event.BreakthroughDetectedEvent;
import com.adaptivetutor.event.SessionEventType;
import com.adaptivetutor.event.SessionLifecycleEvent;
import com.adaptivetutor.event.SessionReviewedEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.DoubleAdder;
import java.util.concurrent.atomic.LongAdder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Cross-session counters, fed by the engine's events and polled through {@link #snapshot()}.
 *
 * <p>Micrometer meters:
 * <ul>
 *   <li><b>sessions.active</b> (gauge): sessions started minus sessions ended</li>
 *   <li><b>adaptations.emitted</b> (counter, tag {@code kind}): every adaptation appended, breakthroughs included</li>
 *   <li><b>breakthroughs.detected</b> (counter)</li>
 *   <li><b>session.tick.latency</b> (timer): wall time of each periodic review</li>
 * </ul>
 *
 * <p>All counters are {@link LongAdder}s, safe under concurrent increments from any session.
 * {@code adaptationsPerMinute} counts adaptations in the trailing {@link #WINDOW}.
 */
@Service
public class SessionMetricsAggregator {

    private static final Logger log = LoggerFactory.getLogger(SessionMetricsAggregator.class);

    public static final Duration WINDOW = Duration.ofSeconds(60);

    /** Weight of each ended session's adaptation rate in the running EMA. */
    static final double RATE_ALPHA = 0.1;

    private final LongAdder sessionsStarted = new LongAdder();
    private final LongAdder sessionsEnded = new LongAdder();
    private final LongAdder adaptationsEmitted = new LongAdder();
    private final LongAdder breakthroughEvents = new LongAdder();
    private final DoubleAdder effectivenessSum = new DoubleAdder();
    private final LongAdder effectivenessCount = new LongAdder();

    /** Emission times (epoch millis) inside the trailing window, oldest first. */
    private final ConcurrentLinkedDeque<Long> recentAdaptations = new ConcurrentLinkedDeque<>();

    private final Object rateLock = new Object();
    private double avgSessionAdaptationRate;
    private boolean rateSeeded;

    private final Map<AdaptationKind, Counter> adaptationCounters = new EnumMap<>(AdaptationKind.class);
    private final Counter breakthroughCounter;
    private final Timer tickLatencyTimer;
    private final Clock clock;

    public SessionMetricsAggregator(MeterRegistry meterRegistry, Clock clock) {
        this.clock = clock;

        for (AdaptationKind kind : AdaptationKind.values()) {
            adaptationCounters.put(
                    kind,
                    Counter.builder("adaptations.emitted")
                            .description("Adaptations appended to session histories")
                            .tag("kind", kind.name())
                            .register(meterRegistry));
        }

        this.breakthroughCounter = Counter.builder("breakthroughs.detected")
                .description("Breakthrough opportunities detected across all sessions")
                .register(meterRegistry);

        this.tickLatencyTimer = Timer.builder("session.tick.latency")
                .description("Wall time of one periodic session review, lock wait included")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry);

        meterRegistry.gauge("sessions.active", this, SessionMetricsAggregator::activeSessions);
    }

    @EventListener
    @Order(20)
    public void onSessionLifecycle(SessionLifecycleEvent event) {
        if (event.getEventType() == SessionEventType.STARTED) {
            sessionsStarted.increment();
        } else if (event.getEventType() == SessionEventType.ENDED) {
            sessionsEnded.increment();
            recordSessionRate(event.getSnapshot());
        }
    }

    @EventListener
    @Order(20)
    public void onAdaptationEmitted(AdaptationEmittedEvent event) {
        recordAdaptation(event.getAdaptation().getKind());
    }

    @EventListener
    @Order(20)
    public void onBreakthroughDetected(BreakthroughDetectedEvent event) {
        breakthroughEvents.increment();
        breakthroughCounter.increment();
        recordAdaptation(AdaptationKind.BREAKTHROUGH);
    }

    @EventListener
    @Order(20)
    public void onSessionReviewed(SessionReviewedEvent event) {
        effectivenessSum.add(event.getReview().effectiveness());
        effectivenessCount.increment();
        tickLatencyTimer.record(event.getDurationNanos(), TimeUnit.NANOSECONDS);
    }

    public MetricsSnapshot snapshot() {
        long started = sessionsStarted.sum();
        long ended = sessionsEnded.sum();
        long reviews = effectivenessCount.sum();
        double rate;
        synchronized (rateLock) {
            rate = avgSessionAdaptationRate;
        }
        return MetricsSnapshot.builder()
                .activeSessions(Math.max(0, started - ended))
                .adaptationsPerMinute(adaptationsPerMinute())
                .breakthroughEvents(breakthroughEvents.sum())
                .avgEffectiveness(reviews == 0 ? 0.0 : effectivenessSum.sum() / reviews)
                .sessionsStarted(started)
                .sessionsEnded(ended)
                .adaptationsEmitted(adaptationsEmitted.sum())
                .avgSessionAdaptationRate(rate)
                .build();
    }

    public long activeSessions() {
        return Math.max(0, sessionsStarted.sum() - sessionsEnded.sum());
    }

    public long adaptationsPerMinute() {
        long now = clock.millis();
        prune(now);
        long cutoff = now - WINDOW.toMillis();
        long count = 0;
        for (Long emittedAt : recentAdaptations) {
            if (emittedAt > cutoff) {
                count++;
            }
        }
        return count;
    }

    private void recordAdaptation(AdaptationKind kind) {
        long now = clock.millis();
        adaptationsEmitted.increment();
        adaptationCounters.get(kind).increment();
        recentAdaptations.addLast(now);
        prune(now);
    }

    private void prune(long now) {
        long cutoff = now - WINDOW.toMillis();
        Iterator<Long> iterator = recentAdaptations.iterator();
        while (iterator.hasNext()) {
            if (iterator.next() > cutoff) {
                break;
            }
            iterator.remove();
        }
    }

    private void recordSessionRate(SessionSnapshot snapshot) {
        if (snapshot == null || snapshot.getEndedAt() == null) {
            return;
        }
        double minutes = Math.max(1.0, Duration.between(snapshot.getStartedAt(), snapshot.getEndedAt()).toMillis() / 60_000.0);
        double rate = snapshot.getAdaptations().size() / minutes;
        synchronized (rateLock) {
            if (!rateSeeded) {
                avgSessionAdaptationRate = rate;
                rateSeeded = true;
            } else {
                avgSessionAdaptationRate = (1 - RATE_ALPHA) * avgSessionAdaptationRate + RATE_ALPHA * rate;
            }
        }
        log.debug("Session {} ended at {} adaptations/min", snapshot.getId(), rate);
    }
}
