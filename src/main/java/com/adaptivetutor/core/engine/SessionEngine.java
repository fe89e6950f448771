package com.adaptivetutor.core.engine;

import com.adaptivetutor.adaptation.AdaptationStrategyTable;
import com.adaptivetutor.adaptation.CognitiveAdjustment;
import com.adaptivetutor.adaptation.EffectivenessScorer;
import com.adaptivetutor.adaptation.ModeParameters;
import com.adaptivetutor.breakthrough.BreakthroughDetector;
import com.adaptivetutor.config.SessionEngineConfig;
import com.adaptivetutor.core.processor.SignalClassifier;
import com.adaptivetutor.domain.enums.AdaptationKind;
import com.adaptivetutor.domain.enums.CognitiveState;
import com.adaptivetutor.domain.enums.EndReason;
import com.adaptivetutor.domain.enums.LearningMode;
import com.adaptivetutor.domain.model.Adaptation;
import com.adaptivetutor.domain.model.BreakthroughOpportunity;
import com.adaptivetutor.domain.model.LearningSession;
import com.adaptivetutor.domain.model.SessionSnapshot;
import com.adaptivetutor.domain.model.SignalUpdate;
import com.adaptivetutor.domain.model.TrajectorySample;
import com.adaptivetutor.event.EventPublisherHelper;
import com.adaptivetutor.exception.InvalidInputException;
import com.adaptivetutor.exception.TransientProcessingFailureException;
import com.adaptivetutor.exception.UnknownSessionException;
import com.adaptivetutor.feed.FeedSubscription;
import com.adaptivetutor.feed.SignalFeed;
import com.adaptivetutor.session.SessionStore;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

/**
 * Orchestrates every live learning session: lifecycle, inbound signal handling and the
 * periodic effectiveness review.
 *
 * <p><b>Concurrency model:</b> each session has a {@link ReentrantLock} held in its
 * {@link SessionRuntime}. Inbound updates, the periodic tick, explicit back-fill and end all
 * run under that lock, so work for one session never interleaves while different sessions
 * proceed in parallel. Inbound updates block on the lock; ticks wait at most
 * {@code tickTimeout} and count as failed otherwise.
 *
 * <p><b>Tick scheduling:</b> each tick schedules the next one as a one-shot task on the shared
 * {@code sessionTickScheduler}. After a success the delay is {@code tickInterval}; after
 * {@code n} consecutive failures it is {@code min(tickInterval * 2^n, maxTickBackoff)}.
 * {@link #end(String, EndReason)} cancels the runtime before taking the lock, and a cancelled
 * runtime refuses new schedules, so no tick starts once end has returned.
 *
 * <p><b>Outbound events:</b> publications are enqueued on the session's {@link SessionOutbox}
 * under the lock and delivered after it is released, so a slow listener never holds the lock.
 * Listeners may call back into the engine.
 *
 * <p><b>State machine:</b> ACTIVE to ENDED, terminal. Work arriving for an ended session is
 * dropped after re-checking the status under the lock.
 *
 * <p>Implements {@link SmartLifecycle} so that every live session is ended with reason
 * SHUTDOWN before the context closes.
 */
@Service
public class SessionEngine implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(SessionEngine.class);

    public static final String METRIC_SIGNAL_UPDATES = "signal_updates";
    public static final String METRIC_ADAPTATIONS = "adaptations";
    public static final String METRIC_BREAKTHROUGHS = "breakthroughs";
    public static final String METRIC_ENGAGEMENT = "engagement";
    public static final String METRIC_STABILITY = "stability";
    public static final String METRIC_EFFECTIVENESS = "effectiveness";

    /** Runtime handles keyed by session ID. Present only while the session is live. */
    private final ConcurrentHashMap<String, SessionRuntime> runtimes = new ConcurrentHashMap<>();

    private final AtomicBoolean running = new AtomicBoolean(false);

    private final SessionStore sessionStore;
    private final AdaptationStrategyTable strategyTable;
    private final BreakthroughDetector breakthroughDetector;
    private final EffectivenessReviewer effectivenessReviewer;
    private final EffectivenessScorer effectivenessScorer;
    private final SignalFeed signalFeed;
    private final EventPublisherHelper eventPublisherHelper;
    private final TaskScheduler taskScheduler;
    private final SessionEngineConfig sessionEngineConfig;
    private final Clock clock;

    public SessionEngine(
            SessionStore sessionStore,
            AdaptationStrategyTable strategyTable,
            BreakthroughDetector breakthroughDetector,
            EffectivenessReviewer effectivenessReviewer,
            EffectivenessScorer effectivenessScorer,
            SignalFeed signalFeed,
            EventPublisherHelper eventPublisherHelper,
            @Qualifier("sessionTickScheduler") TaskScheduler taskScheduler,
            SessionEngineConfig sessionEngineConfig,
            Clock clock) {
        this.sessionStore = sessionStore;
        this.strategyTable = strategyTable;
        this.breakthroughDetector = breakthroughDetector;
        this.effectivenessReviewer = effectivenessReviewer;
        this.effectivenessScorer = effectivenessScorer;
        this.signalFeed = signalFeed;
        this.eventPublisherHelper = eventPublisherHelper;
        this.taskScheduler = taskScheduler;
        this.sessionEngineConfig = sessionEngineConfig;
        this.clock = clock;
    }

    // ========================
    // START
    // ========================

    /**
     * Creates an ACTIVE session, subscribes it to the signal feed and schedules its first tick.
     *
     * <p>The initial classification is recorded as the session's state, not as an adaptation.
     *
     * @return the generated session ID
     * @throws InvalidInputException if the signal is undefined or non-finite, or an ID is blank
     */
    public String start(String userId, String lessonId, Double initialSignal) {
        if (userId == null || userId.isBlank()) {
            throw new InvalidInputException("userId must not be blank");
        }
        if (lessonId == null || lessonId.isBlank()) {
            throw new InvalidInputException("lessonId must not be blank");
        }
        if (!SignalClassifier.isValidLevel(initialSignal)) {
            throw new InvalidInputException(
                    "Initial signal must be a finite number", Map.of("initialSignal", String.valueOf(initialSignal)));
        }

        String sessionId = UUID.randomUUID().toString();
        double level = clampLogged(sessionId, initialSignal);
        LocalDateTime now = LocalDateTime.now(clock);

        LearningMode mode = SignalClassifier.classifyMode(level);
        CognitiveState cognitiveState = SignalClassifier.classifyCognitiveState(level, Map.of());
        LearningSession session =
                new LearningSession(sessionId, userId, lessonId, level, mode, cognitiveState, now);
        session.replaceActiveParameters(strategyTable.parametersFor(mode).tunables());
        refreshTargetDifficulty(session);
        session.updateMetricEma(METRIC_ENGAGEMENT, level);

        SessionRuntime runtime = new SessionRuntime();
        runtime.lock.lock();
        try {
            runtimes.put(sessionId, runtime);
            sessionStore.add(session);
            runtime.attach(signalFeed.subscribe(sessionId, this::onSignalUpdate));
            scheduleNextTick(sessionId, runtime, sessionEngineConfig.getTickInterval());
            SessionSnapshot snapshot = session.toSnapshot();
            runtime.outbox.enqueue(() -> eventPublisherHelper.publishSessionStarted(this, snapshot));
        } finally {
            runtime.lock.unlock();
        }

        log.info(
                "Session {} started for user {} lesson {}: level={}, mode={}, cognitiveState={}",
                sessionId, userId, lessonId, level, mode, cognitiveState);
        runtime.outbox.drain();
        return sessionId;
    }

    // ========================
    // INBOUND SIGNALS
    // ========================

    /**
     * Applies one engagement signal to its session.
     *
     * <p>Unknown and ended sessions are silently ignored. Updates older than the latest trajectory
     * sample are dropped as stale. Out-of-range levels are clamped.
     *
     * @throws InvalidInputException if the level is undefined or non-finite; the session is untouched
     */
    public void onSignalUpdate(SignalUpdate update) {
        if (update == null || update.getSessionId() == null) {
            log.debug("Ignoring signal update without a session ID");
            return;
        }
        String sessionId = update.getSessionId();
        SessionRuntime runtime = runtimes.get(sessionId);
        Optional<LearningSession> found = sessionStore.find(sessionId);
        if (runtime == null || found.isEmpty()) {
            log.debug("Ignoring signal update for unknown or ended session {}", sessionId);
            return;
        }
        if (!SignalClassifier.isValidLevel(update.getLevel())) {
            throw new InvalidInputException(
                    "Signal level for session " + sessionId + " is not a finite number",
                    Map.of("level", String.valueOf(update.getLevel())));
        }

        LearningSession session = found.get();
        runtime.lock.lock();
        try {
            if (session.isEnded()) {
                log.debug("Ignoring signal update for ended session {}", sessionId);
                return;
            }
            LocalDateTime now = LocalDateTime.now(clock);
            LocalDateTime latest = session.latestSample().map(TrajectorySample::timestamp).orElse(null);
            LocalDateTime timestamp = resolveTimestamp(update.getTimestamp(), now, latest);
            if (latest != null && timestamp.isBefore(latest)) {
                log.debug("Dropping stale signal update for session {}: {} is before {}", sessionId, timestamp, latest);
                return;
            }
            applySignal(session, runtime.outbox, update, timestamp, now);
        } finally {
            runtime.lock.unlock();
        }
        runtime.outbox.drain();
    }

    private void applySignal(
            LearningSession session, SessionOutbox outbox, SignalUpdate update, LocalDateTime timestamp, LocalDateTime now) {
        String sessionId = session.getId();
        double level = clampLogged(sessionId, update.getLevel());

        session.recordSample(timestamp, level);
        session.touch(now);
        session.incrementMetric(METRIC_SIGNAL_UPDATES);
        session.updateMetricEma(METRIC_ENGAGEMENT, level);

        LearningMode previousMode = session.getMode();
        LearningMode mode = SignalClassifier.classifyMode(level);
        if (mode != previousMode) {
            ModeParameters parameters = strategyTable.parametersFor(mode);
            session.changeMode(mode);
            session.replaceActiveParameters(parameters.tunables());
            Map<String, Object> values = parameters.toParameterMap();
            values.put(AdaptationStrategyTable.TARGET_DIFFICULTY, refreshTargetDifficulty(session));
            Adaptation adaptation = appendAdaptation(
                    session, AdaptationKind.MODE_CHANGE, previousMode.name(), mode.name(), level, values, now);
            log.info("Session {} mode {} -> {} at level {}", sessionId, previousMode, mode, level);
            outbox.enqueue(() -> eventPublisherHelper.publishAdaptation(this, adaptation));
        }

        CognitiveState previousState = session.getCognitiveState();
        CognitiveState state = SignalClassifier.classifyCognitiveState(level, update.activitiesOrEmpty());
        if (state != previousState) {
            CognitiveAdjustment adjustment = strategyTable.adjustmentFor(state);
            session.changeCognitiveState(state);
            Map<String, Object> values = adjustment.toParameterMap();
            values.put(AdaptationStrategyTable.TARGET_DIFFICULTY, refreshTargetDifficulty(session));
            Adaptation adaptation = appendAdaptation(
                    session, AdaptationKind.COGNITIVE_CHANGE, previousState.name(), state.name(), level, values, now);
            log.info("Session {} cognitive state {} -> {} ({})", sessionId, previousState, state, adjustment.getAction());
            outbox.enqueue(() -> eventPublisherHelper.publishAdaptation(this, adaptation));
        }

        Optional<BreakthroughOpportunity> opportunity = breakthroughDetector.evaluate(sessionId, level, timestamp);
        if (opportunity.isPresent()) {
            Map<String, Object> values = new LinkedHashMap<>();
            values.put(AdaptationStrategyTable.TARGET_DIFFICULTY, strategyTable.targetDifficulty(level));
            values.put(
                    ModeParameters.CONTENT_TYPES,
                    strategyTable.parametersFor(LearningMode.BREAKTHROUGH).getContentTypes().stream()
                            .map(Enum::name)
                            .toList());
            appendAdaptation(session, AdaptationKind.BREAKTHROUGH, null, null, level, values, now);
            session.incrementMetric(METRIC_BREAKTHROUGHS);
            log.info("Session {} breakthrough at level {}", sessionId, level);
            BreakthroughOpportunity breakthrough = opportunity.get();
            outbox.enqueue(() -> eventPublisherHelper.publishBreakthrough(this, breakthrough));
        }
    }

    // ========================
    // PERIODIC TICK
    // ========================

    /**
     * Runs one effectiveness review for the session and schedules the next one.
     *
     * <p>Never throws: a failed review is logged, counted, and retried with backoff.
     * A tick for an unknown or ended session does nothing.
     */
    public void periodicTick(String sessionId) {
        SessionRuntime runtime = runtimes.get(sessionId);
        Optional<LearningSession> found = sessionStore.find(sessionId);
        if (runtime == null || found.isEmpty()) {
            log.debug("Skipping tick for unknown or ended session {}", sessionId);
            return;
        }

        long startNanos = System.nanoTime();
        if (!tryLock(runtime)) {
            onTickFailure(
                    sessionId,
                    runtime,
                    new TransientProcessingFailureException(
                            "Timed out after " + sessionEngineConfig.getTickTimeout() + " waiting for session lock"));
            return;
        }

        LearningSession session = found.get();
        try {
            if (session.isEnded()) {
                return;
            }
            EffectivenessReview review = reviewSession(session, runtime.outbox);
            runtime.tickFailures.set(0);
            scheduleNextTick(sessionId, runtime, sessionEngineConfig.getTickInterval());
            long durationNanos = System.nanoTime() - startNanos;
            runtime.outbox.enqueue(
                    () -> eventPublisherHelper.publishSessionReviewed(this, sessionId, review, durationNanos));
        } catch (RuntimeException e) {
            onTickFailure(sessionId, runtime, e);
        } finally {
            runtime.lock.unlock();
        }
        runtime.outbox.drain();
    }

    private EffectivenessReview reviewSession(LearningSession session, SessionOutbox outbox) {
        LocalDateTime now = LocalDateTime.now(clock);
        EffectivenessReview review =
                effectivenessReviewer.review(session.getTrajectory(), session.getActiveParameters());

        if (review.hasNudges()) {
            review.nudges().forEach(session::setActiveParameter);
            Map<String, Object> values = new LinkedHashMap<>(review.nudges());
            values.put(METRIC_EFFECTIVENESS, review.effectiveness());
            values.put("slope", review.slope());
            Adaptation adaptation = appendAdaptation(
                    session, AdaptationKind.OPTIMIZATION, null, null, session.getSignalLevel(), values, now);
            log.debug("Session {} optimized: {}", session.getId(), review.nudges());
            outbox.enqueue(() -> eventPublisherHelper.publishAdaptation(this, adaptation));
        }

        session.updateMetricEma(METRIC_EFFECTIVENESS, review.effectiveness());
        session.updateMetricEma(METRIC_STABILITY, review.stability());
        backfillFromScorer(session);
        return review;
    }

    private void backfillFromScorer(LearningSession session) {
        SessionSnapshot snapshot = session.toSnapshot();
        for (Adaptation adaptation : snapshot.getAdaptations()) {
            if (adaptation.getEffectivenessScore() != 0.0) {
                continue;
            }
            try {
                OptionalDouble score = effectivenessScorer.score(snapshot, adaptation);
                if (score.isPresent() && Double.isFinite(score.getAsDouble())) {
                    session.replaceAdaptation(
                            adaptation.withEffectivenessScore(SignalClassifier.clamp(score.getAsDouble())));
                }
            } catch (RuntimeException e) {
                TransientProcessingFailureException failure = new TransientProcessingFailureException(
                        "Effectiveness scorer failed for adaptation " + adaptation.getId(), e);
                log.warn("Session {}: {}", session.getId(), failure.getMessage(), failure);
            }
        }
    }

    private void onTickFailure(String sessionId, SessionRuntime runtime, Exception cause) {
        int failures = runtime.tickFailures.incrementAndGet();
        Duration delay = backoffDelay(
                sessionEngineConfig.getTickInterval(), sessionEngineConfig.getMaxTickBackoff(), failures);
        log.error(
                "Tick failed for session {} ({} consecutive), next attempt in {}: {}",
                sessionId, failures, delay, cause.getMessage(), cause);
        scheduleNextTick(sessionId, runtime, delay);
    }

    /**
     * Delay before the next tick after {@code failures} consecutive failures:
     * {@code min(interval * 2^failures, max)}; {@code interval} when there are none.
     */
    public static Duration backoffDelay(Duration interval, Duration max, int failures) {
        if (failures <= 0) {
            return interval;
        }
        if (failures >= 31) {
            return max;
        }
        long millis = interval.toMillis();
        long multiplier = 1L << failures;
        if (millis > max.toMillis() / multiplier) {
            return max;
        }
        return Duration.ofMillis(millis * multiplier);
    }

    private void scheduleNextTick(String sessionId, SessionRuntime runtime, Duration delay) {
        runtime.schedule(delay, () -> taskScheduler.schedule(() -> periodicTick(sessionId), Instant.now().plus(delay)));
    }

    private boolean tryLock(SessionRuntime runtime) {
        try {
            return runtime.lock.tryLock(sessionEngineConfig.getTickTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    // ========================
    // END
    // ========================

    public void end(String sessionId) {
        end(sessionId, EndReason.EXPLICIT);
    }

    /**
     * Ends a session: cancels its tick and feed subscription, marks it ENDED and moves it to
     * ended-session retention.
     *
     * <p>Ending an already-ended session is a no-op for as long as its ID is remembered
     * ({@code endedIdRetention} most recent ends), which outlasts the snapshot retention.
     *
     * @throws UnknownSessionException if the session never existed or its ID has been forgotten
     */
    public void end(String sessionId, EndReason reason) {
        SessionRuntime runtime = runtimes.get(sessionId);
        Optional<LearningSession> found = sessionStore.find(sessionId);
        if (runtime == null || found.isEmpty()) {
            if (sessionStore.isEnded(sessionId)) {
                log.debug("Session {} already ended", sessionId);
                return;
            }
            throw new UnknownSessionException(sessionId);
        }

        runtime.cancel();

        LearningSession session = found.get();
        SessionSnapshot finalState;
        runtime.lock.lock();
        try {
            if (session.isEnded()) {
                log.debug("Session {} already ended", sessionId);
                return;
            }
            session.end(LocalDateTime.now(clock), reason);
            breakthroughDetector.reset(sessionId);
            SessionSnapshot retired = sessionStore.retire(sessionId).orElseGet(session::toSnapshot);
            runtimes.remove(sessionId, runtime);
            runtime.outbox.enqueue(() -> eventPublisherHelper.publishSessionEnded(this, retired));
            finalState = retired;
        } finally {
            runtime.lock.unlock();
        }

        log.info(
                "Session {} ended ({}): {} samples, {} adaptations",
                sessionId, reason, finalState.getTrajectory().size(), finalState.getAdaptations().size());
        runtime.outbox.drain();
    }

    /**
     * Ends every live session with the given reason.
     *
     * @return number of sessions this call ended
     */
    public int endAll(EndReason reason) {
        List<String> sessionIds = new ArrayList<>(runtimes.keySet());
        int ended = 0;
        for (String sessionId : sessionIds) {
            try {
                end(sessionId, reason);
                ended++;
            } catch (UnknownSessionException e) {
                log.debug("Session {} disappeared before it could be ended: {}", sessionId, e.getMessage());
            }
        }
        if (ended > 0) {
            log.info("Ended {} sessions ({})", ended, reason);
        }
        return ended;
    }

    // ========================
    // QUERIES & BACK-FILL
    // ========================

    /**
     * Returns a deep copy of the session, live or retained after end.
     *
     * @throws UnknownSessionException if the ID is neither live nor retained
     */
    public SessionSnapshot getSnapshot(String sessionId) {
        SessionRuntime runtime = runtimes.get(sessionId);
        Optional<LearningSession> found = sessionStore.find(sessionId);
        if (runtime != null && found.isPresent()) {
            runtime.lock.lock();
            try {
                return found.get().toSnapshot();
            } finally {
                runtime.lock.unlock();
            }
        }
        return sessionStore.findEnded(sessionId).orElseThrow(() -> new UnknownSessionException(sessionId));
    }

    /**
     * Writes an effectiveness score onto one adaptation of a live session. The score is clamped
     * to [0, 1]; position and timestamp of the record are kept.
     *
     * @return false if the session is not live or has no adaptation with that ID
     * @throws InvalidInputException if the score is not a finite number
     */
    public boolean backfillEffectiveness(String sessionId, String adaptationId, double score) {
        if (!Double.isFinite(score)) {
            throw new InvalidInputException("Effectiveness score must be a finite number");
        }
        SessionRuntime runtime = runtimes.get(sessionId);
        Optional<LearningSession> found = sessionStore.find(sessionId);
        if (runtime == null || found.isEmpty()) {
            return false;
        }

        LearningSession session = found.get();
        runtime.lock.lock();
        try {
            if (session.isEnded()) {
                return false;
            }
            return session.getAdaptations().stream()
                    .filter(adaptation -> adaptation.getId().equals(adaptationId))
                    .findFirst()
                    .map(adaptation -> session.replaceAdaptation(
                            adaptation.withEffectivenessScore(SignalClassifier.clamp(score))))
                    .orElse(false);
        } finally {
            runtime.lock.unlock();
        }
    }

    /**
     * Snapshots of every live session, each taken under its own lock. A session that ends
     * while this runs is left out; it is already in ended-session retention by then.
     */
    public List<SessionSnapshot> liveSnapshots() {
        List<SessionSnapshot> snapshots = new ArrayList<>();
        for (Map.Entry<String, SessionRuntime> entry : runtimes.entrySet()) {
            Optional<LearningSession> found = sessionStore.find(entry.getKey());
            if (found.isEmpty()) {
                continue;
            }
            SessionRuntime runtime = entry.getValue();
            runtime.lock.lock();
            try {
                if (!found.get().isEnded()) {
                    snapshots.add(found.get().toSnapshot());
                }
            } finally {
                runtime.lock.unlock();
            }
        }
        return snapshots;
    }

    public int activeSessionCount() {
        return runtimes.size();
    }

    /** Delay used for the most recently scheduled tick of a live session. */
    public Optional<Duration> nextTickDelay(String sessionId) {
        SessionRuntime runtime = runtimes.get(sessionId);
        return runtime != null ? Optional.ofNullable(runtime.lastDelay()) : Optional.empty();
    }

    public int consecutiveTickFailures(String sessionId) {
        SessionRuntime runtime = runtimes.get(sessionId);
        return runtime != null ? runtime.tickFailures.get() : 0;
    }

    // ========================
    // LIFECYCLE
    // ========================

    @Override
    public void start() {
        running.set(true);
        log.info("SessionEngine started");
    }

    @Override
    public void stop() {
        try {
            endAll(EndReason.SHUTDOWN);
        } catch (RuntimeException e) {
            log.error("Error ending sessions on shutdown", e);
        } finally {
            running.set(false);
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE - 1;
    }

    // ========================
    // INTERNALS
    // ========================

    private Adaptation appendAdaptation(
            LearningSession session,
            AdaptationKind kind,
            String fromValue,
            String toValue,
            double triggerLevel,
            Map<String, Object> parameters,
            LocalDateTime now) {
        Adaptation adaptation = Adaptation.builder()
                .id(UUID.randomUUID().toString())
                .sessionId(session.getId())
                .kind(kind)
                .fromValue(fromValue)
                .toValue(toValue)
                .triggerLevel(triggerLevel)
                .parameters(Map.copyOf(parameters))
                .effectivenessScore(0.0)
                .timestamp(session.nextAdaptationTimestamp(now))
                .build();
        session.appendAdaptation(adaptation);
        session.incrementMetric(METRIC_ADAPTATIONS);
        return adaptation;
    }

    /**
     * Target difficulty for the current level, shifted by the current cognitive state's
     * complexity delta. Recomputed from scratch so repeated changes never accumulate.
     */
    private double refreshTargetDifficulty(LearningSession session) {
        double base = strategyTable.targetDifficulty(session.getSignalLevel());
        double delta = strategyTable.adjustmentFor(session.getCognitiveState()).getComplexityDelta();
        double target = SignalClassifier.clamp(base + delta);
        session.setActiveParameter(AdaptationStrategyTable.TARGET_DIFFICULTY, target);
        return target;
    }

    private static LocalDateTime resolveTimestamp(LocalDateTime requested, LocalDateTime now, LocalDateTime latest) {
        if (requested != null) {
            return requested;
        }
        return latest != null && now.isBefore(latest) ? latest : now;
    }

    private static double clampLogged(String sessionId, double level) {
        double clamped = SignalClassifier.clamp(level);
        if (clamped != level) {
            log.warn("Signal level {} for session {} clamped to {}", level, sessionId, clamped);
        }
        return clamped;
    }

    /**
     * Per-session runtime handles. The schedule/cancel pair is synchronized on the runtime so
     * that a tick can never be scheduled after {@link #cancel()} has run.
     */
    static final class SessionRuntime {

        final ReentrantLock lock = new ReentrantLock();
        final SessionOutbox outbox = new SessionOutbox();
        final AtomicInteger tickFailures = new AtomicInteger();

        private ScheduledFuture<?> nextTick;
        private Duration lastDelay;
        private FeedSubscription subscription;
        private boolean cancelled;

        synchronized void attach(FeedSubscription subscription) {
            if (cancelled) {
                subscription.cancel();
                return;
            }
            this.subscription = subscription;
        }

        synchronized void schedule(Duration delay, Supplier<ScheduledFuture<?>> scheduler) {
            if (cancelled) {
                return;
            }
            if (nextTick != null && !nextTick.isDone()) {
                nextTick.cancel(false);
            }
            nextTick = scheduler.get();
            lastDelay = delay;
        }

        synchronized Duration lastDelay() {
            return lastDelay;
        }

        synchronized void cancel() {
            cancelled = true;
            if (nextTick != null) {
                nextTick.cancel(false);
            }
            if (subscription != null) {
                subscription.cancel();
            }
        }
    }
}
