package com.adaptivetutor.domain.model;

import com.adaptivetutor.domain.enums.CognitiveState;
import com.adaptivetutor.domain.enums.EndReason;
import com.adaptivetutor.domain.enums.LearningMode;
import com.adaptivetutor.domain.enums.SessionStatus;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.Getter;

/**
 * Live state of one adaptive learning session.
 *
 * <p>Owned by the SessionStore and mutated only by the SessionEngine while it holds the
 * session's lock. Nothing outside the engine receives this object; callers get a
 * {@link SessionSnapshot} instead.
 *
 * <p>Trajectory and adaptation history are append-only. The only in-place rewrite allowed
 * is {@link #replaceAdaptation(Adaptation)}, which back-fills an effectiveness score while
 * keeping the record's position and timestamp.
 *
 * <p>{@code lastActivityAt} and {@code status} are volatile so that the timeout sweep can
 * read them without taking the session lock.
 */
@Getter
public class LearningSession {

    /** EMA weight applied to the previous metric value: new = 0.9 * old + 0.1 * observed. */
    public static final double EMA_RETAIN = 0.9;

    private final String id;
    private final String userId;
    private final String lessonId;
    private final LocalDateTime startedAt;

    private double signalLevel;
    private LearningMode mode;
    private CognitiveState cognitiveState;
    private volatile SessionStatus status = SessionStatus.ACTIVE;
    private volatile LocalDateTime lastActivityAt;
    private LocalDateTime endedAt;
    private EndReason endReason;

    private final List<TrajectorySample> trajectory = new ArrayList<>();
    private final List<Adaptation> adaptations = new ArrayList<>();
    private final Map<String, Double> performanceMetrics = new LinkedHashMap<>();
    private final Map<String, Double> activeParameters = new LinkedHashMap<>();

    public LearningSession(
            String id,
            String userId,
            String lessonId,
            double initialLevel,
            LearningMode mode,
            CognitiveState cognitiveState,
            LocalDateTime startedAt) {
        this.id = id;
        this.userId = userId;
        this.lessonId = lessonId;
        this.signalLevel = initialLevel;
        this.mode = mode;
        this.cognitiveState = cognitiveState;
        this.startedAt = startedAt;
        this.lastActivityAt = startedAt;
        this.trajectory.add(new TrajectorySample(startedAt, initialLevel));
    }

    public boolean isEnded() {
        return status == SessionStatus.ENDED;
    }

    public Optional<TrajectorySample> latestSample() {
        return trajectory.isEmpty() ? Optional.empty() : Optional.of(trajectory.get(trajectory.size() - 1));
    }

    public void recordSample(LocalDateTime timestamp, double level) {
        trajectory.add(new TrajectorySample(timestamp, level));
        this.signalLevel = level;
    }

    public void touch(LocalDateTime now) {
        this.lastActivityAt = now;
    }

    public void changeMode(LearningMode mode) {
        this.mode = mode;
    }

    public void changeCognitiveState(CognitiveState cognitiveState) {
        this.cognitiveState = cognitiveState;
    }

    /**
     * Returns the timestamp the next adaptation should carry: {@code now}, or the last
     * adaptation's timestamp if the clock has stepped backwards.
     */
    public LocalDateTime nextAdaptationTimestamp(LocalDateTime now) {
        if (adaptations.isEmpty()) {
            return now;
        }
        LocalDateTime last = adaptations.get(adaptations.size() - 1).getTimestamp();
        return now.isBefore(last) ? last : now;
    }

    public void appendAdaptation(Adaptation adaptation) {
        if (!adaptations.isEmpty()) {
            LocalDateTime last = adaptations.get(adaptations.size() - 1).getTimestamp();
            if (adaptation.getTimestamp().isBefore(last)) {
                throw new IllegalStateException("Adaptation " + adaptation.getId() + " is older than the history tail");
            }
        }
        adaptations.add(adaptation);
    }

    /**
     * Replaces the adaptation with the same ID, preserving its position in the history.
     *
     * @return true if a matching adaptation was found
     */
    public boolean replaceAdaptation(Adaptation updated) {
        for (int i = 0; i < adaptations.size(); i++) {
            if (adaptations.get(i).getId().equals(updated.getId())) {
                adaptations.set(i, updated);
                return true;
            }
        }
        return false;
    }

    public void incrementMetric(String name) {
        performanceMetrics.merge(name, 1.0, Double::sum);
    }

    /** Folds {@code observed} into the named metric; the first observation seeds it. */
    public void updateMetricEma(String name, double observed) {
        performanceMetrics.merge(name, observed, (old, value) -> EMA_RETAIN * old + (1 - EMA_RETAIN) * value);
    }

    public void replaceActiveParameters(Map<String, Double> parameters) {
        activeParameters.clear();
        activeParameters.putAll(parameters);
    }

    public void setActiveParameter(String name, double value) {
        activeParameters.put(name, value);
    }

    public void end(LocalDateTime now, EndReason reason) {
        this.status = SessionStatus.ENDED;
        this.endedAt = now;
        this.endReason = reason;
    }

    public SessionSnapshot toSnapshot() {
        return SessionSnapshot.builder()
                .id(id)
                .userId(userId)
                .lessonId(lessonId)
                .status(status)
                .signalLevel(signalLevel)
                .mode(mode)
                .cognitiveState(cognitiveState)
                .trajectory(List.copyOf(trajectory))
                .adaptations(List.copyOf(adaptations))
                .performanceMetrics(Map.copyOf(performanceMetrics))
                .activeParameters(Map.copyOf(activeParameters))
                .startedAt(startedAt)
                .lastActivityAt(lastActivityAt)
                .endedAt(endedAt)
                .endReason(endReason)
                .build();
    }
}
