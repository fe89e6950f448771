package com.adaptivetutor.reporting;

import com.adaptivetutor.core.engine.SessionEngine;
import com.adaptivetutor.domain.enums.AdaptationKind;
import com.adaptivetutor.domain.enums.EndReason;
import com.adaptivetutor.domain.enums.LearningMode;
import com.adaptivetutor.domain.enums.SessionStatus;
import com.adaptivetutor.domain.model.SessionSnapshot;
import com.adaptivetutor.session.SessionStore;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Computes per-user learning analytics across live sessions and ended sessions still in
 * retention.
 *
 * <p>Calculates: session totals, completion rate, average signal level, average effectiveness
 * of completed sessions, the level/effectiveness correlation, the learning-mode distribution,
 * and adaptation and breakthrough totals.
 *
 * <p>Ended sessions that have aged out of retention are no longer counted.
 */
@Service
public class SessionAnalyticsCalculator {

    private static final Logger log = LoggerFactory.getLogger(SessionAnalyticsCalculator.class);

    static final int MIN_CORRELATION_SAMPLES = 3;

    private final SessionEngine sessionEngine;
    private final SessionStore sessionStore;

    public SessionAnalyticsCalculator(SessionEngine sessionEngine, SessionStore sessionStore) {
        this.sessionEngine = sessionEngine;
        this.sessionStore = sessionStore;
    }

    /**
     * @param userId the user to report on, or null for every user
     * @return the report, or an empty report if the user has no live or retained session
     */
    public SessionAnalyticsReport calculate(String userId) {
        List<SessionSnapshot> sessions = collect(userId);
        if (sessions.isEmpty()) {
            return SessionAnalyticsReport.empty(userId);
        }

        int totalSessions = sessions.size();
        int activeSessions = (int) sessions.stream()
                .filter(s -> s.getStatus() == SessionStatus.ACTIVE)
                .count();
        List<SessionSnapshot> completed = sessions.stream()
                .filter(s -> s.getStatus() == SessionStatus.ENDED && s.getEndReason() == EndReason.EXPLICIT)
                .toList();

        double averageSignalLevel = sessions.stream()
                .mapToDouble(SessionSnapshot::getSignalLevel)
                .average()
                .orElse(0.0);

        double averageEffectiveness = completed.stream()
                .mapToDouble(SessionAnalyticsCalculator::effectivenessOf)
                .average()
                .orElse(0.0);

        long totalAdaptations = sessions.stream()
                .mapToLong(s -> s.getAdaptations().size())
                .sum();
        long totalBreakthroughs = sessions.stream()
                .mapToLong(s -> s.countAdaptations(AdaptationKind.BREAKTHROUGH))
                .sum();

        SessionAnalyticsReport report = SessionAnalyticsReport.builder()
                .userId(userId)
                .totalSessions(totalSessions)
                .activeSessions(activeSessions)
                .completedSessions(completed.size())
                .completionRate((double) completed.size() / totalSessions)
                .averageSignalLevel(averageSignalLevel)
                .averageEffectiveness(averageEffectiveness)
                .levelEffectivenessCorrelation(calculateCorrelation(completed))
                .modeDistribution(calculateModeDistribution(sessions))
                .totalAdaptations(totalAdaptations)
                .totalBreakthroughs(totalBreakthroughs)
                .build();

        log.debug(
                "Analytics for {}: {} sessions ({} active, {} completed), avg level {}",
                userId == null ? "all users" : userId, totalSessions, activeSessions, completed.size(),
                averageSignalLevel);
        return report;
    }

    /** Live sessions first: one that ends in between is then found in retention, never dropped. */
    private List<SessionSnapshot> collect(String userId) {
        Map<String, SessionSnapshot> byId = new LinkedHashMap<>();
        for (SessionSnapshot snapshot : sessionEngine.liveSnapshots()) {
            if (belongsTo(snapshot, userId)) {
                byId.put(snapshot.getId(), snapshot);
            }
        }
        for (SessionSnapshot snapshot : sessionStore.endedSnapshots()) {
            if (belongsTo(snapshot, userId)) {
                byId.put(snapshot.getId(), snapshot);
            }
        }
        return new ArrayList<>(byId.values());
    }

    private static boolean belongsTo(SessionSnapshot snapshot, String userId) {
        return userId == null || userId.equals(snapshot.getUserId());
    }

    private static double effectivenessOf(SessionSnapshot snapshot) {
        return snapshot.getPerformanceMetrics().getOrDefault(SessionEngine.METRIC_EFFECTIVENESS, 0.0);
    }

    /**
     * Fraction of sessions per learning mode. Iterates in enum order so the JSON is stable.
     */
    Map<LearningMode, Double> calculateModeDistribution(List<SessionSnapshot> sessions) {
        Map<LearningMode, Double> distribution = new EnumMap<>(LearningMode.class);
        for (SessionSnapshot snapshot : sessions) {
            distribution.merge(snapshot.getMode(), 1.0, Double::sum);
        }
        distribution.replaceAll((mode, count) -> count / sessions.size());
        return distribution;
    }

    /**
     * Pearson correlation between final signal level and effectiveness. Zero below
     * {@link #MIN_CORRELATION_SAMPLES} sessions or when either series is constant.
     */
    double calculateCorrelation(List<SessionSnapshot> completed) {
        int n = completed.size();
        if (n < MIN_CORRELATION_SAMPLES) {
            return 0.0;
        }
        double meanLevel = completed.stream().mapToDouble(SessionSnapshot::getSignalLevel).average().orElse(0);
        double meanEffectiveness = completed.stream()
                .mapToDouble(SessionAnalyticsCalculator::effectivenessOf)
                .average()
                .orElse(0);

        double covariance = 0;
        double levelVariance = 0;
        double effectivenessVariance = 0;
        for (SessionSnapshot snapshot : completed) {
            double dl = snapshot.getSignalLevel() - meanLevel;
            double de = effectivenessOf(snapshot) - meanEffectiveness;
            covariance += dl * de;
            levelVariance += dl * dl;
            effectivenessVariance += de * de;
        }
        if (levelVariance == 0 || effectivenessVariance == 0) {
            return 0.0;
        }
        return covariance / Math.sqrt(levelVariance * effectivenessVariance);
    }
}
