package com.adaptivetutor.reporting;

import com.adaptivetutor.domain.enums.LearningMode;
import java.util.Map;
import lombok.Builder;
import lombok.Data;

/**
 * Learning analytics over the live and retained sessions of one user, or of every user when
 * {@code userId} is null.
 *
 * <p>A session counts as completed when it was ended explicitly; timeouts and shutdown do not
 * count. {@code modeDistribution} is the fraction of sessions whose current (or final) mode is
 * each mode; modes with no sessions are omitted.
 */
@Data
@Builder
public class SessionAnalyticsReport {

    private String userId;
    private int totalSessions;
    private int activeSessions;
    private int completedSessions;
    private double completionRate;
    private double averageSignalLevel;

    /** Mean smoothed effectiveness of completed sessions; 0 for a session never reviewed. */
    private double averageEffectiveness;

    /** Pearson correlation of final level and effectiveness over completed sessions; 0 below three. */
    private double levelEffectivenessCorrelation;

    private Map<LearningMode, Double> modeDistribution;
    private long totalAdaptations;
    private long totalBreakthroughs;

    public static SessionAnalyticsReport empty(String userId) {
        return SessionAnalyticsReport.builder()
                .userId(userId)
                .modeDistribution(Map.of())
                .build();
    }
}
