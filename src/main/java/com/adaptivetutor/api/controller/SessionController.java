package com.adaptivetutor.api.controller;

import com.adaptivetutor.adaptation.AdaptationStrategyTable;
import com.adaptivetutor.adaptation.CognitiveAdjustment;
import com.adaptivetutor.adaptation.ModeParameters;
import com.adaptivetutor.api.dto.request.SignalUpdateRequest;
import com.adaptivetutor.api.dto.request.StartSessionRequest;
import com.adaptivetutor.api.dto.response.RecommendationResponse;
import com.adaptivetutor.api.dto.response.StartSessionResponse;
import com.adaptivetutor.core.engine.SessionEngine;
import com.adaptivetutor.domain.model.MetricsSnapshot;
import com.adaptivetutor.domain.model.SessionSnapshot;
import com.adaptivetutor.domain.model.SignalUpdate;
import com.adaptivetutor.event.EventPublisherHelper;
import com.adaptivetutor.observability.SessionMetricsAggregator;
import com.adaptivetutor.reporting.SessionAnalyticsCalculator;
import com.adaptivetutor.reporting.SessionAnalyticsReport;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for the adaptive session lifecycle.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code POST /api/sessions} -- start a session</li>
 *   <li>{@code GET /api/sessions/{id}} -- snapshot of a live or recently ended session</li>
 *   <li>{@code DELETE /api/sessions/{id}} -- end a session (no-op if already ended)</li>
 *   <li>{@code POST /api/sessions/{id}/signals} -- push an engagement signal onto the feed</li>
 *   <li>{@code GET /api/sessions/{id}/recommendations} -- content and pacing for the current state</li>
 *   <li>{@code GET /api/sessions/metrics} -- cross-session metrics</li>
 *   <li>{@code GET /api/sessions/analytics?userId=} -- learning analytics for one user, or all users</li>
 * </ul>
 *
 * <p>Signals go through the event feed like any other transport, so a signal for an unknown or
 * ended session is accepted and dropped.
 */
@RestController
@RequestMapping("/api/sessions")
public class SessionController {

    private final SessionEngine sessionEngine;
    private final SessionMetricsAggregator sessionMetricsAggregator;
    private final AdaptationStrategyTable strategyTable;
    private final EventPublisherHelper eventPublisherHelper;
    private final SessionAnalyticsCalculator sessionAnalyticsCalculator;

    public SessionController(
            SessionEngine sessionEngine,
            SessionMetricsAggregator sessionMetricsAggregator,
            AdaptationStrategyTable strategyTable,
            EventPublisherHelper eventPublisherHelper,
            SessionAnalyticsCalculator sessionAnalyticsCalculator) {
        this.sessionEngine = sessionEngine;
        this.sessionMetricsAggregator = sessionMetricsAggregator;
        this.strategyTable = strategyTable;
        this.eventPublisherHelper = eventPublisherHelper;
        this.sessionAnalyticsCalculator = sessionAnalyticsCalculator;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public StartSessionResponse startSession(@RequestBody @Valid StartSessionRequest request) {
        String sessionId =
                sessionEngine.start(request.getUserId(), request.getLessonId(), request.getInitialSignal());
        return new StartSessionResponse(sessionId);
    }

    @GetMapping("/metrics")
    public MetricsSnapshot getMetrics() {
        return sessionMetricsAggregator.snapshot();
    }

    @GetMapping("/analytics")
    public SessionAnalyticsReport getAnalytics(@RequestParam(required = false) String userId) {
        return sessionAnalyticsCalculator.calculate(userId == null || userId.isBlank() ? null : userId);
    }

    @GetMapping("/{id}")
    public SessionSnapshot getSession(@PathVariable String id) {
        return sessionEngine.getSnapshot(id);
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void endSession(@PathVariable String id) {
        sessionEngine.end(id);
    }

    @PostMapping("/{id}/signals")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public void pushSignal(@PathVariable String id, @RequestBody @Valid SignalUpdateRequest request) {
        SignalUpdate update = SignalUpdate.builder()
                .sessionId(id)
                .level(request.getLevel())
                .activities(request.getActivities())
                .timestamp(request.getTimestamp())
                .build();
        eventPublisherHelper.publishSignalUpdate(this, update);
    }

    @GetMapping("/{id}/recommendations")
    public RecommendationResponse getRecommendations(@PathVariable String id) {
        SessionSnapshot snapshot = sessionEngine.getSnapshot(id);
        ModeParameters parameters = strategyTable.parametersFor(snapshot.getMode());
        CognitiveAdjustment adjustment = strategyTable.adjustmentFor(snapshot.getCognitiveState());
        double targetDifficulty = snapshot.getActiveParameters()
                .getOrDefault(
                        AdaptationStrategyTable.TARGET_DIFFICULTY,
                        strategyTable.targetDifficulty(snapshot.getSignalLevel()));

        return RecommendationResponse.builder()
                .sessionId(snapshot.getId())
                .mode(snapshot.getMode())
                .cognitiveState(snapshot.getCognitiveState())
                .contentTypes(parameters.getContentTypes())
                .activeParameters(snapshot.getActiveParameters())
                .cognitiveAction(adjustment.getAction())
                .sessionDurationMinutes(parameters.getSessionDurationMinutes())
                .shortBreakMinutes(adjustment.getShortBreakMinutes())
                .longBreakMinutes(adjustment.getLongBreakMinutes())
                .targetDifficulty(targetDifficulty)
                .build();
    }
}
