package com.adaptivetutor.config;

import com.adaptivetutor.domain.enums.AdaptationKind;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.config.MeterFilter;
import jakarta.annotation.PostConstruct;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

/**
 * Registry-wide meter settings: the {@code application} tag on every meter, and a cap on the
 * {@code kind} tag of {@code adaptations.emitted} so a new adaptation kind cannot grow the tag set
 * unnoticed. Session meters themselves live in
 * {@link com.adaptivetutor.observability.SessionMetricsAggregator}.
 */
@Configuration
public class MetricsConfig {

    private final MeterRegistry meterRegistry;
    private final String applicationName;

    public MetricsConfig(
            MeterRegistry meterRegistry,
            @Value("${spring.application.name:adaptive-session-engine}") String applicationName) {
        this.meterRegistry = meterRegistry;
        this.applicationName = applicationName;
    }

    @PostConstruct
    void configureRegistry() {
        meterRegistry
                .config()
                .commonTags("application", applicationName)
                .meterFilter(MeterFilter.maximumAllowableTags(
                        "adaptations.emitted", "kind", AdaptationKind.values().length, MeterFilter.deny()));
    }
}
