package com.adaptivetutor.config;

import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Thread pool for per-session periodic ticks, plus the clock every time-based rule reads.
 *
 * <p>All sessions share one scheduler; per-session serialization is the engine's job
 * (session lock), not the pool's.
 */
@Configuration
@EnableConfigurationProperties(SessionEngineConfig.class)
public class SchedulerConfig {

    private static final Logger log = LoggerFactory.getLogger(SchedulerConfig.class);

    @Bean("sessionTickScheduler")
    public ThreadPoolTaskScheduler sessionTickScheduler(SessionEngineConfig sessionEngineConfig) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(sessionEngineConfig.getSchedulerPoolSize());
        scheduler.setThreadNamePrefix("session-tick-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(10);
        scheduler.setErrorHandler(throwable -> log.error("Uncaught error in session tick: {}", throwable.getMessage(), throwable));
        return scheduler;
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
