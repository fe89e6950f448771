package com.adaptivetutor.config;

import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the session engine under the {@code adaptive-session} prefix.
 *
 * <ul>
 *   <li>{@code tickInterval} -- period of each session's effectiveness review (default 10s)</li>
 *   <li>{@code tickTimeout} -- how long a tick waits for the session lock before counting as failed</li>
 *   <li>{@code maxTickBackoff} -- cap for the doubled delay after consecutive tick failures</li>
 *   <li>{@code breakthroughThreshold} / {@code breakthroughCooldown} -- breakthrough detector rule</li>
 *   <li>{@code idleTimeout} / {@code maxSessionDuration} -- automatic session end</li>
 *   <li>{@code endedRetention} -- how many ended sessions stay queryable</li>
 *   <li>{@code endedIdRetention} -- how many ended session IDs are remembered so a repeated end stays a no-op</li>
 *   <li>{@code schedulerPoolSize} -- threads running periodic ticks for all sessions</li>
 * </ul>
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "adaptive-session")
public class SessionEngineConfig {

    private Duration tickInterval = Duration.ofSeconds(10);
    private Duration tickTimeout = Duration.ofSeconds(2);
    private Duration maxTickBackoff = Duration.ofMinutes(5);
    private double breakthroughThreshold = 0.85;
    private Duration breakthroughCooldown = Duration.ofSeconds(60);
    private Duration idleTimeout = Duration.ofMinutes(30);
    private Duration maxSessionDuration = Duration.ofHours(4);
    private int endedRetention = 1000;
    private int endedIdRetention = 100_000;
    private int schedulerPoolSize = 4;
}
