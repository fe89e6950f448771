package com.adaptivetutor.domain.model;

import java.time.LocalDateTime;

/**
 * One point of a session's signal trajectory.
 */
public record TrajectorySample(LocalDateTime timestamp, double level) {}
