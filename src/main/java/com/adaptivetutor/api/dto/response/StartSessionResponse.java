package com.adaptivetutor.api.dto.response;

/**
 * Response for a newly started session.
 */
public record StartSessionResponse(String sessionId) {}
