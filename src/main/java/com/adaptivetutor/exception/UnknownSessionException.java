package com.adaptivetutor.exception;

import lombok.Getter;

/**
 * Raised when a lifecycle call or snapshot request names a session ID that was never created
 * (or whose ended record has aged out of retention).
 */
@Getter
public class UnknownSessionException extends BaseException {

    private final String sessionId;

    public UnknownSessionException(String sessionId) {
        super(ErrorCode.NOT_FOUND, String.format("Session not found with identifier: %s", sessionId));
        this.sessionId = sessionId;
    }
}
