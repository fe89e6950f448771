package com.adaptivetutor.exception;

import java.util.Map;

/**
 * Raised for input that cannot be interpreted at all: an undefined or non-finite signal
 * level, or a blank user/lesson identifier. Out-of-range but finite levels are clamped,
 * never rejected.
 */
public class InvalidInputException extends BaseException {

    public InvalidInputException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
    }

    public InvalidInputException(String message, Map<String, Object> details) {
        super(ErrorCode.VALIDATION_ERROR, message, details);
    }
}
