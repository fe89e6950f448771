package com.adaptivetutor.exception;

/**
 * A processing step failed because of a downstream dependency (event listener,
 * effectiveness scorer, lock timeout). The session stays alive; the step is retried
 * on the next event or tick.
 */
public class TransientProcessingFailureException extends BaseException {

    public TransientProcessingFailureException(String message) {
        super(ErrorCode.TRANSIENT_FAILURE, message);
    }

    public TransientProcessingFailureException(String message, Throwable cause) {
        super(ErrorCode.TRANSIENT_FAILURE, message, cause);
    }
}
