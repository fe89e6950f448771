package com.adaptivetutor.api.dto.response;

import com.adaptivetutor.exception.ErrorCode;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.Map;

/**
 * Error envelope returned by every session endpoint when a request fails.
 * Successful calls return their DTO directly.
 */
public record ApiErrorResponse(boolean success, Failure error) {

    public static ApiErrorResponse of(ErrorCode errorCode, String message, Map<String, Object> details, String path) {
        Map<String, Object> safeDetails = details == null || details.isEmpty() ? null : Map.copyOf(details);
        return new ApiErrorResponse(
                false, new Failure(errorCode.getCode(), message, safeDetails, Instant.now(), path));
    }

    /** {@code details} is omitted when there is nothing field-specific to report. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Failure(String code, String message, Map<String, Object> details, Instant timestamp, String path) {}
}
