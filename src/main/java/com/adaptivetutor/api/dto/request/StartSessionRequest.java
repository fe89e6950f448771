package com.adaptivetutor.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for starting an adaptive learning session.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StartSessionRequest {

    @NotBlank(message = "userId is required")
    private String userId;

    @NotBlank(message = "lessonId is required")
    private String lessonId;

    /** Starting engagement level. Values outside [0, 1] are clamped by the engine. */
    @NotNull(message = "initialSignal is required")
    private Double initialSignal;
}
