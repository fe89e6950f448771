package com.adaptivetutor.api.dto.request;

import jakarta.validation.constraints.NotNull;
import java.time.LocalDateTime;
import java.util.Map;
import lombok.Data;

/**
 * Request payload carrying one engagement signal for a session.
 *
 * <p>{@code activities} may hold {@code executive}, {@code memory} and {@code sensory} values;
 * missing keys count as 0.5. A missing {@code timestamp} means "now".
 */
@Data
public class SignalUpdateRequest {

    @NotNull(message = "level is required")
    private Double level;

    private Map<String, Double> activities;

    private LocalDateTime timestamp;
}
