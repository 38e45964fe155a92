package com.example.workflowcompiler.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Retry policy attached to a node. Intervals are duration strings ({@code 1s}, {@code 500ms}, {@code PT1M}).
 * Absent fields take the runtime defaults: unlimited attempts and a backoff coefficient of 2.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RetryPolicy(
        @JsonProperty("max_attempts") Integer maxAttempts,
        @JsonProperty("initial_interval") String initialInterval,
        @JsonProperty("max_interval") String maxInterval,
        @JsonProperty("backoff_coefficient") Double backoffCoefficient
) {
    public static final double DEFAULT_BACKOFF_COEFFICIENT = 2.0;

    public int maxAttemptsOrDefault() {
        return maxAttempts != null ? maxAttempts : 0;
    }

    public double backoffCoefficientOrDefault() {
        return backoffCoefficient != null ? backoffCoefficient : DEFAULT_BACKOFF_COEFFICIENT;
    }
}
