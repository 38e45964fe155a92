package com.example.workflowcompiler.model.config;

import java.time.Duration;

/**
 * Parsed retry policy. {@code maxAttempts == 0} means unlimited, as on the target runtime.
 */
public record RetrySettings(
        int maxAttempts,
        Duration initialInterval,
        Duration maxInterval,
        double backoffCoefficient
) {}
