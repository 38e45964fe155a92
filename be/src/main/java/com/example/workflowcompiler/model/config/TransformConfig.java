package com.example.workflowcompiler.model.config;

import java.time.Duration;
import java.util.SortedMap;

/**
 * Data transformation, run as a local activity. {@code mappings} is target variable to source variable.
 */
public record TransformConfig(String expression, SortedMap<String, String> mappings) implements WorkConfig {

    @Override
    public Duration timeout() {
        return null;
    }
}
