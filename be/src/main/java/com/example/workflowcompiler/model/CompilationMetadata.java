package com.example.workflowcompiler.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Facts about a compiled workflow shared by all emitters and returned to the caller.
 */
public record CompilationMetadata(
        @JsonProperty("workflow_name") String workflowName,
        @JsonProperty("package_name") String packageName,
        List<String> activities,
        List<String> signals,
        List<String> queries,
        @JsonProperty("estimated_complexity") int estimatedComplexity
) {
    public CompilationMetadata {
        activities = List.copyOf(activities);
        signals = List.copyOf(signals);
        queries = List.copyOf(queries);
    }
}
