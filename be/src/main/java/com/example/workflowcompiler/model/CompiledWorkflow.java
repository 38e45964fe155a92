package com.example.workflowcompiler.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The four generated artifacts plus metadata. Always complete: either every artifact is present or
 * no instance is created.
 */
public record CompiledWorkflow(
        @JsonProperty("workflow_code") String workflowCode,
        @JsonProperty("activity_code") String activityCode,
        @JsonProperty("worker_code") String workerCode,
        @JsonProperty("test_code") String testCode,
        CompilationMetadata metadata
) {}
