package com.example.workflowcompiler.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Control transfer between two nodes. Only edges leaving a decision may carry a condition.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record WorkflowEdge(
        String id,
        String source,
        String target,
        String condition,
        String label
) {

    public boolean hasCondition() {
        return condition != null && !condition.isBlank();
    }
}
