package com.example.workflowcompiler.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Workflow variable: becomes a field of the generated workflow input.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Variable(
        String name,
        @JsonProperty("var_type") String varType,
        @JsonProperty("default_value") Object defaultValue
) {}
