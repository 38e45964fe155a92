package com.example.workflowcompiler.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One node in a workflow graph. {@code config} is the opaque per-variant payload; it is parsed into a
 * typed {@link com.example.workflowcompiler.model.config.NodeConfig} during validation.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record WorkflowNode(
        String id,
        @JsonProperty("node_type") NodeType nodeType,
        String label,
        Map<String, Object> config,
        Position position,
        RetryPolicy retries
) {
    public WorkflowNode {
        if (config == null) {
            config = Map.of();
        } else {
            // JSON nulls are treated as absent keys
            Map<String, Object> copy = new LinkedHashMap<>(config);
            copy.values().removeIf(Objects::isNull);
            config = Collections.unmodifiableMap(copy);
        }
    }

    public WorkflowNode(String id, NodeType nodeType, String label) {
        this(id, nodeType, label, Map.of(), null, null);
    }
}
