package com.example.workflowcompiler.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * How a workflow gets started. Validated but not used by code generation.
 */
public record Trigger(
        @JsonProperty("trigger_type") TriggerType triggerType,
        Map<String, Object> config
) {
    public Trigger {
        config = config != null ? config : Map.of();
    }
}
