package com.example.workflowcompiler.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum TriggerType {
    @JsonProperty("manual") MANUAL,
    @JsonProperty("schedule") SCHEDULE,
    @JsonProperty("webhook") WEBHOOK,
    @JsonProperty("event") EVENT
}
