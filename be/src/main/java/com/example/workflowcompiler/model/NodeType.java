package com.example.workflowcompiler.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.EnumSet;
import java.util.Set;

/**
 * Variant tag of a workflow node. The JSON names are part of the editor contract and must not change.
 */
public enum NodeType {

    @JsonProperty("start") START,
    @JsonProperty("end") END,
    @JsonProperty("activity") ACTIVITY,
    @JsonProperty("decision") DECISION,
    @JsonProperty("parallel_gateway") PARALLEL_GATEWAY,
    @JsonProperty("parallel_join") PARALLEL_JOIN,
    @JsonProperty("wait_timer") WAIT_TIMER,
    @JsonProperty("wait_signal") WAIT_SIGNAL,
    @JsonProperty("sub_workflow") SUB_WORKFLOW,
    @JsonProperty("http_call") HTTP_CALL,
    @JsonProperty("database_query") DATABASE_QUERY,
    @JsonProperty("transform") TRANSFORM,
    @JsonProperty("notification") NOTIFICATION;

    private static final Set<NodeType> WORK = EnumSet.of(ACTIVITY, HTTP_CALL, DATABASE_QUERY, NOTIFICATION, TRANSFORM);
    private static final Set<NodeType> WAIT = EnumSet.of(WAIT_TIMER, WAIT_SIGNAL);
    private static final Set<NodeType> CONTROL = EnumSet.of(START, END, DECISION, PARALLEL_GATEWAY, PARALLEL_JOIN);

    /** Performs external work through an activity; retry policies only apply here. */
    public boolean isWork() {
        return WORK.contains(this);
    }

    public boolean isWait() {
        return WAIT.contains(this);
    }

    public boolean isControl() {
        return CONTROL.contains(this);
    }

    /** Nodes that may have more than one outgoing edge. */
    public boolean isBranching() {
        return this == DECISION || this == PARALLEL_GATEWAY;
    }
}
