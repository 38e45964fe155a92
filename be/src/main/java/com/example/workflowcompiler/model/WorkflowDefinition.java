package com.example.workflowcompiler.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.UUID;

/**
 * Workflow definition as produced by the visual editor.
 * <p>
 * Immutable input to one compile invocation. Collections are copied defensively and never null.
 * </p>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record WorkflowDefinition(
        UUID id,
        String name,
        String version,
        String description,
        List<WorkflowNode> nodes,
        List<WorkflowEdge> edges,
        List<Variable> variables,
        List<Trigger> triggers
) {
    public WorkflowDefinition {
        nodes = nodes != null ? List.copyOf(nodes) : List.of();
        edges = edges != null ? List.copyOf(edges) : List.of();
        variables = variables != null ? List.copyOf(variables) : List.of();
        triggers = triggers != null ? List.copyOf(triggers) : List.of();
    }

    /** Same identity, variables and triggers with a different graph. */
    public WorkflowDefinition withGraph(List<WorkflowNode> newNodes, List<WorkflowEdge> newEdges) {
        return new WorkflowDefinition(id, name, version, description, newNodes, newEdges, variables, triggers);
    }
}
