package com.example.workflowcompiler.optimizer;

import com.example.workflowcompiler.model.WorkflowDefinition;

import java.util.List;

/**
 * Result of {@link WorkflowOptimizer#optimize}: the rewritten definition and the chain hints found in it.
 */
public record OptimizedWorkflow(WorkflowDefinition definition, List<LinearChain> chains) {
    public OptimizedWorkflow {
        chains = List.copyOf(chains);
    }
}
