package com.example.workflowcompiler.optimizer;

import java.util.List;

/**
 * A run of work or sub-workflow nodes connected by single edges, with no branching, joining or waiting
 * in between. The control-flow builder emits a chain as consecutive steps without re-examining each link.
 */
public record LinearChain(List<String> nodeIds) {
    public LinearChain {
        nodeIds = List.copyOf(nodeIds);
        if (nodeIds.size() < 2) {
            throw new IllegalArgumentException("a chain has at least two nodes");
        }
    }

    public String head() {
        return nodeIds.get(0);
    }

    public String tail() {
        return nodeIds.get(nodeIds.size() - 1);
    }
}
