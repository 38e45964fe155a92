package com.example.workflowcompiler.controlflow;

import java.util.List;

/**
 * A parallel gateway and its matching join. Branches run concurrently; execution continues after all of
 * them have completed.
 */
public record Fork(String gatewayId, String joinId, String identifier, String label, List<Sequence> branches)
        implements ControlNode {
    public Fork {
        branches = List.copyOf(branches);
    }
}
