package com.example.workflowcompiler.controlflow;

import java.util.List;

/**
 * A decision. Arms are tested in edge declaration order; {@code defaultArm} is the unconditioned edge and may
 * be {@code null}, in which case the generated code fails the workflow when no arm matches.
 */
public record Branch(
        String decisionId,
        String identifier,
        String label,
        List<ConditionalArm> arms,
        Sequence defaultArm
) implements ControlNode {
    public Branch {
        arms = List.copyOf(arms);
    }

    public boolean hasDefault() {
        return defaultArm != null;
    }

    /** True if every arm ends in an exit; a missing default fails the workflow and counts as terminating. */
    public boolean terminates() {
        for (ConditionalArm arm : arms) {
            if (!arm.body().terminates()) {
                return false;
            }
        }
        return defaultArm == null || defaultArm.terminates();
    }
}
