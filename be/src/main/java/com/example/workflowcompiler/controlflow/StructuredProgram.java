package com.example.workflowcompiler.controlflow;

import java.util.ArrayList;
import java.util.List;

/**
 * The workflow graph rewritten as a tree of structured control flow, ready for the emitters.
 *
 * @param workflowName display name of the workflow
 * @param entryPoint   identifier of the generated workflow function
 * @param packageName  package of the generated sources
 * @param variables    workflow variables in declaration order
 * @param body         code run after the start node
 */
public record StructuredProgram(
        String workflowName,
        String entryPoint,
        String packageName,
        List<ProgramVariable> variables,
        Sequence body
) {
    public StructuredProgram {
        variables = List.copyOf(variables);
    }

    /** All steps in tree order: sequence order, decision arms before the default, fork branches in order. */
    public List<StepDescriptor> steps() {
        List<StepDescriptor> steps = new ArrayList<>();
        collect(body, steps);
        return steps;
    }

    public List<Fork> forks() {
        List<Fork> forks = new ArrayList<>();
        collectForks(body, forks);
        return forks;
    }

    private static void collect(Sequence sequence, List<StepDescriptor> steps) {
        for (ControlNode node : sequence.items()) {
            if (node instanceof Step step) {
                steps.add(step.descriptor());
            } else if (node instanceof Branch branch) {
                for (ConditionalArm arm : branch.arms()) {
                    collect(arm.body(), steps);
                }
                if (branch.hasDefault()) {
                    collect(branch.defaultArm(), steps);
                }
            } else if (node instanceof Fork fork) {
                for (Sequence branch : fork.branches()) {
                    collect(branch, steps);
                }
            }
        }
    }

    private static void collectForks(Sequence sequence, List<Fork> forks) {
        for (ControlNode node : sequence.items()) {
            if (node instanceof Branch branch) {
                for (ConditionalArm arm : branch.arms()) {
                    collectForks(arm.body(), forks);
                }
                if (branch.hasDefault()) {
                    collectForks(branch.defaultArm(), forks);
                }
            } else if (node instanceof Fork fork) {
                forks.add(fork);
                for (Sequence branch : fork.branches()) {
                    collectForks(branch, forks);
                }
            }
        }
    }
}
