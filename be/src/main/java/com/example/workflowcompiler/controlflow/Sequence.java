package com.example.workflowcompiler.controlflow;

import java.util.List;

public record Sequence(List<ControlNode> items) implements ControlNode {
    public Sequence {
        items = List.copyOf(items);
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    /** True if control never falls through the end of this sequence. */
    public boolean terminates() {
        if (items.isEmpty()) {
            return false;
        }
        ControlNode last = items.get(items.size() - 1);
        if (last instanceof Exit) {
            return true;
        }
        if (last instanceof Branch branch) {
            return branch.terminates();
        }
        return false;
    }
}
