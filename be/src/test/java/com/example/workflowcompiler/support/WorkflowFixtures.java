package com.example.workflowcompiler.support;

import com.example.workflowcompiler.model.NodeType;
import com.example.workflowcompiler.model.RetryPolicy;
import com.example.workflowcompiler.model.Trigger;
import com.example.workflowcompiler.model.TriggerType;
import com.example.workflowcompiler.model.Variable;
import com.example.workflowcompiler.model.WorkflowDefinition;
import com.example.workflowcompiler.model.WorkflowEdge;
import com.example.workflowcompiler.model.WorkflowNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Builders for workflow definitions used across tests.
 */
public final class WorkflowFixtures {

    private WorkflowFixtures() {
    }

    public static Builder workflow(String name) {
        return new Builder(name);
    }

    /** Start → "Send Email" → decision amount > 100 → "Escalate" / default "Approve" → End. */
    public static WorkflowDefinition orderApproval() {
        return workflow("Order Approval")
                .variable("amount", "number", 150)
                .node("start", NodeType.START, "Start")
                .node("email", NodeType.ACTIVITY, "Send Email")
                .node("check", NodeType.DECISION, "Check Amount")
                .node("escalate", NodeType.ACTIVITY, "Escalate")
                .node("approve", NodeType.ACTIVITY, "Approve")
                .node("end", NodeType.END, "End")
                .edge("start", "email")
                .edge("email", "check")
                .conditionalEdge("check", "escalate", "amount>100")
                .edge("check", "approve")
                .edge("escalate", "end")
                .edge("approve", "end")
                .build();
    }

    /** Start → gateway → (A, B) → join → End. */
    public static WorkflowDefinition forkJoin() {
        return workflow("Fork Join")
                .node("start", NodeType.START, "Start")
                .node("fork", NodeType.PARALLEL_GATEWAY, "Split")
                .node("a", NodeType.ACTIVITY, "Left")
                .node("b", NodeType.HTTP_CALL, "Right", Map.of("url", "https://example.com"))
                .node("join", NodeType.PARALLEL_JOIN, "Merge")
                .node("end", NodeType.END, "End")
                .edge("start", "fork")
                .edge("fork", "a")
                .edge("fork", "b")
                .edge("a", "join")
                .edge("b", "join")
                .edge("join", "end")
                .build();
    }

    public static final class Builder {

        private final String name;
        private final List<WorkflowNode> nodes = new ArrayList<>();
        private final List<WorkflowEdge> edges = new ArrayList<>();
        private final List<Variable> variables = new ArrayList<>();
        private final List<Trigger> triggers = new ArrayList<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder node(String id, NodeType type, String label) {
            return node(id, type, label, Map.of());
        }

        public Builder node(String id, NodeType type, String label, Map<String, Object> config) {
            nodes.add(new WorkflowNode(id, type, label, config, null, null));
            return this;
        }

        public Builder node(String id, NodeType type, String label, Map<String, Object> config, RetryPolicy retries) {
            nodes.add(new WorkflowNode(id, type, label, config, null, retries));
            return this;
        }

        public Builder edge(String source, String target) {
            return edge("e" + (edges.size() + 1), source, target, null);
        }

        public Builder conditionalEdge(String source, String target, String condition) {
            return edge("e" + (edges.size() + 1), source, target, condition);
        }

        public Builder edge(String id, String source, String target, String condition) {
            edges.add(new WorkflowEdge(id, source, target, condition, null));
            return this;
        }

        public Builder variable(String variableName, String type, Object defaultValue) {
            variables.add(new Variable(variableName, type, defaultValue));
            return this;
        }

        public Builder trigger(TriggerType type, Map<String, Object> config) {
            triggers.add(new Trigger(type, config));
            return this;
        }

        public WorkflowDefinition build() {
            return new WorkflowDefinition(UUID.nameUUIDFromBytes(name.getBytes()), name, "1.0.0", null,
                    nodes, edges, variables, triggers);
        }
    }
}
