package com.example.workflowcompiler.optimizer;

import com.example.workflowcompiler.model.NodeType;
import com.example.workflowcompiler.model.WorkflowDefinition;
import com.example.workflowcompiler.model.WorkflowEdge;
import com.example.workflowcompiler.model.WorkflowNode;
import com.example.workflowcompiler.support.WorkflowFixtures;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("WorkflowOptimizer")
class WorkflowOptimizerTest {

    private static List<String> nodeIds(WorkflowDefinition definition) {
        return definition.nodes().stream().map(WorkflowNode::id).toList();
    }

    @Nested
    @DisplayName("dead-node elimination")
    class DeadNodes {

        @Test
        @DisplayName("drops a node unreachable from start together with its edges")
        void unreachableFromStart() {
            WorkflowDefinition definition = WorkflowFixtures.workflow("Dead")
                    .node("s", NodeType.START, "Start")
                    .node("a", NodeType.ACTIVITY, "Work")
                    .node("orphan", NodeType.ACTIVITY, "Orphan")
                    .node("e", NodeType.END, "End")
                    .edge("s", "a")
                    .edge("a", "e")
                    .edge("orphan", "e")
                    .build();

            WorkflowDefinition optimized = WorkflowOptimizer.optimize(definition).definition();

            assertEquals(List.of("a", "e", "s"), nodeIds(optimized));
            assertEquals(2, optimized.edges().size());
            assertTrue(optimized.edges().stream().noneMatch(e -> e.source().equals("orphan")));
        }

        @Test
        @DisplayName("drops nodes that cannot reach an end node, transitively")
        void cannotReachEnd() {
            WorkflowDefinition definition = WorkflowFixtures.workflow("Stuck arm")
                    .variable("x", "number", 0)
                    .node("s", NodeType.START, "Start")
                    .node("d", NodeType.DECISION, "Route")
                    .node("stuck1", NodeType.ACTIVITY, "Stuck 1")
                    .node("stuck2", NodeType.ACTIVITY, "Stuck 2")
                    .node("ok", NodeType.ACTIVITY, "Ok")
                    .node("e", NodeType.END, "End")
                    .edge("s", "d")
                    .conditionalEdge("d", "stuck1", "x > 1")
                    .edge("stuck1", "stuck2")
                    .edge("d", "ok")
                    .edge("ok", "e")
                    .build();

            WorkflowDefinition optimized = WorkflowOptimizer.optimize(definition).definition();

            assertEquals(List.of("d", "e", "ok", "s"), nodeIds(optimized));
            assertEquals(3, optimized.edges().size());
        }

        @Test
        @DisplayName("leaves a fully live graph unchanged apart from ordering")
        void liveGraph() {
            WorkflowDefinition optimized = WorkflowOptimizer.optimize(WorkflowFixtures.orderApproval()).definition();
            assertEquals(6, optimized.nodes().size());
            assertEquals(6, optimized.edges().size());
        }
    }

    @Nested
    @DisplayName("canonical ordering")
    class Ordering {

        @Test
        @DisplayName("sorts nodes by id and edges by source, keeping declaration order per source")
        void ordering() {
            WorkflowDefinition optimized = WorkflowOptimizer.optimize(WorkflowFixtures.orderApproval()).definition();

            assertEquals(List.of("approve", "check", "email", "end", "escalate", "start"), nodeIds(optimized));
            List<String> edges = optimized.edges().stream().map(e -> e.source() + ">" + e.target()).toList();
            assertEquals(List.of("approve>end", "check>escalate", "check>approve", "email>check",
                    "escalate>end", "start>email"), edges);
        }

        @Test
        @DisplayName("is independent of declaration order of unrelated nodes")
        void independentOfDeclarationOrder() {
            WorkflowDefinition forward = WorkflowFixtures.workflow("Order")
                    .node("s", NodeType.START, "Start")
                    .node("b", NodeType.ACTIVITY, "B")
                    .node("a", NodeType.ACTIVITY, "A")
                    .node("e", NodeType.END, "End")
                    .edge("s", "a")
                    .edge("a", "b")
                    .edge("b", "e")
                    .build();
            WorkflowDefinition reversed = WorkflowFixtures.workflow("Order")
                    .node("e", NodeType.END, "End")
                    .node("a", NodeType.ACTIVITY, "A")
                    .node("b", NodeType.ACTIVITY, "B")
                    .node("s", NodeType.START, "Start")
                    .edge("b", "e")
                    .edge("s", "a")
                    .edge("a", "b")
                    .build();

            WorkflowDefinition first = WorkflowOptimizer.optimize(forward).definition();
            WorkflowDefinition second = WorkflowOptimizer.optimize(reversed).definition();

            assertEquals(nodeIds(first), nodeIds(second));
            assertEquals(first.edges().stream().map(WorkflowEdge::source).toList(),
                    second.edges().stream().map(WorkflowEdge::source).toList());
        }
    }

    @Nested
    @DisplayName("chain detection")
    class Chains {

        @Test
        @DisplayName("finds a run of work nodes joined by single edges")
        void findsChain() {
            WorkflowDefinition definition = WorkflowFixtures.workflow("Chain")
                    .node("s", NodeType.START, "Start")
                    .node("a", NodeType.ACTIVITY, "A")
                    .node("b", NodeType.HTTP_CALL, "B", Map.of("url", "https://example.com"))
                    .node("c", NodeType.SUB_WORKFLOW, "C", Map.of("workflow_name", "Child"))
                    .node("t", NodeType.WAIT_TIMER, "Pause", Map.of("duration", "1m"))
                    .node("d", NodeType.ACTIVITY, "D")
                    .node("e", NodeType.END, "End")
                    .edge("s", "a")
                    .edge("a", "b")
                    .edge("b", "c")
                    .edge("c", "t")
                    .edge("t", "d")
                    .edge("d", "e")
                    .build();

            List<LinearChain> chains = WorkflowOptimizer.optimize(definition).chains();

            assertEquals(1, chains.size());
            assertEquals(List.of("a", "b", "c"), chains.get(0).nodeIds());
            assertEquals("a", chains.get(0).head());
            assertEquals("c", chains.get(0).tail());
        }

        @Test
        @DisplayName("does not chain across a merge point")
        void stopsAtMerge() {
            List<LinearChain> chains = WorkflowOptimizer.optimize(WorkflowFixtures.orderApproval()).chains();
            assertTrue(chains.isEmpty());
        }
    }
}
