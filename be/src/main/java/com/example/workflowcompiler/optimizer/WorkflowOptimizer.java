package com.example.workflowcompiler.optimizer;

import com.example.workflowcompiler.graph.GraphIndex;
import com.example.workflowcompiler.model.NodeType;
import com.example.workflowcompiler.model.WorkflowDefinition;
import com.example.workflowcompiler.model.WorkflowEdge;
import com.example.workflowcompiler.model.WorkflowNode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Comparator;
import java.util.List;

/**
 * Graph rewrites applied to a validated definition before structuring.
 * <ul>
 *   <li>dead-node elimination: nodes not on any start-to-end path are dropped with their edges</li>
 *   <li>canonical ordering: nodes by id, edges by source id keeping declaration order per source</li>
 *   <li>chain detection: runs of work nodes joined by single edges are reported as {@link LinearChain}s</li>
 * </ul>
 * The output depends only on the input graph, never on map iteration order.
 */
public final class WorkflowOptimizer {

    private static final Logger log = LoggerFactory.getLogger(WorkflowOptimizer.class);

    private WorkflowOptimizer() {
    }

    public static OptimizedWorkflow optimize(WorkflowDefinition definition) {
        WorkflowDefinition current = definition;
        while (true) {
            WorkflowDefinition next = removeDeadNodes(current);
            if (next.nodes().size() == current.nodes().size() && next.edges().size() == current.edges().size()) {
                break;
            }
            log.debug("Removed {} dead node(s) from workflow '{}'",
                    current.nodes().size() - next.nodes().size(), definition.name());
            current = next;
        }
        WorkflowDefinition ordered = canonicalOrder(current);
        return new OptimizedWorkflow(ordered, findChains(GraphIndex.of(ordered)));
    }

    private static WorkflowDefinition removeDeadNodes(WorkflowDefinition definition) {
        GraphIndex graph = GraphIndex.of(definition);
        List<Integer> starts = graph.nodesOfType(NodeType.START);
        if (starts.size() != 1) {
            return definition;
        }
        BitSet live = graph.reachableFrom(starts.get(0));
        live.and(graph.reaching(graph.nodesOfType(NodeType.END)));

        List<WorkflowNode> nodes = new ArrayList<>();
        for (int i = 0; i < graph.size(); i++) {
            if (live.get(i)) {
                nodes.add(graph.node(i));
            }
        }
        List<WorkflowEdge> edges = new ArrayList<>();
        for (int e = 0; e < graph.edgeCount(); e++) {
            int source = graph.source(e);
            int target = graph.target(e);
            if (source >= 0 && target >= 0 && live.get(source) && live.get(target)) {
                edges.add(graph.edge(e));
            }
        }
        return definition.withGraph(nodes, edges);
    }

    private static WorkflowDefinition canonicalOrder(WorkflowDefinition definition) {
        List<WorkflowNode> nodes = new ArrayList<>(definition.nodes());
        nodes.sort(Comparator.comparing(WorkflowNode::id));
        // List.sort is stable, so edges leaving the same node keep their declaration order
        List<WorkflowEdge> edges = new ArrayList<>(definition.edges());
        edges.sort(Comparator.comparing(WorkflowEdge::source));
        return definition.withGraph(nodes, edges);
    }

    private static List<LinearChain> findChains(GraphIndex graph) {
        List<LinearChain> chains = new ArrayList<>();
        for (int n = 0; n < graph.size(); n++) {
            if (!isChainable(graph, n) || continuesChain(graph, n)) {
                continue;
            }
            List<String> ids = new ArrayList<>();
            ids.add(graph.node(n).id());
            int current = n;
            while (true) {
                int next = linkTarget(graph, current);
                if (next < 0) {
                    break;
                }
                ids.add(graph.node(next).id());
                current = next;
            }
            if (ids.size() >= 2) {
                chains.add(new LinearChain(ids));
            }
        }
        return chains;
    }

    /** True if {@code n} is the non-head member of some chain. */
    private static boolean continuesChain(GraphIndex graph, int n) {
        int[] incoming = graph.incoming(n);
        if (incoming.length != 1) {
            return false;
        }
        int previous = graph.source(incoming[0]);
        return linkTarget(graph, previous) == n;
    }

    /** The chain member following {@code n}, or {@code -1} if the chain ends at {@code n}. */
    private static int linkTarget(GraphIndex graph, int n) {
        if (!isChainable(graph, n)) {
            return -1;
        }
        int[] outgoing = graph.outgoing(n);
        if (outgoing.length != 1) {
            return -1;
        }
        int edge = outgoing[0];
        int next = graph.target(edge);
        if (graph.edge(edge).hasCondition() || !isChainable(graph, next) || graph.incoming(next).length != 1) {
            return -1;
        }
        return next;
    }

    private static boolean isChainable(GraphIndex graph, int n) {
        NodeType type = graph.type(n);
        return type != null && (type.isWork() || type == NodeType.SUB_WORKFLOW);
    }
}
