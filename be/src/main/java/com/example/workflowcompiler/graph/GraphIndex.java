package com.example.workflowcompiler.graph;

import com.example.workflowcompiler.model.NodeType;
import com.example.workflowcompiler.model.WorkflowDefinition;
import com.example.workflowcompiler.model.WorkflowEdge;
import com.example.workflowcompiler.model.WorkflowNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Integer-indexed view of a workflow graph.
 * <p>
 * Node ids are resolved to indices once; traversals then work on plain int arrays. Tolerates invalid
 * input so the validator can use it: the first node with a duplicated id wins and edges with an unknown
 * endpoint are kept in {@link #edgeCount()} but left out of the adjacency lists.
 * </p>
 */
public final class GraphIndex {

    private final List<WorkflowNode> nodes;
    private final List<WorkflowEdge> edges;
    private final Map<String, Integer> indexById;
    private final int[] edgeSource;
    private final int[] edgeTarget;
    private final int[][] outgoing;
    private final int[][] incoming;

    private GraphIndex(List<WorkflowNode> nodes, List<WorkflowEdge> edges) {
        this.nodes = nodes;
        this.edges = edges;
        this.indexById = new HashMap<>();
        for (int i = 0; i < nodes.size(); i++) {
            String id = nodes.get(i).id();
            if (id != null) {
                indexById.putIfAbsent(id, i);
            }
        }
        this.edgeSource = new int[edges.size()];
        this.edgeTarget = new int[edges.size()];
        List<List<Integer>> out = emptyLists(nodes.size());
        List<List<Integer>> in = emptyLists(nodes.size());
        for (int e = 0; e < edges.size(); e++) {
            WorkflowEdge edge = edges.get(e);
            edgeSource[e] = indexOf(edge.source());
            edgeTarget[e] = indexOf(edge.target());
            if (edgeSource[e] >= 0 && edgeTarget[e] >= 0) {
                out.get(edgeSource[e]).add(e);
                in.get(edgeTarget[e]).add(e);
            }
        }
        this.outgoing = toArrays(out);
        this.incoming = toArrays(in);
    }

    public static GraphIndex of(WorkflowDefinition definition) {
        return new GraphIndex(definition.nodes(), definition.edges());
    }

    public int size() {
        return nodes.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    public WorkflowNode node(int index) {
        return nodes.get(index);
    }

    public WorkflowEdge edge(int edgeIndex) {
        return edges.get(edgeIndex);
    }

    /** Index of the node with the given id, or {@code -1}. */
    public int indexOf(String id) {
        if (id == null) {
            return -1;
        }
        Integer index = indexById.get(id);
        return index != null ? index : -1;
    }

    public NodeType type(int index) {
        return nodes.get(index).nodeType();
    }

    /** Source node index of an edge, or {@code -1} when it does not resolve. */
    public int source(int edgeIndex) {
        return edgeSource[edgeIndex];
    }

    public int target(int edgeIndex) {
        return edgeTarget[edgeIndex];
    }

    /** Outgoing edge indices in declaration order. */
    public int[] outgoing(int index) {
        return outgoing[index];
    }

    public int[] incoming(int index) {
        return incoming[index];
    }

    public int[] successors(int index) {
        int[] out = outgoing[index];
        int[] result = new int[out.length];
        for (int i = 0; i < out.length; i++) {
            result[i] = edgeTarget[out[i]];
        }
        return result;
    }

    public int[] predecessors(int index) {
        int[] in = incoming[index];
        int[] result = new int[in.length];
        for (int i = 0; i < in.length; i++) {
            result[i] = edgeSource[in[i]];
        }
        return result;
    }

    public List<Integer> nodesOfType(NodeType type) {
        List<Integer> result = new ArrayList<>();
        for (int i = 0; i < nodes.size(); i++) {
            if (nodes.get(i).nodeType() == type) {
                result.add(i);
            }
        }
        return result;
    }

    /** Nodes reachable from {@code start} following edges forward, including {@code start}. */
    public BitSet reachableFrom(int start) {
        BitSet seen = new BitSet(nodes.size());
        if (start < 0) {
            return seen;
        }
        Deque<Integer> work = new ArrayDeque<>();
        work.push(start);
        seen.set(start);
        while (!work.isEmpty()) {
            int n = work.pop();
            for (int s : successors(n)) {
                if (!seen.get(s)) {
                    seen.set(s);
                    work.push(s);
                }
            }
        }
        return seen;
    }

    /** Nodes from which at least one of {@code targets} is reachable, including the targets. */
    public BitSet reaching(List<Integer> targets) {
        BitSet seen = new BitSet(nodes.size());
        Deque<Integer> work = new ArrayDeque<>();
        for (int t : targets) {
            if (!seen.get(t)) {
                seen.set(t);
                work.push(t);
            }
        }
        while (!work.isEmpty()) {
            int n = work.pop();
            for (int p : predecessors(n)) {
                if (!seen.get(p)) {
                    seen.set(p);
                    work.push(p);
                }
            }
        }
        return seen;
    }

    private static List<List<Integer>> emptyLists(int size) {
        List<List<Integer>> lists = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            lists.add(new ArrayList<>());
        }
        return lists;
    }

    private static int[][] toArrays(List<List<Integer>> lists) {
        int[][] result = new int[lists.size()][];
        for (int i = 0; i < lists.size(); i++) {
            result[i] = lists.get(i).stream().mapToInt(Integer::intValue).toArray();
        }
        return result;
    }
}
