package com.example.workflowcompiler.graph;

import com.example.workflowcompiler.model.NodeType;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.function.IntFunction;

/**
 * Dominator tree of a rooted graph, computed with the iterative algorithm of Cooper, Harvey and Kennedy
 * ("A Simple, Fast Dominance Algorithm").
 * <p>
 * Node {@code a} dominates {@code b} if every path from the root to {@code b} passes through {@code a}.
 * {@link #postDominators(GraphIndex)} builds the tree over the reversed workflow graph rooted at a virtual
 * exit joined to every End node; the immediate post-dominator of a decision or fork is where its branches
 * reconverge.
 * </p>
 */
public final class DominatorTree {

    private static final int UNDEFINED = -1;

    private final int root;
    private final int[] idom;
    private final int[] postorder;

    private DominatorTree(int root, int[] idom, int[] postorder) {
        this.root = root;
        this.idom = idom;
        this.postorder = postorder;
    }

    /**
     * @param nodeCount    number of nodes, indexed {@code 0..nodeCount-1}
     * @param root         entry node
     * @param successors   successor indices per node
     * @param predecessors predecessor indices per node (must mirror {@code successors})
     */
    public static DominatorTree compute(int nodeCount, int root, IntFunction<int[]> successors, IntFunction<int[]> predecessors) {
        int[] postorder = new int[nodeCount];
        Arrays.fill(postorder, UNDEFINED);
        List<Integer> order = postorder(nodeCount, root, successors, postorder);

        int[] idom = new int[nodeCount];
        Arrays.fill(idom, UNDEFINED);
        idom[root] = root;
        boolean changed = true;
        while (changed) {
            changed = false;
            // reverse postorder, root excluded
            for (int i = order.size() - 2; i >= 0; i--) {
                int b = order.get(i);
                int newIdom = UNDEFINED;
                for (int p : predecessors.apply(b)) {
                    if (idom[p] == UNDEFINED) {
                        continue;
                    }
                    newIdom = newIdom == UNDEFINED ? p : intersect(p, newIdom, idom, postorder);
                }
                if (newIdom != UNDEFINED && idom[b] != newIdom) {
                    idom[b] = newIdom;
                    changed = true;
                }
            }
        }
        return new DominatorTree(root, idom, postorder);
    }

    /** Forward dominators of a workflow graph rooted at {@code start}. */
    public static DominatorTree dominators(GraphIndex graph, int start) {
        return compute(graph.size(), start, graph::successors, graph::predecessors);
    }

    /**
     * Post-dominators of a workflow graph. The virtual exit has index {@code graph.size()}; every End node is
     * its predecessor in the forward graph.
     */
    public static DominatorTree postDominators(GraphIndex graph) {
        int exit = graph.size();
        List<Integer> ends = graph.nodesOfType(NodeType.END);
        int[] endArray = ends.stream().mapToInt(Integer::intValue).toArray();
        IntFunction<int[]> reverseSuccessors = n -> n == exit ? endArray : graph.predecessors(n);
        IntFunction<int[]> reversePredecessors = n -> {
            if (n == exit) {
                return new int[0];
            }
            int[] forward = graph.successors(n);
            if (graph.type(n) != NodeType.END) {
                return forward;
            }
            int[] withExit = Arrays.copyOf(forward, forward.length + 1);
            withExit[forward.length] = exit;
            return withExit;
        };
        return compute(graph.size() + 1, exit, reverseSuccessors, reversePredecessors);
    }

    public int root() {
        return root;
    }

    /** Immediate dominator of {@code node}; {@code -1} for the root and for unreachable nodes. */
    public int immediateDominator(int node) {
        if (node == root || idom[node] == UNDEFINED) {
            return UNDEFINED;
        }
        return idom[node];
    }

    public boolean isReachable(int node) {
        return idom[node] != UNDEFINED;
    }

    /** True if every path from the root to {@code b} passes through {@code a}; a node dominates itself. */
    public boolean dominates(int a, int b) {
        if (!isReachable(a) || !isReachable(b)) {
            return false;
        }
        int current = b;
        while (true) {
            if (current == a) {
                return true;
            }
            if (current == root) {
                return false;
            }
            current = idom[current];
        }
    }

    private static int intersect(int b1, int b2, int[] idom, int[] postorder) {
        int finger1 = b1;
        int finger2 = b2;
        while (finger1 != finger2) {
            while (postorder[finger1] < postorder[finger2]) {
                finger1 = idom[finger1];
            }
            while (postorder[finger2] < postorder[finger1]) {
                finger2 = idom[finger2];
            }
        }
        return finger1;
    }

    /** Iterative depth-first postorder; fills {@code numbers} and returns nodes in postorder. */
    private static List<Integer> postorder(int nodeCount, int root, IntFunction<int[]> successors, int[] numbers) {
        List<Integer> order = new ArrayList<>();
        boolean[] visited = new boolean[nodeCount];
        Deque<int[]> stack = new ArrayDeque<>();
        stack.push(new int[]{root, 0});
        visited[root] = true;
        while (!stack.isEmpty()) {
            int[] frame = stack.peek();
            int[] next = successors.apply(frame[0]);
            if (frame[1] < next.length) {
                int s = next[frame[1]++];
                if (!visited[s]) {
                    visited[s] = true;
                    stack.push(new int[]{s, 0});
                }
            } else {
                stack.pop();
                numbers[frame[0]] = order.size();
                order.add(frame[0]);
            }
        }
        return order;
    }
}
