package com.example.workflowcompiler.controlflow;

import com.example.workflowcompiler.expression.ConditionExpression;
import com.example.workflowcompiler.graph.DominatorTree;
import com.example.workflowcompiler.graph.GraphIndex;
import com.example.workflowcompiler.model.NodeType;
import com.example.workflowcompiler.model.Variable;
import com.example.workflowcompiler.model.VariableType;
import com.example.workflowcompiler.model.WorkflowDefinition;
import com.example.workflowcompiler.model.WorkflowEdge;
import com.example.workflowcompiler.model.WorkflowNode;
import com.example.workflowcompiler.model.config.NodeConfigParser;
import com.example.workflowcompiler.model.config.RetrySettings;
import com.example.workflowcompiler.naming.IdentifierResolver;
import com.example.workflowcompiler.optimizer.LinearChain;
import com.example.workflowcompiler.optimizer.OptimizedWorkflow;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns an optimized, acyclic workflow graph into a {@link StructuredProgram}.
 * <p>
 * The walk starts at the successor of the start node. A decision or parallel gateway is closed at its
 * immediate post-dominator: decision arms reconverge there, and for a gateway it must be the matching
 * parallel join. Every node is placed exactly once; a graph whose branches merge anywhere else cannot be
 * written as nested blocks and is rejected with a {@link CodeGenerationException}.
 * </p>
 */
public final class ControlFlowBuilder {

    private static final Logger log = LoggerFactory.getLogger(ControlFlowBuilder.class);

    private final GraphIndex graph;
    private final IdentifierResolver resolver;
    private final DominatorTree dominators;
    private final DominatorTree postDominators;
    private final int virtualExit;
    private final Map<String, LinearChain> chainsByHead = new HashMap<>();
    private final BitSet placed;
    private final BitSet claimedJoins;

    private ControlFlowBuilder(GraphIndex graph, int start, List<LinearChain> chains, IdentifierResolver resolver) {
        this.graph = graph;
        this.resolver = resolver;
        this.dominators = DominatorTree.dominators(graph, start);
        this.postDominators = DominatorTree.postDominators(graph);
        this.virtualExit = graph.size();
        this.placed = new BitSet(graph.size());
        this.claimedJoins = new BitSet(graph.size());
        for (LinearChain chain : chains) {
            chainsByHead.put(chain.head(), chain);
        }
    }

    /**
     * @throws CodeGenerationException if the graph has no structured form
     */
    public static StructuredProgram build(OptimizedWorkflow optimized, IdentifierResolver resolver) {
        WorkflowDefinition definition = optimized.definition();
        GraphIndex graph = GraphIndex.of(definition);
        List<Integer> starts = graph.nodesOfType(NodeType.START);
        if (starts.size() != 1) {
            throw new CodeGenerationException("nodes", "exactly one start node is required");
        }
        int start = starts.get(0);
        int[] first = graph.successors(start);
        if (first.length != 1) {
            throw new CodeGenerationException(nodeField(graph, start), "start node must have exactly one successor");
        }

        resolver.reserve("Activities", "NewActivities");
        String entryPoint = resolver.resolveWorkflow(definition.name());
        String packageName = IdentifierResolver.packageName(definition.name());

        ControlFlowBuilder builder = new ControlFlowBuilder(graph, start, optimized.chains(), resolver);
        builder.placed.set(start);
        Sequence body = builder.structureRegion(first[0], builder.virtualExit, false);
        log.debug("Structured workflow '{}' into {} top-level item(s)", definition.name(), body.items().size());
        return new StructuredProgram(definition.name(), entryPoint, packageName, variables(definition), body);
    }

    /**
     * Structures the nodes from {@code entry} up to, not including, {@code stop}.
     */
    private Sequence structureRegion(int entry, int stop, boolean insideFork) {
        List<ControlNode> items = new ArrayList<>();
        int current = entry;
        while (current != stop) {
            NodeType type = graph.type(current);
            if (type == NodeType.PARALLEL_JOIN) {
                throw new CodeGenerationException(nodeField(graph, current),
                        "parallel_join is reached outside the branches of its parallel_gateway");
            }
            place(current);
            switch (type) {
                case END:
                    if (insideFork) {
                        throw new CodeGenerationException(nodeField(graph, current),
                                "end node inside a parallel branch; every branch must reach the parallel_join");
                    }
                    items.add(new Exit(graph.node(current).id(), graph.node(current).label()));
                    return new Sequence(items);
                case DECISION:
                    int reconverge = postDominators.immediateDominator(current);
                    items.add(decision(current, reconverge, insideFork));
                    if (reconverge == virtualExit || reconverge < 0) {
                        return new Sequence(items);
                    }
                    current = reconverge;
                    break;
                case PARALLEL_GATEWAY:
                    int join = matchingJoin(current);
                    items.add(fork(current, join));
                    current = onlySuccessor(join);
                    break;
                case START:
                    throw new CodeGenerationException(nodeField(graph, current), "start node must not have incoming edges");
                default:
                    current = step(current, items);
                    break;
            }
        }
        return new Sequence(items);
    }

    private Branch decision(int decision, int reconverge, boolean insideFork) {
        WorkflowNode node = graph.node(decision);
        String identifier = resolver.resolve(node.label(), NodeType.DECISION);
        List<ConditionalArm> arms = new ArrayList<>();
        Sequence defaultArm = null;
        for (int e : graph.outgoing(decision)) {
            WorkflowEdge edge = graph.edge(e);
            Sequence body = structureRegion(graph.target(e), reconverge, insideFork);
            if (edge.hasCondition()) {
                arms.add(new ConditionalArm(edge.id(), ConditionExpression.parse(edge.condition()), body));
            } else {
                defaultArm = body;
            }
        }
        if (arms.isEmpty() && defaultArm != null) {
            log.debug("Decision {} has only a default arm left", node.id());
        }
        return new Branch(node.id(), identifier, node.label(), arms, defaultArm);
    }

    private int matchingJoin(int gateway) {
        int join = postDominators.immediateDominator(gateway);
        String field = nodeField(graph, gateway);
        if (join < 0 || join == virtualExit || graph.type(join) != NodeType.PARALLEL_JOIN) {
            throw new CodeGenerationException(field,
                    "parallel_gateway has no matching parallel_join; all branches must meet at a single join");
        }
        if (claimedJoins.get(join)) {
            throw new CodeGenerationException(field,
                    "parallel_join " + graph.node(join).id() + " already closes another parallel_gateway");
        }
        if (!dominators.dominates(gateway, join)) {
            throw new CodeGenerationException(field,
                    "parallel_join " + graph.node(join).id() + " can be reached without passing through the gateway");
        }
        claimedJoins.set(join);
        return join;
    }

    private Fork fork(int gateway, int join) {
        WorkflowNode node = graph.node(gateway);
        String identifier = resolver.resolve(node.label(), NodeType.PARALLEL_GATEWAY);
        List<Sequence> branches = new ArrayList<>();
        for (int target : graph.successors(gateway)) {
            branches.add(structureRegion(target, join, true));
        }
        place(join);
        return new Fork(node.id(), graph.node(join).id(), identifier, node.label(), branches);
    }

    /** Appends the step for {@code node}, or the whole chain it heads, and returns the next node. */
    private int step(int node, List<ControlNode> items) {
        items.add(new Step(describe(node)));
        int last = node;
        LinearChain chain = chainsByHead.get(graph.node(node).id());
        if (chain != null) {
            for (String id : chain.nodeIds().subList(1, chain.nodeIds().size())) {
                int member = graph.indexOf(id);
                place(member);
                items.add(new Step(describe(member)));
                last = member;
            }
        }
        return onlySuccessor(last);
    }

    private StepDescriptor describe(int index) {
        WorkflowNode node = graph.node(index);
        RetrySettings retry = node.nodeType().isWork() ? NodeConfigParser.parseRetryPolicy(node.retries()) : null;
        return new StepDescriptor(
                node.id(),
                node.nodeType(),
                resolver.resolve(node.label(), node.nodeType()),
                node.label(),
                NodeConfigParser.parse(node),
                retry);
    }

    private int onlySuccessor(int node) {
        int[] successors = graph.successors(node);
        if (successors.length != 1) {
            throw new CodeGenerationException(nodeField(graph, node),
                    "expected exactly one successor, found " + successors.length);
        }
        return successors[0];
    }

    private void place(int node) {
        if (placed.get(node)) {
            throw new CodeGenerationException(nodeField(graph, node),
                    "node is reached from branches that do not reconverge at a single point");
        }
        placed.set(node);
    }

    private static List<ProgramVariable> variables(WorkflowDefinition definition) {
        List<ProgramVariable> result = new ArrayList<>();
        for (Variable variable : definition.variables()) {
            VariableType type = VariableType.fromName(variable.varType()).orElse(VariableType.ANY);
            result.add(new ProgramVariable(variable.name(), IdentifierResolver.toPascalCase(variable.name()), type,
                    variable.defaultValue()));
        }
        return result;
    }

    private static String nodeField(GraphIndex graph, int node) {
        return "nodes[" + graph.node(node).id() + "]";
    }
}
