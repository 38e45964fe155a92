package com.example.workflowcompiler.validation;

import com.example.workflowcompiler.compiler.CompileFailure;
import com.example.workflowcompiler.compiler.FailureCode;
import com.example.workflowcompiler.expression.ConditionExpression;
import com.example.workflowcompiler.expression.ConditionParseException;
import com.example.workflowcompiler.graph.GraphIndex;
import com.example.workflowcompiler.model.NodeType;
import com.example.workflowcompiler.model.Trigger;
import com.example.workflowcompiler.model.Variable;
import com.example.workflowcompiler.model.VariableType;
import com.example.workflowcompiler.model.WorkflowDefinition;
import com.example.workflowcompiler.model.WorkflowEdge;
import com.example.workflowcompiler.model.WorkflowNode;
import com.example.workflowcompiler.model.config.InvalidNodeConfigException;
import com.example.workflowcompiler.model.config.NodeConfigParser;
import com.example.workflowcompiler.naming.IdentifierResolver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Validates a workflow graph: start/end shape, reference integrity, branching rules, fork/join shape,
 * per-variant configuration, variables, triggers and cycles.
 * <p>
 * Every check runs and every failure is collected, so one call reports all problems at once. Graph shapes
 * that are acyclic but cannot be structured are left to the control-flow builder. Unreachable nodes are not
 * failures; the optimizer removes them.
 * </p>
 */
public final class WorkflowGraphValidator {

    private static final Logger log = LoggerFactory.getLogger(WorkflowGraphValidator.class);

    private static final Pattern VARIABLE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private WorkflowGraphValidator() {
    }

    /**
     * Validates the definition. Throws {@link WorkflowGraphValidationException} with all failures if invalid.
     */
    public static void validate(WorkflowDefinition definition) {
        List<CompileFailure> failures = findFailures(definition);
        if (!failures.isEmpty()) {
            throw new WorkflowGraphValidationException(failures);
        }
    }

    /**
     * Runs all checks and returns the failures in a stable order (empty when the definition is valid).
     */
    public static List<CompileFailure> findFailures(WorkflowDefinition definition) {
        List<CompileFailure> errors = new ArrayList<>();
        if (definition.nodes().isEmpty()) {
            errors.add(new CompileFailure(FailureCode.EMPTY_WORKFLOW, "nodes", "at least one node is required"));
            errors.add(new CompileFailure(FailureCode.MISSING_START, "nodes", "missing start node"));
            errors.add(new CompileFailure(FailureCode.MISSING_END, "nodes", "missing end node"));
            return errors;
        }
        GraphIndex graph = GraphIndex.of(definition);

        Set<String> variables = validateVariables(definition.variables(), errors);
        validateNodes(definition.nodes(), errors);
        validateEdges(graph, errors);
        validateStartAndEnd(graph, errors);
        validateBranching(graph, variables, errors);
        validateForkJoinShape(graph, errors);
        detectCycles(graph, errors);
        validateTriggers(definition.triggers(), errors);
        return errors;
    }

    private static Set<String> validateVariables(List<Variable> variables, List<CompileFailure> errors) {
        Set<String> names = new HashSet<>();
        Map<String, String> fieldNames = new HashMap<>();
        for (int i = 0; i < variables.size(); i++) {
            Variable variable = variables.get(i);
            String name = variable.name();
            String prefix = "variables[" + (name != null && !name.isBlank() ? name : String.valueOf(i)) + "]";
            if (name == null || name.isBlank()) {
                errors.add(new CompileFailure(FailureCode.INVALID_VARIABLE, prefix + ".name", "variable name is required"));
                continue;
            }
            if (!VARIABLE_NAME.matcher(name).matches()) {
                errors.add(new CompileFailure(FailureCode.INVALID_VARIABLE, prefix + ".name",
                        "variable name must start with a letter or '_' and contain only letters, digits and '_'"));
                continue;
            }
            if (!names.add(name)) {
                errors.add(new CompileFailure(FailureCode.INVALID_VARIABLE, prefix + ".name", "duplicate variable name: " + name));
                continue;
            }
            String fieldName = IdentifierResolver.toPascalCase(name);
            if (fieldName.isEmpty()) {
                errors.add(new CompileFailure(FailureCode.INVALID_VARIABLE, prefix + ".name",
                        "variable name must contain at least one letter or digit"));
                continue;
            }
            String clash = fieldNames.putIfAbsent(fieldName, name);
            if (clash != null) {
                errors.add(new CompileFailure(FailureCode.INVALID_VARIABLE, prefix + ".name",
                        "variable '" + name + "' maps to the same generated field as '" + clash + "'"));
            }
            Optional<VariableType> type = VariableType.fromName(variable.varType());
            if (type.isEmpty()) {
                errors.add(new CompileFailure(FailureCode.INVALID_VARIABLE, prefix + ".var_type",
                        "unknown variable type '" + variable.varType() + "'"));
            } else if (!type.get().accepts(variable.defaultValue())) {
                errors.add(new CompileFailure(FailureCode.INVALID_VARIABLE, prefix + ".default_value",
                        "default value does not match type " + variable.varType()));
            }
        }
        return names;
    }

    private static void validateNodes(List<WorkflowNode> nodes, List<CompileFailure> errors) {
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < nodes.size(); i++) {
            WorkflowNode node = nodes.get(i);
            String prefix = nodePrefix(node, i);
            if (node.id() == null || node.id().isBlank()) {
                errors.add(new CompileFailure(FailureCode.INVALID_NODE, prefix + ".id", "node id is required"));
            } else if (!seen.add(node.id())) {
                errors.add(new CompileFailure(FailureCode.DUPLICATE_NODE_ID, prefix + ".id", "duplicate node id: " + node.id()));
            }
            if (node.nodeType() == null) {
                errors.add(new CompileFailure(FailureCode.INVALID_NODE, prefix + ".node_type", "node type is required"));
                continue;
            }
            try {
                NodeConfigParser.parse(node);
            } catch (InvalidNodeConfigException e) {
                errors.add(new CompileFailure(FailureCode.INVALID_CONFIG, prefix + "." + e.getKey(), e.getMessage()));
            }
            if (node.retries() == null) {
                continue;
            }
            if (!node.nodeType().isWork()) {
                log.debug("Ignoring retry policy on node id={} type={}", node.id(), node.nodeType());
                continue;
            }
            try {
                NodeConfigParser.parseRetryPolicy(node.retries());
            } catch (InvalidNodeConfigException e) {
                errors.add(new CompileFailure(FailureCode.INVALID_CONFIG, prefix + "." + e.getKey(), e.getMessage()));
            }
        }
    }

    private static void validateEdges(GraphIndex graph, List<CompileFailure> errors) {
        Set<String> seen = new HashSet<>();
        for (int e = 0; e < graph.edgeCount(); e++) {
            WorkflowEdge edge = graph.edge(e);
            String prefix = edgePrefix(edge, e);
            if (edge.id() == null || edge.id().isBlank()) {
                errors.add(new CompileFailure(FailureCode.INVALID_EDGE, prefix + ".id", "edge id is required"));
            } else if (!seen.add(edge.id())) {
                errors.add(new CompileFailure(FailureCode.DUPLICATE_EDGE_ID, prefix + ".id", "duplicate edge id: " + edge.id()));
            }
            if (graph.source(e) < 0) {
                errors.add(new CompileFailure(FailureCode.DANGLING_EDGE, prefix + ".source",
                        "source must reference an existing node id: " + edge.source()));
            }
            if (graph.target(e) < 0) {
                errors.add(new CompileFailure(FailureCode.DANGLING_EDGE, prefix + ".target",
                        "target must reference an existing node id: " + edge.target()));
            }
            int source = graph.source(e);
            if (edge.hasCondition() && source >= 0 && graph.type(source) != NodeType.DECISION) {
                errors.add(new CompileFailure(FailureCode.CONDITION_NOT_ALLOWED, prefix + ".condition",
                        "only edges leaving a decision node may carry a condition"));
            }
        }
    }

    private static void validateStartAndEnd(GraphIndex graph, List<CompileFailure> errors) {
        List<Integer> starts = graph.nodesOfType(NodeType.START);
        List<Integer> ends = graph.nodesOfType(NodeType.END);

        if (starts.isEmpty()) {
            errors.add(new CompileFailure(FailureCode.MISSING_START, "nodes", "missing start node"));
        } else if (starts.size() > 1) {
            errors.add(new CompileFailure(FailureCode.MULTIPLE_START, "nodes",
                    "exactly one start node is allowed, found " + starts.size()));
        }
        for (int start : starts) {
            String prefix = nodePrefix(graph.node(start), start);
            if (graph.incoming(start).length > 0) {
                errors.add(new CompileFailure(FailureCode.INVALID_START, prefix, "start node must not have incoming edges"));
            }
            if (graph.outgoing(start).length != 1) {
                errors.add(new CompileFailure(FailureCode.INVALID_START, prefix,
                        "start node must have exactly one outgoing edge, found " + graph.outgoing(start).length));
            }
        }

        if (ends.isEmpty()) {
            errors.add(new CompileFailure(FailureCode.MISSING_END, "nodes", "missing end node"));
            return;
        }
        for (int end : ends) {
            if (graph.outgoing(end).length > 0) {
                errors.add(new CompileFailure(FailureCode.INVALID_END, nodePrefix(graph.node(end), end),
                        "end node must not have outgoing edges"));
            }
        }
        if (starts.size() == 1) {
            BitSet reachable = graph.reachableFrom(starts.get(0));
            boolean anyEndReachable = ends.stream().anyMatch(reachable::get);
            if (!anyEndReachable) {
                errors.add(new CompileFailure(FailureCode.UNREACHABLE_END, "nodes", "no end node is reachable from the start node"));
            }
        }
    }

    private static void validateBranching(GraphIndex graph, Set<String> variables, List<CompileFailure> errors) {
        for (int n = 0; n < graph.size(); n++) {
            NodeType type = graph.type(n);
            if (type == null || type == NodeType.START || type == NodeType.END) {
                continue;
            }
            String prefix = nodePrefix(graph.node(n), n);
            int[] outgoing = graph.outgoing(n);
            if (type == NodeType.DECISION) {
                validateDecision(graph, n, prefix, variables, errors);
            } else if (!type.isBranching() && outgoing.length > 1) {
                errors.add(new CompileFailure(FailureCode.MULTIPLE_SUCCESSORS, prefix,
                        "only decision and parallel_gateway nodes may have more than one outgoing edge, found " + outgoing.length));
            }
        }
    }

    private static void validateDecision(GraphIndex graph, int decision, String prefix, Set<String> variables,
                                         List<CompileFailure> errors) {
        int[] outgoing = graph.outgoing(decision);
        if (outgoing.length < 2) {
            errors.add(new CompileFailure(FailureCode.INVALID_DECISION, prefix,
                    "decision node must have at least 2 outgoing edges, found " + outgoing.length));
        }
        int defaults = 0;
        Map<String, String> seenConditions = new HashMap<>();
        for (int e : outgoing) {
            WorkflowEdge edge = graph.edge(e);
            if (!edge.hasCondition()) {
                defaults++;
                continue;
            }
            String field = edgePrefix(edge, e) + ".condition";
            ConditionExpression condition;
            try {
                condition = ConditionExpression.parse(edge.condition());
            } catch (ConditionParseException ex) {
                errors.add(new CompileFailure(FailureCode.INVALID_CONDITION, field,
                        "invalid condition '" + edge.condition() + "': " + ex.getMessage()));
                continue;
            }
            for (String name : condition.variables()) {
                if (!variables.contains(name)) {
                    errors.add(new CompileFailure(FailureCode.UNDECLARED_VARIABLE, field,
                            "condition references undeclared variable '" + name + "'"));
                }
            }
            String earlier = seenConditions.putIfAbsent(condition.normalized(), edge.id());
            if (earlier != null) {
                errors.add(new CompileFailure(FailureCode.INVALID_DECISION, field,
                        "condition duplicates edge " + earlier + " and can never be taken"));
            }
        }
        if (defaults > 1) {
            errors.add(new CompileFailure(FailureCode.INVALID_DECISION, prefix,
                    "decision node has " + defaults + " edges without a condition; at most one default branch is allowed"));
        }
    }

    private static void validateForkJoinShape(GraphIndex graph, List<CompileFailure> errors) {
        List<Integer> forks = graph.nodesOfType(NodeType.PARALLEL_GATEWAY);
        BitSet downstreamOfFork = new BitSet(graph.size());
        for (int fork : forks) {
            if (graph.outgoing(fork).length < 2) {
                errors.add(new CompileFailure(FailureCode.INVALID_FORK, nodePrefix(graph.node(fork), fork),
                        "parallel_gateway must have at least 2 outgoing edges, found " + graph.outgoing(fork).length));
            }
            BitSet reachable = graph.reachableFrom(fork);
            reachable.clear(fork);
            downstreamOfFork.or(reachable);
        }
        for (int join : graph.nodesOfType(NodeType.PARALLEL_JOIN)) {
            String prefix = nodePrefix(graph.node(join), join);
            if (graph.incoming(join).length < 2) {
                errors.add(new CompileFailure(FailureCode.INVALID_JOIN, prefix,
                        "parallel_join must have at least 2 incoming edges, found " + graph.incoming(join).length));
            }
            if (graph.outgoing(join).length != 1) {
                errors.add(new CompileFailure(FailureCode.INVALID_JOIN, prefix,
                        "parallel_join must have exactly one outgoing edge, found " + graph.outgoing(join).length));
            }
            if (!downstreamOfFork.get(join)) {
                errors.add(new CompileFailure(FailureCode.ORPHAN_JOIN, prefix,
                        "parallel_join is not downstream of any parallel_gateway"));
            }
        }
    }

    /**
     * Depth-first search with an explicit stack and an in-progress set. An edge into a node that is still in
     * progress closes a cycle and is reported.
     */
    private static void detectCycles(GraphIndex graph, List<CompileFailure> errors) {
        final int unvisited = 0;
        final int inProgress = 1;
        final int done = 2;
        int[] state = new int[graph.size()];
        for (int root = 0; root < graph.size(); root++) {
            if (state[root] != unvisited) {
                continue;
            }
            Deque<int[]> stack = new ArrayDeque<>();
            stack.push(new int[]{root, 0});
            state[root] = inProgress;
            while (!stack.isEmpty()) {
                int[] frame = stack.peek();
                int[] outgoing = graph.outgoing(frame[0]);
                if (frame[1] == outgoing.length) {
                    state[frame[0]] = done;
                    stack.pop();
                    continue;
                }
                int e = outgoing[frame[1]++];
                int target = graph.target(e);
                if (state[target] == inProgress) {
                    WorkflowEdge edge = graph.edge(e);
                    errors.add(new CompileFailure(FailureCode.CYCLE_DETECTED, edgePrefix(edge, e),
                            "cycle detected: edge " + edge.id() + " (" + edge.source() + " -> " + edge.target() + ") closes a loop"));
                } else if (state[target] == unvisited) {
                    state[target] = inProgress;
                    stack.push(new int[]{target, 0});
                }
            }
        }
    }

    private static void validateTriggers(List<Trigger> triggers, List<CompileFailure> errors) {
        for (int i = 0; i < triggers.size(); i++) {
            Trigger trigger = triggers.get(i);
            String prefix = "triggers[" + i + "]";
            if (trigger.triggerType() == null) {
                errors.add(new CompileFailure(FailureCode.INVALID_TRIGGER, prefix + ".trigger_type", "trigger type is required"));
                continue;
            }
            switch (trigger.triggerType()) {
                case SCHEDULE:
                    requireTriggerKey(trigger, "cron", prefix, errors);
                    break;
                case WEBHOOK:
                    requireTriggerKey(trigger, "path", prefix, errors);
                    break;
                case EVENT:
                    requireTriggerKey(trigger, "event", prefix, errors);
                    break;
                default:
                    break;
            }
        }
    }

    private static void requireTriggerKey(Trigger trigger, String key, String prefix, List<CompileFailure> errors) {
        Object value = trigger.config().get(key);
        if (!(value instanceof String text) || text.isBlank()) {
            errors.add(new CompileFailure(FailureCode.INVALID_TRIGGER, prefix + ".config." + key,
                    key + " is required for " + trigger.triggerType().name().toLowerCase(Locale.ROOT) + " triggers"));
        }
    }

    private static String nodePrefix(WorkflowNode node, int index) {
        return "nodes[" + (node.id() != null && !node.id().isBlank() ? node.id() : String.valueOf(index)) + "]";
    }

    private static String edgePrefix(WorkflowEdge edge, int index) {
        return "edges[" + (edge.id() != null && !edge.id().isBlank() ? edge.id() : String.valueOf(index)) + "]";
    }
}
