package com.example.workflowcompiler.compiler;

import com.example.workflowcompiler.controlflow.CodeGenerationException;
import com.example.workflowcompiler.controlflow.ControlFlowBuilder;
import com.example.workflowcompiler.controlflow.StepDescriptor;
import com.example.workflowcompiler.controlflow.StructuredProgram;
import com.example.workflowcompiler.emit.ArtifactEmitter;
import com.example.workflowcompiler.emit.WorkflowCodeEmitter;
import com.example.workflowcompiler.model.CompilationMetadata;
import com.example.workflowcompiler.model.CompiledWorkflow;
import com.example.workflowcompiler.model.NodeType;
import com.example.workflowcompiler.model.WorkflowDefinition;
import com.example.workflowcompiler.model.config.SignalConfig;
import com.example.workflowcompiler.naming.IdentifierResolver;
import com.example.workflowcompiler.optimizer.OptimizedWorkflow;
import com.example.workflowcompiler.optimizer.WorkflowOptimizer;
import com.example.workflowcompiler.validation.WorkflowGraphValidationException;
import com.example.workflowcompiler.validation.WorkflowGraphValidator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Runs the pipeline: validate, optimize, structure, emit.
 * <p>
 * Validation failures stop the run before any rewriting; a structuring or rendering problem stops it before
 * any artifact is returned. Holds no per-request state, so one instance serves concurrent calls.
 * </p>
 */
public class WorkflowCompiler {

    private static final Logger log = LoggerFactory.getLogger(WorkflowCompiler.class);

    private final ArtifactEmitter workflowEmitter;
    private final ArtifactEmitter activityEmitter;
    private final ArtifactEmitter workerEmitter;
    private final ArtifactEmitter testEmitter;

    public WorkflowCompiler(ArtifactEmitter workflowEmitter, ArtifactEmitter activityEmitter,
                            ArtifactEmitter workerEmitter, ArtifactEmitter testEmitter) {
        this.workflowEmitter = Objects.requireNonNull(workflowEmitter, "workflowEmitter");
        this.activityEmitter = Objects.requireNonNull(activityEmitter, "activityEmitter");
        this.workerEmitter = Objects.requireNonNull(workerEmitter, "workerEmitter");
        this.testEmitter = Objects.requireNonNull(testEmitter, "testEmitter");
    }

    public CompilationResult compile(WorkflowDefinition definition) {
        Objects.requireNonNull(definition, "definition");
        try {
            WorkflowGraphValidator.validate(definition);
        } catch (WorkflowGraphValidationException e) {
            log.debug("Workflow '{}' rejected with {} validation failure(s)", definition.name(), e.getErrors().size());
            return CompilationResult.failed(e.getErrors());
        }
        try {
            OptimizedWorkflow optimized = WorkflowOptimizer.optimize(definition);
            StructuredProgram program = ControlFlowBuilder.build(optimized, new IdentifierResolver());
            CompilationMetadata metadata = metadata(program, optimized);
            CompiledWorkflow compiled = new CompiledWorkflow(
                    workflowEmitter.emit(program, metadata),
                    activityEmitter.emit(program, metadata),
                    workerEmitter.emit(program, metadata),
                    testEmitter.emit(program, metadata),
                    metadata);
            log.debug("Compiled workflow '{}' into package {} with {} activity(ies)",
                    definition.name(), metadata.packageName(), metadata.activities().size());
            return CompilationResult.succeeded(compiled);
        } catch (CodeGenerationException e) {
            log.debug("Code generation failed for workflow '{}': {}", definition.name(), e.getMessage());
            return CompilationResult.failed(List.of(e.getFailure()));
        }
    }

    /** Validation only; never optimizes or generates code. */
    public ValidationReport validateOnly(WorkflowDefinition definition) {
        Objects.requireNonNull(definition, "definition");
        List<CompileFailure> failures = WorkflowGraphValidator.findFailures(definition);
        List<String> errors = failures.stream().map(CompileFailure::describe).collect(Collectors.toList());
        return new ValidationReport(errors.isEmpty(), errors);
    }

    /**
     * Builds the metadata of a compiled workflow. Activities and signals are listed in tree order.
     * The estimated complexity counts the optimized nodes, excluding the start node.
     */
    public static CompilationMetadata metadata(StructuredProgram program, OptimizedWorkflow optimized) {
        Set<String> activities = new LinkedHashSet<>();
        Set<String> signals = new LinkedHashSet<>();
        for (StepDescriptor step : program.steps()) {
            if (step.type().isWork()) {
                activities.add(step.identifier());
            } else if (step.config() instanceof SignalConfig signal) {
                signals.add(signal.signalName());
            }
        }
        int complexity = (int) optimized.definition().nodes().stream()
                .filter(node -> node.nodeType() != NodeType.START)
                .count();
        return new CompilationMetadata(
                program.workflowName(),
                program.packageName(),
                new ArrayList<>(activities),
                new ArrayList<>(signals),
                List.of(WorkflowCodeEmitter.CURRENT_STEP_QUERY),
                complexity);
    }
}
