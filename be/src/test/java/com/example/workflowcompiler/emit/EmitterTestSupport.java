package com.example.workflowcompiler.emit;

import com.example.workflowcompiler.compiler.WorkflowCompiler;
import com.example.workflowcompiler.controlflow.ControlFlowBuilder;
import com.example.workflowcompiler.controlflow.StructuredProgram;
import com.example.workflowcompiler.model.CompilationMetadata;
import com.example.workflowcompiler.model.WorkflowDefinition;
import com.example.workflowcompiler.naming.IdentifierResolver;
import com.example.workflowcompiler.optimizer.WorkflowOptimizer;

/**
 * Shared setup for emitter tests: one template registry and a structured program with matching metadata.
 */
final class EmitterTestSupport {

    static final GoTemplateRegistry TEMPLATES = new GoTemplateRegistry("templates/go");

    private EmitterTestSupport() {
    }

    static StructuredProgram program(WorkflowDefinition definition) {
        return ControlFlowBuilder.build(WorkflowOptimizer.optimize(definition), new IdentifierResolver());
    }

    static CompilationMetadata metadata(WorkflowDefinition definition, StructuredProgram program) {
        return WorkflowCompiler.metadata(program, WorkflowOptimizer.optimize(definition));
    }
}
