package com.example.workflowcompiler.compiler;

import com.example.workflowcompiler.model.CompiledWorkflow;

import java.util.List;

/**
 * Outcome of {@link WorkflowCompiler#compile}: either all artifacts or the failures that prevented them,
 * never both.
 */
public record CompilationResult(boolean success, CompiledWorkflow compiled, List<CompileFailure> failures) {

    public CompilationResult {
        failures = failures != null ? List.copyOf(failures) : List.of();
    }

    public static CompilationResult succeeded(CompiledWorkflow compiled) {
        return new CompilationResult(true, compiled, List.of());
    }

    public static CompilationResult failed(List<CompileFailure> failures) {
        return new CompilationResult(false, null, failures);
    }
}
