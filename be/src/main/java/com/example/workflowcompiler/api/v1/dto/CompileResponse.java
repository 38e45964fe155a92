package com.example.workflowcompiler.api.v1.dto;

import com.example.workflowcompiler.compiler.CompilationResult;
import com.example.workflowcompiler.compiler.CompileFailure;
import com.example.workflowcompiler.model.CompiledWorkflow;

import java.util.List;

/**
 * Compile result: artifacts on success, failures otherwise. Always returned with 200.
 */
public record CompileResponse(boolean success, CompiledWorkflow compiled, List<CompileFailure> errors) {

    public static CompileResponse from(CompilationResult result) {
        return new CompileResponse(result.success(), result.compiled(), result.failures());
    }
}
