package com.example.workflowcompiler.emit;

import com.example.workflowcompiler.controlflow.StructuredProgram;
import com.example.workflowcompiler.model.CompilationMetadata;

/**
 * Renders one generated source file. Implementations are stateless; the same input always yields the
 * same text.
 */
public interface ArtifactEmitter {

    /**
     * @throws com.example.workflowcompiler.controlflow.CodeGenerationException if rendering fails
     */
    String emit(StructuredProgram program, CompilationMetadata metadata);
}
