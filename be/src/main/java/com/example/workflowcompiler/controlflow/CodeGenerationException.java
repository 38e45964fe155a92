package com.example.workflowcompiler.controlflow;

import com.example.workflowcompiler.compiler.CompileFailure;
import com.example.workflowcompiler.compiler.FailureCode;

import lombok.Getter;

/**
 * Thrown when a valid graph cannot be turned into code, e.g. a parallel gateway without a matching join.
 * Raised on the first problem found.
 */
@Getter
public class CodeGenerationException extends RuntimeException {

    private final CompileFailure failure;

    public CodeGenerationException(String field, String message) {
        super(field + ": " + message);
        this.failure = new CompileFailure(FailureCode.CODE_GENERATION, field, message);
    }
}
