package com.example.workflowcompiler.validation;

import com.example.workflowcompiler.compiler.CompileFailure;

import lombok.Getter;

import java.util.List;

/**
 * Thrown when workflow graph validation fails; carries every failure found, not just the first.
 * <p>
 * The compile facade turns it into a failed result, so it never reaches the transport layer.
 * </p>
 */
@Getter
public class WorkflowGraphValidationException extends RuntimeException {

    private final List<CompileFailure> errors;

    public WorkflowGraphValidationException(List<CompileFailure> errors) {
        super("Workflow graph validation failed: " + (errors != null ? errors.size() + " error(s)" : ""));
        this.errors = errors != null ? List.copyOf(errors) : List.of();
    }
}
