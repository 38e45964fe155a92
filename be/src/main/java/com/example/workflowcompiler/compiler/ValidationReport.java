package com.example.workflowcompiler.compiler;

import java.util.List;

/**
 * Result of a validation-only run. {@code errors} holds one {@link CompileFailure#describe()} line per failure.
 */
public record ValidationReport(boolean valid, List<String> errors) {
    public ValidationReport {
        errors = errors != null ? List.copyOf(errors) : List.of();
    }
}
