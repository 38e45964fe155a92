package com.example.workflowcompiler.compiler;

import java.util.Objects;

/**
 * A single problem with a submitted workflow: category, location ({@code nodes[n1].config.duration},
 * {@code edges[e4]}) and a human-readable message.
 */
public record CompileFailure(FailureCode code, String field, String message) {
    public CompileFailure {
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(message, "message");
    }

    /** Message prefixed with the location, as shown in editor feedback. */
    public String describe() {
        return field + ": " + message;
    }
}
