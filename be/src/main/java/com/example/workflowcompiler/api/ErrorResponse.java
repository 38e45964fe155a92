package com.example.workflowcompiler.api;

import java.util.List;

/**
 * Standard error response body (4xx/5xx): message and optional field errors.
 */
public record ErrorResponse(String message, List<FieldErrorDetail> errors) {

    public ErrorResponse(String message) {
        this(message, null);
    }

    public static ErrorResponse withErrors(String message, List<FieldErrorDetail> errors) {
        return new ErrorResponse(message, errors != null ? List.copyOf(errors) : null);
    }
}
