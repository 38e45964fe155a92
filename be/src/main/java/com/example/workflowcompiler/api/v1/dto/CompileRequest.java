package com.example.workflowcompiler.api.v1.dto;

import com.example.workflowcompiler.model.WorkflowDefinition;

import jakarta.validation.constraints.NotNull;

/**
 * Request body of compile and validate: {@code {"workflow": {...}}}.
 */
public record CompileRequest(@NotNull(message = "workflow is required") WorkflowDefinition workflow) {}
