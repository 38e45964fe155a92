package com.example.workflowcompiler.controlflow;

import com.example.workflowcompiler.model.VariableType;

/**
 * A workflow variable as it appears in generated code: {@code fieldName} is the exported field of the
 * input and state types.
 */
public record ProgramVariable(String name, String fieldName, VariableType type, Object defaultValue) {
}
