package com.example.workflowcompiler.expression;

/**
 * Thrown when a condition expression cannot be tokenized or is structurally malformed.
 */
public class ConditionParseException extends RuntimeException {

    public ConditionParseException(String message) {
        super(message);
    }
}
