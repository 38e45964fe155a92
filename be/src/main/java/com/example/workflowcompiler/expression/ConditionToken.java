package com.example.workflowcompiler.expression;

/**
 * One lexical token of a condition expression.
 */
public record ConditionToken(Kind kind, String text) {

    public enum Kind {
        IDENTIFIER,
        NUMBER,
        STRING,
        LITERAL,
        OPERATOR,
        OPEN_PAREN,
        CLOSE_PAREN
    }
}
