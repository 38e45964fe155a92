package com.example.workflowcompiler.compiler;

/**
 * Machine-readable category of a {@link CompileFailure}.
 */
public enum FailureCode {
    EMPTY_WORKFLOW,
    INVALID_NODE,
    DUPLICATE_NODE_ID,
    INVALID_EDGE,
    DUPLICATE_EDGE_ID,
    DANGLING_EDGE,
    MISSING_START,
    MULTIPLE_START,
    INVALID_START,
    MISSING_END,
    UNREACHABLE_END,
    INVALID_END,
    MULTIPLE_SUCCESSORS,
    CONDITION_NOT_ALLOWED,
    INVALID_DECISION,
    INVALID_CONDITION,
    UNDECLARED_VARIABLE,
    INVALID_FORK,
    INVALID_JOIN,
    ORPHAN_JOIN,
    CYCLE_DETECTED,
    INVALID_CONFIG,
    INVALID_VARIABLE,
    INVALID_TRIGGER,
    CODE_GENERATION
}
