package com.example.workflowcompiler.model;

/**
 * Editor canvas position. Carried through the wire format, ignored by the compiler.
 */
public record Position(Double x, Double y) {}
