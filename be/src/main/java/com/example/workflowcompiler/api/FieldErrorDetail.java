package com.example.workflowcompiler.api;

/**
 * One rejected request field: path and message.
 */
public record FieldErrorDetail(String field, String message) {}
