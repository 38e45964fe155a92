package com.example.workflowcompiler.model;

import java.math.BigInteger;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Declared type of a workflow variable, resolved from the {@code var_type} string and its aliases.
 */
public enum VariableType {
    STRING("string", "text"),
    NUMBER("number", "float", "double", "decimal"),
    INTEGER("integer", "int", "long"),
    BOOLEAN("boolean", "bool"),
    OBJECT("object", "map", "json"),
    ARRAY("array", "list"),
    ANY("any");

    private final List<String> names;

    VariableType(String... names) {
        this.names = List.of(names);
    }

    public static Optional<VariableType> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String key = name.trim().toLowerCase(Locale.ROOT);
        for (VariableType type : values()) {
            if (type.names.contains(key)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    /** Whether a JSON default value fits this type; {@code null} always fits. */
    public boolean accepts(Object value) {
        if (value == null) {
            return true;
        }
        switch (this) {
            case STRING:
                return value instanceof String;
            case NUMBER:
                return value instanceof Number;
            case INTEGER:
                return value instanceof Integer || value instanceof Long
                        || value instanceof BigInteger || value instanceof Short;
            case BOOLEAN:
                return value instanceof Boolean;
            case OBJECT:
                return value instanceof Map;
            case ARRAY:
                return value instanceof List;
            default:
                return true;
        }
    }
}
