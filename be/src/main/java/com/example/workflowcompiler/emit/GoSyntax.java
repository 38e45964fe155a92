package com.example.workflowcompiler.emit;

import com.example.workflowcompiler.expression.ConditionExpression;
import com.example.workflowcompiler.expression.ConditionToken;
import com.example.workflowcompiler.model.VariableType;
import com.example.workflowcompiler.naming.IdentifierResolver;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Go source fragments: string literals, durations, types, value literals and condition expressions.
 */
public final class GoSyntax {

    private GoSyntax() {
    }

    /** Go interpreted string literal. */
    public static String quote(String text) {
        StringBuilder out = new StringBuilder("\"");
        String value = text != null ? text : "";
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"':
                    out.append("\\\"");
                    break;
                case '\\':
                    out.append("\\\\");
                    break;
                case '\n':
                    out.append("\\n");
                    break;
                case '\r':
                    out.append("\\r");
                    break;
                case '\t':
                    out.append("\\t");
                    break;
                default:
                    if (c < 0x20 || c == 0x7f) {
                        out.append(String.format("\\x%02x", (int) c));
                    } else {
                        out.append(c);
                    }
            }
        }
        return out.append('"').toString();
    }

    /** Single-line comment text: line breaks collapse to spaces. */
    public static String comment(String text) {
        if (text == null) {
            return "";
        }
        return text.replaceAll("[\\r\\n]+", " ").trim();
    }

    /** {@code 90s} renders as {@code 90 * time.Second}, {@code 1h} as {@code time.Hour}. */
    public static String duration(Duration duration) {
        long millis = duration.toMillis();
        if (millis % 3_600_000 == 0) {
            return scaled(millis / 3_600_000, "time.Hour");
        }
        if (millis % 60_000 == 0) {
            return scaled(millis / 60_000, "time.Minute");
        }
        if (millis % 1_000 == 0) {
            return scaled(millis / 1_000, "time.Second");
        }
        return scaled(millis, "time.Millisecond");
    }

    private static String scaled(long amount, String unit) {
        return amount == 1 ? unit : amount + " * " + unit;
    }

    public static String goType(VariableType type) {
        switch (type) {
            case STRING:
                return "string";
            case NUMBER:
                return "float64";
            case INTEGER:
                return "int64";
            case BOOLEAN:
                return "bool";
            case OBJECT:
                return "map[string]interface{}";
            case ARRAY:
                return "[]interface{}";
            default:
                return "interface{}";
        }
    }

    /**
     * Go literal for a JSON value. Objects and arrays become {@code map[string]interface{}} and
     * {@code []interface{}} composite literals; {@code null} becomes {@code nil}.
     */
    public static String literal(Object value) {
        if (value == null) {
            return "nil";
        }
        if (value instanceof String text) {
            return quote(text);
        }
        if (value instanceof Boolean || value instanceof Number) {
            return String.valueOf(value);
        }
        if (value instanceof Map<?, ?> map) {
            List<String> entries = new ArrayList<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                entries.add(quote(String.valueOf(entry.getKey())) + ": " + literal(entry.getValue()));
            }
            return "map[string]interface{}{" + String.join(", ", entries) + "}";
        }
        if (value instanceof List<?> list) {
            List<String> items = new ArrayList<>();
            for (Object item : list) {
                items.add(literal(item));
            }
            return "[]interface{}{" + String.join(", ", items) + "}";
        }
        return quote(String.valueOf(value));
    }

    /**
     * Renders a condition over the workflow state: {@code amount > 100 and approved} becomes
     * {@code state.Amount > 100 && state.Approved}.
     */
    public static String condition(ConditionExpression expression, String stateVariable) {
        StringBuilder out = new StringBuilder();
        ConditionToken previous = null;
        for (ConditionToken token : expression.tokens()) {
            String text = render(token, stateVariable);
            if (previous != null && needsSpace(previous, token)) {
                out.append(' ');
            }
            out.append(text);
            previous = token;
        }
        return out.toString();
    }

    private static String render(ConditionToken token, String stateVariable) {
        switch (token.kind()) {
            case IDENTIFIER:
                return stateVariable + "." + IdentifierResolver.toPascalCase(token.text());
            case STRING:
                return quote(token.text());
            case LITERAL:
                return "null".equals(token.text()) ? "nil" : token.text();
            default:
                return token.text();
        }
    }

    private static boolean needsSpace(ConditionToken previous, ConditionToken current) {
        if (previous.kind() == ConditionToken.Kind.OPEN_PAREN || current.kind() == ConditionToken.Kind.CLOSE_PAREN) {
            return false;
        }
        return !(previous.kind() == ConditionToken.Kind.OPERATOR && "!".equals(previous.text()));
    }
}
