package com.example.workflowcompiler.naming;

import com.example.workflowcompiler.model.NodeType;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Maps user-supplied labels to unique identifiers that are valid in the generated code.
 * <p>
 * An identifier starts with an ASCII letter and contains only ASCII letters and digits. A collision within
 * one resolver appends a numeric suffix ({@code Foo}, {@code Foo2}, {@code Foo3}). Create one resolver per
 * compile run; it is not thread-safe.
 * </p>
 */
public final class IdentifierResolver {

    /**
     * Names a package must not take: Go keywords, predeclared identifiers, and the imports and locals of the
     * generated worker, which imports the workflow package under its own name.
     */
    private static final Set<String> RESERVED_PACKAGE_NAMES = Set.of(
            "break", "case", "chan", "const", "continue", "default", "defer", "else", "fallthrough", "for",
            "func", "go", "goto", "if", "import", "interface", "map", "package", "range", "return", "select",
            "struct", "switch", "type", "var",
            "any", "bool", "byte", "comparable", "complex64", "complex128", "error", "float32", "float64",
            "int", "int8", "int16", "int32", "int64", "rune", "string", "uint", "uint8", "uint16", "uint32",
            "uint64", "uintptr", "true", "false", "iota", "nil", "append", "cap", "clear", "close", "complex",
            "copy", "delete", "imag", "len", "make", "max", "min", "new", "panic", "print", "println", "real",
            "recover",
            "main", "log", "client", "worker", "c", "w", "err");

    private final Set<String> assigned = new HashSet<>();

    /**
     * Registers names the generated code already uses so no node identifier can shadow them.
     */
    public void reserve(String... names) {
        for (String name : names) {
            assigned.add(name);
        }
    }

    /**
     * Resolves a node label. The variant decides the suffix ({@code SendEmail} becomes {@code SendEmailActivity})
     * and the fallback for labels without letters or digits ({@code UnnamedActivity}).
     */
    public String resolve(String label, NodeType variant) {
        String suffix = suffix(variant);
        String base = toPascalCase(label);
        if (base.isEmpty()) {
            base = "Unnamed";
        } else if (Character.isDigit(base.charAt(0))) {
            base = "Step" + base;
        }
        if (!base.endsWith(suffix)) {
            base = base + suffix;
        }
        return unique(base);
    }

    /**
     * Identifier for the workflow function. The function and the names derived from it ({@code <id>Input},
     * {@code <id>Output} and the generated {@code Test<id>}) are all free before the call and registered as
     * taken after it.
     */
    public String resolveWorkflow(String workflowName) {
        String base = toPascalCase(workflowName);
        if (base.isEmpty()) {
            base = "Workflow";
        } else if (Character.isDigit(base.charAt(0))) {
            base = "Workflow" + base;
        }
        String candidate = base;
        int counter = 2;
        while (anyTaken(workflowNames(candidate))) {
            candidate = base + counter;
            counter++;
        }
        reserve(workflowNames(candidate));
        return candidate;
    }

    private static String[] workflowNames(String entryPoint) {
        return new String[]{entryPoint, entryPoint + "Input", entryPoint + "Output", "Test" + entryPoint};
    }

    private boolean anyTaken(String... names) {
        for (String name : names) {
            if (assigned.contains(name)) {
                return true;
            }
        }
        return false;
    }

    private String unique(String base) {
        String candidate = base;
        int counter = 2;
        while (assigned.contains(candidate)) {
            candidate = base + counter;
            counter++;
        }
        assigned.add(candidate);
        return candidate;
    }

    /**
     * Splits on every non-alphanumeric character and capitalizes each word: {@code "send email-now"} becomes
     * {@code SendEmailNow}. Characters outside ASCII are dropped.
     */
    public static String toPascalCase(String label) {
        if (label == null) {
            return "";
        }
        StringBuilder out = new StringBuilder();
        for (String word : words(label)) {
            out.append(Character.toUpperCase(word.charAt(0)));
            out.append(word, 1, word.length());
        }
        return out.toString();
    }

    /**
     * Go package name for a workflow: lowercase words joined by {@code _}, never starting with a digit. A name
     * that is a Go keyword, a predeclared identifier or a name the worker already uses gets {@code _wf}
     * appended ({@code Worker} becomes {@code worker_wf}).
     */
    public static String packageName(String workflowName) {
        List<String> words = words(workflowName == null ? "" : workflowName);
        if (words.isEmpty()) {
            return "workflow";
        }
        String joined = String.join("_", words).toLowerCase(Locale.ROOT);
        if (Character.isDigit(joined.charAt(0))) {
            return "wf_" + joined;
        }
        return RESERVED_PACKAGE_NAMES.contains(joined) ? joined + "_wf" : joined;
    }

    /** {@code SendEmailActivity} becomes {@code sendEmailActivity}. */
    public static String lowerCamel(String identifier) {
        if (identifier.isEmpty()) {
            return identifier;
        }
        return Character.toLowerCase(identifier.charAt(0)) + identifier.substring(1);
    }

    private static List<String> words(String text) {
        List<String> words = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (isAsciiAlphanumeric(c)) {
                current.append(c);
            } else if (current.length() > 0) {
                words.add(current.toString());
                current.setLength(0);
            }
        }
        if (current.length() > 0) {
            words.add(current.toString());
        }
        return words;
    }

    private static boolean isAsciiAlphanumeric(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9');
    }

    private static String suffix(NodeType variant) {
        if (variant == null) {
            return "Step";
        }
        switch (variant) {
            case WAIT_TIMER:
                return "Timer";
            case WAIT_SIGNAL:
                return "Signal";
            case SUB_WORKFLOW:
                return "Child";
            case DECISION:
                return "Decision";
            case PARALLEL_GATEWAY:
                return "Fork";
            case PARALLEL_JOIN:
                return "Join";
            case START:
                return "Start";
            case END:
                return "End";
            default:
                return "Activity";
        }
    }
}
