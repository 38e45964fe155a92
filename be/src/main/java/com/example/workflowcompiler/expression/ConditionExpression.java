package com.example.workflowcompiler.expression;

import com.example.workflowcompiler.expression.ConditionToken.Kind;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A boolean condition on a decision edge, e.g. {@code amount > 100 and status == "open"}.
 * <p>
 * Parsing tokenizes the text, normalizes keyword operators ({@code and}, {@code or}, {@code not}, a lone
 * {@code =}) to their symbolic form and checks the token sequence is a well-formed expression. The
 * target-language rendering lives with the emitters.
 * </p>
 */
public final class ConditionExpression {

    private static final Map<String, String> KEYWORD_OPERATORS = Map.of(
            "and", "&&",
            "or", "||",
            "not", "!"
    );
    private static final Set<String> LITERALS = Set.of("true", "false", "null");
    private static final Set<String> BINARY_OPERATORS = Set.of("==", "!=", "<", "<=", ">", ">=", "&&", "||");

    private final String source;
    private final List<ConditionToken> tokens;

    private ConditionExpression(String source, List<ConditionToken> tokens) {
        this.source = source;
        this.tokens = List.copyOf(tokens);
    }

    /**
     * @throws ConditionParseException if the text is blank, contains an unknown character or is malformed
     */
    public static ConditionExpression parse(String text) {
        if (text == null || text.isBlank()) {
            throw new ConditionParseException("condition is empty");
        }
        List<ConditionToken> tokens = tokenize(text);
        new Checker(tokens).check();
        return new ConditionExpression(text.trim(), tokens);
    }

    public String source() {
        return source;
    }

    public List<ConditionToken> tokens() {
        return tokens;
    }

    /** Variable names referenced by the expression, in order of first appearance. */
    public Set<String> variables() {
        Set<String> names = new LinkedHashSet<>();
        for (ConditionToken token : tokens) {
            if (token.kind() == Kind.IDENTIFIER) {
                names.add(token.text());
            }
        }
        return names;
    }

    /** Whitespace- and keyword-insensitive form, used to detect duplicate conditions. */
    public String normalized() {
        return tokens.stream()
                .map(t -> t.kind() == Kind.STRING ? "\"" + t.text() + "\"" : t.text())
                .collect(Collectors.joining(" "));
    }

    @Override
    public String toString() {
        return source;
    }

    private static List<ConditionToken> tokenize(String text) {
        List<ConditionToken> tokens = new ArrayList<>();
        int i = 0;
        int n = text.length();
        while (i < n) {
            char c = text.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (c == '(') {
                tokens.add(new ConditionToken(Kind.OPEN_PAREN, "("));
                i++;
            } else if (c == ')') {
                tokens.add(new ConditionToken(Kind.CLOSE_PAREN, ")"));
                i++;
            } else if (c == '"' || c == '\'') {
                int end = text.indexOf(c, i + 1);
                if (end < 0) {
                    throw new ConditionParseException("unterminated string literal at position " + i);
                }
                tokens.add(new ConditionToken(Kind.STRING, text.substring(i + 1, end)));
                i = end + 1;
            } else if (Character.isDigit(c)) {
                int start = i;
                while (i < n && (Character.isDigit(text.charAt(i)) || text.charAt(i) == '.')) {
                    i++;
                }
                String number = text.substring(start, i);
                if (number.endsWith(".") || number.indexOf('.') != number.lastIndexOf('.')) {
                    throw new ConditionParseException("invalid number '" + number + "'");
                }
                tokens.add(new ConditionToken(Kind.NUMBER, number));
            } else if (Character.isLetter(c) || c == '_') {
                int start = i;
                while (i < n && (Character.isLetterOrDigit(text.charAt(i)) || text.charAt(i) == '_')) {
                    i++;
                }
                String word = text.substring(start, i);
                String lower = word.toLowerCase(Locale.ROOT);
                if (KEYWORD_OPERATORS.containsKey(lower)) {
                    tokens.add(new ConditionToken(Kind.OPERATOR, KEYWORD_OPERATORS.get(lower)));
                } else if (LITERALS.contains(lower)) {
                    tokens.add(new ConditionToken(Kind.LITERAL, lower));
                } else {
                    tokens.add(new ConditionToken(Kind.IDENTIFIER, word));
                }
            } else {
                i = operator(text, i, tokens);
            }
        }
        return tokens;
    }

    private static int operator(String text, int i, List<ConditionToken> tokens) {
        String two = i + 1 < text.length() ? text.substring(i, i + 2) : "";
        if (two.equals("==") || two.equals("!=") || two.equals("<=") || two.equals(">=")
                || two.equals("&&") || two.equals("||")) {
            tokens.add(new ConditionToken(Kind.OPERATOR, two));
            return i + 2;
        }
        char c = text.charAt(i);
        if (c == '<' || c == '>' || c == '!') {
            tokens.add(new ConditionToken(Kind.OPERATOR, String.valueOf(c)));
            return i + 1;
        }
        if (c == '=') {
            tokens.add(new ConditionToken(Kind.OPERATOR, "=="));
            return i + 1;
        }
        throw new ConditionParseException("unexpected character '" + c + "' at position " + i);
    }

    /**
     * Recursive descent over: expr := unary (binop unary)* ; unary := '!'* primary ; primary := operand | '(' expr ')'.
     */
    private static final class Checker {

        private final List<ConditionToken> tokens;
        private int pos;

        Checker(List<ConditionToken> tokens) {
            this.tokens = tokens;
        }

        void check() {
            expression();
            if (pos < tokens.size()) {
                throw new ConditionParseException("unexpected '" + tokens.get(pos).text() + "'");
            }
        }

        private void expression() {
            unary();
            while (pos < tokens.size() && isBinary(tokens.get(pos))) {
                pos++;
                unary();
            }
        }

        private void unary() {
            while (pos < tokens.size() && tokens.get(pos).kind() == Kind.OPERATOR && tokens.get(pos).text().equals("!")) {
                pos++;
            }
            primary();
        }

        private void primary() {
            if (pos >= tokens.size()) {
                throw new ConditionParseException("expression ends unexpectedly");
            }
            ConditionToken token = tokens.get(pos);
            switch (token.kind()) {
                case IDENTIFIER:
                case NUMBER:
                case STRING:
                case LITERAL:
                    pos++;
                    return;
                case OPEN_PAREN:
                    pos++;
                    expression();
                    if (pos >= tokens.size() || tokens.get(pos).kind() != Kind.CLOSE_PAREN) {
                        throw new ConditionParseException("missing ')'");
                    }
                    pos++;
                    return;
                default:
                    throw new ConditionParseException("unexpected '" + token.text() + "'");
            }
        }

        private static boolean isBinary(ConditionToken token) {
            return token.kind() == Kind.OPERATOR && BINARY_OPERATORS.contains(token.text());
        }
    }
}
