package com.example.workflowcompiler.model.config;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses duration strings used in node configuration and retry policies.
 * <p>
 * Accepts unit sequences ({@code 1h30m}, {@code 500ms}, {@code 1.5s}, {@code 2d}) and ISO-8601
 * ({@code PT10M}). Bare numbers are seconds.
 * </p>
 */
public final class DurationParser {

    private static final Pattern WHOLE = Pattern.compile("(\\d+(\\.\\d+)?(ms|s|m|h|d))+");
    private static final Pattern PART = Pattern.compile("(\\d+(?:\\.\\d+)?)(ms|s|m|h|d)");
    private static final Pattern NUMBER = Pattern.compile("\\d+(\\.\\d+)?");

    private DurationParser() {
    }

    /**
     * @throws IllegalArgumentException if the text is not a recognised duration
     */
    public static Duration parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("duration is empty");
        }
        String value = text.trim();
        if (value.startsWith("P") || value.startsWith("p")) {
            try {
                return Duration.parse(value.toUpperCase(Locale.ROOT));
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException("invalid ISO-8601 duration '" + text + "'", e);
            }
        }
        if (NUMBER.matcher(value).matches()) {
            return millis(new BigDecimal(value).multiply(BigDecimal.valueOf(1000)));
        }
        if (!WHOLE.matcher(value).matches()) {
            throw new IllegalArgumentException("invalid duration '" + text + "'; expected e.g. 30s, 5m, 1h30m or PT5M");
        }
        BigDecimal totalMillis = BigDecimal.ZERO;
        Matcher m = PART.matcher(value);
        while (m.find()) {
            BigDecimal amount = new BigDecimal(m.group(1));
            totalMillis = totalMillis.add(amount.multiply(BigDecimal.valueOf(unitMillis(m.group(2)))));
        }
        return millis(totalMillis);
    }

    private static long unitMillis(String unit) {
        switch (unit) {
            case "ms":
                return 1L;
            case "s":
                return 1_000L;
            case "m":
                return 60_000L;
            case "h":
                return 3_600_000L;
            case "d":
                return 86_400_000L;
            default:
                throw new IllegalArgumentException("unknown duration unit: " + unit);
        }
    }

    private static Duration millis(BigDecimal totalMillis) {
        try {
            return Duration.ofMillis(totalMillis.setScale(0, RoundingMode.DOWN).longValueExact());
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("duration is too large: " + totalMillis.toPlainString() + "ms", e);
        }
    }
}
