package com.property.reconciliation.validation;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Locale-invariant conversions from raw cell text. Every method returns empty for
 * blank or malformed input instead of throwing.
 */
public final class ValueCoercer {

    private static final DateTimeFormatter ISO_DATE = DateTimeFormatter.ofPattern("uuuu-MM-dd")
            .withResolverStyle(ResolverStyle.STRICT);
    private static final Pattern NUMBER = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");
    private static final Pattern EMAIL = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");

    private ValueCoercer() {
    }

    public static Optional<BigDecimal> parseDecimal(String raw) {
        String value = trimToNull(raw);
        if (value == null || !NUMBER.matcher(value).matches()) {
            return Optional.empty();
        }
        try {
            return Optional.of(new BigDecimal(value));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    /**
     * Parses a whole number. Values such as {@code "4.0"} are accepted, {@code "4.5"} is not.
     */
    public static Optional<Integer> parseInteger(String raw) {
        return parseDecimal(raw).flatMap(d -> {
            try {
                return Optional.of(d.stripTrailingZeros().intValueExact());
            } catch (ArithmeticException e) {
                return Optional.empty();
            }
        });
    }

    /**
     * Parses a strict calendar date: {@code 2024-02-30} and {@code 2024-1-5} are rejected.
     */
    public static Optional<LocalDate> parseDate(String raw) {
        String value = trimToNull(raw);
        if (value == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(LocalDate.parse(value, ISO_DATE));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    public static Optional<String> parseEmail(String raw) {
        String value = trimToNull(raw);
        if (value == null || !EMAIL.matcher(value).matches()) {
            return Optional.empty();
        }
        return Optional.of(value);
    }

    public static List<String> parseList(String raw) {
        String value = trimToNull(raw);
        if (value == null) {
            return List.of();
        }
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    static String trimToNull(String raw) {
        if (raw == null) {
            return null;
        }
        String trimmed = raw.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
