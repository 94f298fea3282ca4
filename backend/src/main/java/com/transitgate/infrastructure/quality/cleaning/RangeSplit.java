package com.transitgate.infrastructure.quality.cleaning;

import java.util.regex.Pattern;

/**
 * Splits one "start{separator}end" column into two columns, e.g.
 * {@code Target Ship (Range) = "1/5/2024 - 1/7/2024"} into {@code Ship Start} and {@code Ship End}.
 * <p>
 * The source column is kept. A value without the separator fills only the start column;
 * a null source clears both targets so the field validator reports them.
 * </p>
 */
public record RangeSplit(
        String sourceField,
        String separator,
        String startField,
        String endField
) {
    public RangeSplit {
        requireText(sourceField, "sourceField");
        requireText(startField, "startField");
        requireText(endField, "endField");
        if (separator == null || separator.isEmpty()) {
            throw new IllegalArgumentException("separator must not be empty: " + sourceField);
        }
    }

    /**
     * @return {start, end}, each trimmed and null when absent
     */
    String[] split(String value) {
        String[] parts = value.split(Pattern.quote(separator), -1);
        String start = parts[0].strip();
        String end = parts.length > 1 ? parts[1].strip() : null;
        return new String[]{start, end};
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
    }
}
