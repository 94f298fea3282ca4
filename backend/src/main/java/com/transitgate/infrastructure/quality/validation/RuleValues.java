package com.transitgate.infrastructure.quality.validation;

import com.transitgate.domain.dataset.model.ServiceTime;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.OptionalInt;

/**
 * Helpers shared by rules that compare or index raw field values.
 */
public final class RuleValues {

    private RuleValues() {
    }

    /**
     * Canonical lookup key of a value, so that "12", 12 and 12.0 index the same way.
     *
     * @return the key, or null for a null value
     */
    public static String keyOf(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof BigDecimal decimal) {
            return canonical(decimal);
        }
        if (value instanceof Number number) {
            try {
                return canonical(new BigDecimal(number.toString()));
            } catch (NumberFormatException e) {
                return number.toString();
            }
        }
        return value.toString();
    }

    /**
     * Canonical numeric key of a number or a numeric-looking string, so that "07", "7.0" and 7 match.
     *
     * @return the key, or null when the value is not a number
     */
    public static String numericKeyOf(Object value) {
        if (value instanceof Number) {
            return keyOf(value);
        }
        if (!(value instanceof String text) || text.isBlank()) {
            return null;
        }
        try {
            return canonical(new BigDecimal(text.strip()));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Compare two values of the same cleaned type: {@link BigDecimal}, {@link LocalDate},
     * {@link LocalDateTime}, {@link ServiceTime} or {@link String}.
     *
     * @return the comparison, or empty when the values cannot be ordered against each other
     */
    public static OptionalInt compare(Object left, Object right) {
        if (left instanceof BigDecimal l && right instanceof BigDecimal r) {
            return OptionalInt.of(l.compareTo(r));
        }
        if (left instanceof LocalDateTime l && right instanceof LocalDateTime r) {
            return OptionalInt.of(l.compareTo(r));
        }
        if (left instanceof LocalDate l && right instanceof LocalDate r) {
            return OptionalInt.of(l.compareTo(r));
        }
        if (left instanceof ServiceTime l && right instanceof ServiceTime r) {
            return OptionalInt.of(l.compareTo(r));
        }
        if (left instanceof String l && right instanceof String r) {
            return OptionalInt.of(l.compareTo(r));
        }
        return OptionalInt.empty();
    }

    private static String canonical(BigDecimal decimal) {
        return decimal.signum() == 0 ? "0" : decimal.stripTrailingZeros().toPlainString();
    }
}
