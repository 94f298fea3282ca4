package com.transitgate.infrastructure.io.report;

import java.math.BigDecimal;

/**
 * Text form of cleaned values for CSV output and API responses.
 */
public final class ValueFormatter {

    private ValueFormatter() {
    }

    public static String format(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.toPlainString();
        }
        // LocalDate / LocalDateTime / ServiceTime print ISO-style through toString
        return value.toString();
    }
}
