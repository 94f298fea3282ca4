package com.transitgate.domain.dataset.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Declared value type of a dataset field. The cleaner coerces raw strings into the Java type listed here.
 */
public enum FieldType {
    /** {@link String} */
    STRING,
    /** {@link BigDecimal} */
    NUMBER,
    /** {@link LocalDate} */
    DATE,
    /** {@link LocalDateTime} */
    DATETIME,
    /** {@link ServiceTime} */
    TIME;

    public boolean accepts(Object value) {
        return switch (this) {
            case STRING -> value instanceof String;
            case NUMBER -> value instanceof BigDecimal;
            case DATE -> value instanceof LocalDate;
            case DATETIME -> value instanceof LocalDateTime;
            case TIME -> value instanceof ServiceTime;
        };
    }
}
