package com.transitgate.infrastructure.quality.validation.field;

import java.util.Optional;

/**
 * One check on a single field value.
 */
interface FieldRule {

    /**
     * Check name; the rule id is {@code field.<field>.<check>}.
     */
    String check();

    /**
     * @return violation message, or empty when the value passes
     */
    Optional<String> evaluate(Object value);

    /**
     * Whether the rule is also evaluated for null values. Only the presence check is.
     */
    default boolean appliesToNull() {
        return false;
    }

    /**
     * Whether a violation makes the remaining checks of the field meaningless.
     */
    default boolean stopsFieldOnViolation() {
        return false;
    }
}
