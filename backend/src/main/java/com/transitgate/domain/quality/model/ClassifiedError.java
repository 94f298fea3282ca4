package com.transitgate.domain.quality.model;

import java.util.List;
import java.util.Objects;

/**
 * A finding with its resolved severity.
 *
 * @param error    the original finding, untouched
 * @param severity severity resolved from the rule id by the classifier
 */
public record ClassifiedError(
        ValidationError error,
        Severity severity
) {
    public ClassifiedError {
        Objects.requireNonNull(error, "error");
        Objects.requireNonNull(severity, "severity");
    }

    public String ruleId() {
        return error.ruleId();
    }

    public ValidationStage stage() {
        return error.stage();
    }

    public List<Integer> rowIndices() {
        return error.rowIndices();
    }

    public String field() {
        return error.field();
    }

    public String message() {
        return error.message();
    }
}
