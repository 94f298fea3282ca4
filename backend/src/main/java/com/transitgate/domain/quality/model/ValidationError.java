package com.transitgate.domain.quality.model;

import java.util.List;
import java.util.Objects;

/**
 * A single problem found by a validator, before severity is resolved.
 *
 * @param ruleId      id of the rule that fired; the only key used for classification
 * @param stage       stage that raised the finding
 * @param rowIndices  rows the finding is attributed to (one for field/domain record rules, several for grouped rules)
 * @param field       offending field (nullable for multi-field rules)
 * @param message     human-readable description
 * @param rawSeverity optional hint from the rule itself (nullable); informational only
 */
public record ValidationError(
        String ruleId,
        ValidationStage stage,
        List<Integer> rowIndices,
        String field,
        String message,
        Severity rawSeverity
) {
    public ValidationError {
        Objects.requireNonNull(ruleId, "ruleId");
        Objects.requireNonNull(stage, "stage");
        Objects.requireNonNull(message, "message");
        rowIndices = List.copyOf(rowIndices);
    }

    public static ValidationError of(String ruleId, ValidationStage stage, int rowIndex,
                                     String field, String message) {
        return new ValidationError(ruleId, stage, List.of(rowIndex), field, message, null);
    }

    public static ValidationError of(String ruleId, ValidationStage stage, List<Integer> rowIndices,
                                     String field, String message) {
        return new ValidationError(ruleId, stage, rowIndices, field, message, null);
    }

    /**
     * First attributed row, or -1 for dataset-wide findings.
     */
    public int firstRow() {
        return rowIndices.isEmpty() ? -1 : rowIndices.get(0);
    }
}
