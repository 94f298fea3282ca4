package com.transitgate.domain.quality.model;

import java.util.List;

/**
 * Aggregate of all findings raised by one rule in a run.
 *
 * @param ruleId     the rule
 * @param severity   resolved severity (identical for every finding of a rule)
 * @param count      number of findings
 * @param rowIndices distinct affected rows, ascending
 */
public record RuleSummary(
        String ruleId,
        Severity severity,
        int count,
        List<Integer> rowIndices
) {
    public RuleSummary {
        rowIndices = List.copyOf(rowIndices);
    }
}
