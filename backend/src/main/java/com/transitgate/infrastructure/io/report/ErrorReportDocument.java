package com.transitgate.infrastructure.io.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.transitgate.domain.quality.model.ClassifiedError;
import com.transitgate.domain.quality.model.ErrorReport;
import com.transitgate.domain.quality.model.RuleSummary;
import com.transitgate.domain.quality.model.Severity;

import java.util.List;
import java.util.Map;

/**
 * Serialized form of an {@link ErrorReport}; the contract downstream consumers parse.
 */
@JsonPropertyOrder({"dataset", "decision", "severity_counts", "errors", "summary"})
public record ErrorReportDocument(
        String dataset,
        String decision,
        @JsonProperty("severity_counts") Map<Severity, Long> severityCounts,
        List<Entry> errors,
        List<RuleSummaryEntry> summary
) {

    @JsonPropertyOrder({"rule_id", "stage", "row_indices", "field", "severity", "message"})
    @JsonInclude(JsonInclude.Include.ALWAYS)
    public record Entry(
            @JsonProperty("rule_id") String ruleId,
            String stage,
            @JsonProperty("row_indices") List<Integer> rowIndices,
            String field,
            String severity,
            String message
    ) {
        static Entry from(ClassifiedError error) {
            return new Entry(error.ruleId(), error.stage().wireName(), error.rowIndices(),
                    error.field(), error.severity().name(), error.message());
        }
    }

    @JsonPropertyOrder({"rule_id", "severity", "count", "row_indices"})
    public record RuleSummaryEntry(
            @JsonProperty("rule_id") String ruleId,
            String severity,
            int count,
            @JsonProperty("row_indices") List<Integer> rowIndices
    ) {
        static RuleSummaryEntry from(RuleSummary summary) {
            return new RuleSummaryEntry(summary.ruleId(), summary.severity().name(),
                    summary.count(), summary.rowIndices());
        }
    }

    public static ErrorReportDocument from(String datasetName, ErrorReport report) {
        return new ErrorReportDocument(
                datasetName,
                report.decision() != null ? report.decision().name() : null,
                report.severityCounts(),
                report.errors().stream().map(Entry::from).toList(),
                report.summarizeByRule().stream().map(RuleSummaryEntry::from).toList());
    }
}
