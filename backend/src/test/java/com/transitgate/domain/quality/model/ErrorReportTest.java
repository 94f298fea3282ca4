package com.transitgate.domain.quality.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ErrorReportTest {

    private static ClassifiedError error(String ruleId, ValidationStage stage, List<Integer> rows, Severity severity) {
        return new ClassifiedError(ValidationError.of(ruleId, stage, rows, null, ruleId), severity);
    }

    @Test
    @DisplayName("Created empty and open")
    void emptyReport() {
        ErrorReport report = ErrorReport.empty();

        assertThat(report.isEmpty()).isTrue();
        assertThat(report.isFinalized()).isFalse();
        assertThat(report.decision()).isNull();
    }

    @Test
    @DisplayName("Keeps findings in append order")
    void appendOrder() {
        ErrorReport report = ErrorReport.empty();
        report.append(error("b", ValidationStage.DOMAIN, List.of(3), Severity.ERROR));
        report.appendAll(List.of(
                error("a", ValidationStage.FIELD, List.of(1), Severity.WARNING),
                error("c", ValidationStage.RELATIONAL, List.of(0), Severity.INFO)));

        assertThat(report.errors()).extracting(ClassifiedError::ruleId).containsExactly("b", "a", "c");
        assertThat(report.errorsOf(ValidationStage.FIELD)).extracting(ClassifiedError::ruleId).containsExactly("a");
    }

    @Test
    @DisplayName("Finalized once, read-only afterwards")
    void lifecycle() {
        ErrorReport report = ErrorReport.empty();
        report.append(error("a", ValidationStage.FIELD, List.of(1), Severity.WARNING));
        report.finalizeWith(Decision.PASS_WITH_WARNINGS);

        assertThat(report.isFinalized()).isTrue();
        assertThat(report.decision()).isEqualTo(Decision.PASS_WITH_WARNINGS);
        assertThatThrownBy(() -> report.finalizeWith(Decision.HALT)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> report.append(error("b", ValidationStage.FIELD, List.of(2), Severity.ERROR)))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> report.errors().clear()).isInstanceOf(UnsupportedOperationException.class);
        assertThat(report.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("Per-severity counts and per-rule summaries")
    void summaries() {
        ErrorReport report = ErrorReport.empty();
        report.appendAll(List.of(
                error("field.Weight.required", ValidationStage.FIELD, List.of(4), Severity.CRITICAL),
                error("weight.overweight", ValidationStage.DOMAIN, List.of(7), Severity.WARNING),
                error("field.Weight.required", ValidationStage.FIELD, List.of(2), Severity.CRITICAL),
                error("primary_reference.duplicate", ValidationStage.RELATIONAL, List.of(2, 9), Severity.CRITICAL)));

        assertThat(report.count(Severity.CRITICAL)).isEqualTo(3);
        assertThat(report.severityCounts()).containsEntry(Severity.WARNING, 1L).containsEntry(Severity.INFO, 0L);

        List<RuleSummary> summaries = report.summarizeByRule();
        assertThat(summaries).extracting(RuleSummary::ruleId)
                .containsExactly("field.Weight.required", "weight.overweight", "primary_reference.duplicate");
        assertThat(summaries.get(0).count()).isEqualTo(2);
        assertThat(summaries.get(0).rowIndices()).containsExactly(2, 4);
        assertThat(summaries.get(2).rowIndices()).containsExactly(2, 9);
    }
}
