package com.transitgate.interfaces.api.dto;

import com.transitgate.domain.dataset.model.DatasetRecord;
import com.transitgate.domain.quality.model.QualityGateResult;
import com.transitgate.infrastructure.io.report.ErrorReportDocument;
import com.transitgate.infrastructure.io.report.ValueFormatter;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * @param report         the full error report
 * @param cleanedRecords cleaned rows, or null when the run halted
 */
public record QualityGateRunResponse(
        String decision,
        ErrorReportDocument report,
        List<Map<String, String>> cleanedRecords
) {
    public static QualityGateRunResponse from(QualityGateResult result) {
        List<Map<String, String>> cleaned = result.halted()
                ? null
                : result.cleanedDataset().records().stream().map(QualityGateRunResponse::format).toList();
        return new QualityGateRunResponse(
                result.decision().name(),
                ErrorReportDocument.from(result.cleanedDataset().name(), result.errorReport()),
                cleaned);
    }

    private static Map<String, String> format(DatasetRecord record) {
        Map<String, String> row = new LinkedHashMap<>();
        record.fields().forEach((field, value) -> row.put(field, value == null ? null : ValueFormatter.format(value)));
        return row;
    }
}
