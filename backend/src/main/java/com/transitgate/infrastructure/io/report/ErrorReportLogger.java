package com.transitgate.infrastructure.io.report;

import com.transitgate.domain.quality.model.ClassifiedError;
import com.transitgate.domain.quality.model.ErrorReport;
import com.transitgate.domain.quality.model.RuleSummary;
import com.transitgate.domain.quality.model.Severity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Writes a finalized report to the application log: one line per finding at a level matching its
 * severity, then one summary line per rule. Called before the decision is acted upon.
 */
@Slf4j
@Component
public class ErrorReportLogger {

    public void log(String datasetName, ErrorReport report) {
        for (ClassifiedError error : report.errors()) {
            logAt(error.severity(), "[{}] {} {} rows={} field={} - {}",
                    error.stage().wireName(), error.severity(), error.ruleId(),
                    error.rowIndices(), error.field(), error.message());
        }

        for (RuleSummary summary : report.summarizeByRule()) {
            logAt(summary.severity(), "[Summary] {} ({}) - rows affected: {}, indices: {}",
                    summary.ruleId(), summary.severity(), summary.count(), summary.rowIndices());
        }

        log.info("[Report] {}: {} findings {} -> {}",
                datasetName, report.size(), report.severityCounts(), report.decision());
    }

    private void logAt(Severity severity, String format, Object... args) {
        switch (severity) {
            case INFO -> log.info(format, args);
            case WARNING -> log.warn(format, args);
            case ERROR, CRITICAL -> log.error(format, args);
        }
    }
}
