package com.transitgate.infrastructure.quality.classification;

import com.transitgate.domain.quality.model.ClassifiedError;
import com.transitgate.domain.quality.model.Severity;
import com.transitgate.domain.quality.model.ValidationError;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves the severity of every finding from its rule id alone.
 * Ids missing from the table get the policy default and are logged, never dropped.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ErrorClassifier {

    private final SeverityTable severityTable;

    /**
     * @param errors          findings in report order
     * @param defaultSeverity severity for ids without a table entry
     * @return one classified error per input, same order
     */
    public List<ClassifiedError> classify(List<ValidationError> errors, Severity defaultSeverity) {
        List<ClassifiedError> classified = new ArrayList<>(errors.size());
        Map<String, Severity> resolved = new HashMap<>();

        for (ValidationError error : errors) {
            Severity severity = resolved.computeIfAbsent(error.ruleId(), ruleId -> resolve(ruleId, defaultSeverity));
            classified.add(new ClassifiedError(error, severity));
        }
        return classified;
    }

    private Severity resolve(String ruleId, Severity defaultSeverity) {
        Optional<Severity> severity = severityTable.lookup(ruleId);
        if (severity.isPresent()) {
            return severity.get();
        }
        log.warn("[Classifier] No severity entry for rule '{}', classified as {}", ruleId, defaultSeverity);
        return defaultSeverity;
    }
}
