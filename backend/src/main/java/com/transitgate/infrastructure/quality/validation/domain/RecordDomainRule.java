package com.transitgate.infrastructure.quality.validation.domain;

import com.transitgate.domain.dataset.model.Dataset;
import com.transitgate.domain.dataset.model.DatasetRecord;
import com.transitgate.domain.quality.model.ValidationError;
import com.transitgate.domain.quality.model.ValidationStage;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Base for rules that look at one record at a time.
 * A record whose prerequisite fields are null is skipped: the field validator already reported it.
 */
public abstract class RecordDomainRule implements DomainRule {

    private final String ruleId;
    private final List<String> prerequisites;

    protected RecordDomainRule(String ruleId, List<String> prerequisites) {
        this.ruleId = ruleId;
        this.prerequisites = List.copyOf(prerequisites);
    }

    @Override
    public final String ruleId() {
        return ruleId;
    }

    @Override
    public final List<ValidationError> evaluate(Dataset dataset) {
        List<ValidationError> errors = new ArrayList<>();
        for (DatasetRecord record : dataset.records()) {
            if (prerequisites.stream().noneMatch(record::isNull)) {
                errors.addAll(evaluateRecord(record));
            }
        }
        return errors;
    }

    /**
     * Evaluate one record whose prerequisites are present. Values of an unexpected type (a raw string
     * the cleaner could not coerce) must be treated as "cannot evaluate" and produce no finding.
     */
    protected abstract List<ValidationError> evaluateRecord(DatasetRecord record);

    protected ValidationError violation(DatasetRecord record, String field, String message) {
        return ValidationError.of(ruleId, ValidationStage.DOMAIN, record.rowIndex(), field, message);
    }

    protected static BigDecimal number(DatasetRecord record, String field) {
        return record.get(field) instanceof BigDecimal decimal ? decimal : null;
    }
}
