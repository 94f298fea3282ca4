package com.transitgate.infrastructure.quality.validation.domain;

import com.transitgate.domain.dataset.model.DatasetRecord;
import com.transitgate.domain.quality.model.ValidationError;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Distances, durations and weights cannot be negative; with {@code strict} they must be positive.
 * Each listed field is checked independently, so a null in one does not hide a violation in another.
 */
public class NonNegativeRule extends RecordDomainRule {

    private final List<String> fields;
    private final boolean strict;

    public NonNegativeRule(String ruleId, List<String> fields, boolean strict) {
        super(ruleId, List.of());
        this.fields = List.copyOf(fields);
        this.strict = strict;
    }

    @Override
    protected List<ValidationError> evaluateRecord(DatasetRecord record) {
        List<ValidationError> errors = new ArrayList<>();
        for (String field : fields) {
            BigDecimal value = number(record, field);
            if (value == null) {
                continue;
            }
            if (strict ? value.signum() <= 0 : value.signum() < 0) {
                errors.add(violation(record, field, String.format("%s %s must be %s",
                        field, value.toPlainString(), strict ? "positive" : "non-negative")));
            }
        }
        return errors;
    }
}
