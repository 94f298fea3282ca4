package com.transitgate.infrastructure.quality.validation.domain;

import com.transitgate.domain.dataset.model.DatasetRecord;
import com.transitgate.domain.quality.model.ValidationError;
import com.transitgate.infrastructure.quality.validation.RuleValues;

import java.util.List;
import java.util.OptionalInt;

/**
 * Two fields of one record must be ordered: {@code earlier <= later}, or {@code earlier < later} when strict.
 * Works on any pair of same-typed comparable values (times, dates, numbers).
 * Examples: arrival_time ≤ departure_time, ship_start ≤ ship_end, ship_start ≤ delivery_start.
 */
public class FieldOrderRule extends RecordDomainRule {

    private final String earlierField;
    private final String laterField;
    private final boolean strict;

    public FieldOrderRule(String ruleId, String earlierField, String laterField, boolean strict) {
        super(ruleId, List.of(earlierField, laterField));
        this.earlierField = earlierField;
        this.laterField = laterField;
        this.strict = strict;
    }

    @Override
    protected List<ValidationError> evaluateRecord(DatasetRecord record) {
        Object earlier = record.get(earlierField);
        Object later = record.get(laterField);
        OptionalInt comparison = RuleValues.compare(earlier, later);
        if (comparison.isEmpty()) {
            return List.of();
        }

        boolean violated = strict ? comparison.getAsInt() >= 0 : comparison.getAsInt() > 0;
        if (!violated) {
            return List.of();
        }
        return List.of(violation(record, earlierField, String.format("%s %s must be %s %s %s",
                earlierField, earlier, strict ? "before" : "at or before", laterField, later)));
    }
}
