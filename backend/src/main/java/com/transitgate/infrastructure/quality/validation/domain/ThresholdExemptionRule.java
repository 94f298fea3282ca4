package com.transitgate.infrastructure.quality.validation.domain;

import com.transitgate.domain.dataset.model.DatasetRecord;
import com.transitgate.domain.quality.model.ValidationError;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A value at or above a threshold is only allowed when another field names an approved party,
 * e.g. loads of 49,000 lb and more may only be booked by the overweight desk.
 * The exemption field is compared trimmed and case-insensitively; a null exemption field is not exempt.
 */
public class ThresholdExemptionRule extends RecordDomainRule {

    private final String valueField;
    private final BigDecimal threshold;
    private final String exemptionField;
    private final Set<String> exemptValues;

    public ThresholdExemptionRule(String ruleId, String valueField, BigDecimal threshold,
                                  String exemptionField, Set<String> exemptValues) {
        super(ruleId, List.of(valueField));
        this.valueField = valueField;
        this.threshold = threshold;
        this.exemptionField = exemptionField;
        this.exemptValues = exemptValues.stream()
                .map(ThresholdExemptionRule::normalize)
                .collect(Collectors.toUnmodifiableSet());
    }

    @Override
    protected List<ValidationError> evaluateRecord(DatasetRecord record) {
        BigDecimal value = number(record, valueField);
        if (value == null || value.compareTo(threshold) < 0) {
            return List.of();
        }
        Object exemption = record.get(exemptionField);
        if (exemption != null && exemptValues.contains(normalize(exemption.toString()))) {
            return List.of();
        }
        return List.of(violation(record, valueField, String.format("%s %s reaches %s but %s '%s' is not approved",
                valueField, value.toPlainString(), threshold.toPlainString(), exemptionField, exemption)));
    }

    private static String normalize(String value) {
        return value.strip().toLowerCase(Locale.ROOT);
    }
}
