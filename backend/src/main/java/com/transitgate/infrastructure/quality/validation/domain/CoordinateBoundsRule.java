package com.transitgate.infrastructure.quality.validation.domain;

import com.transitgate.domain.dataset.model.DatasetRecord;
import com.transitgate.domain.quality.model.ValidationError;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Latitude within [-90, 90] and longitude within [-180, 180]. One finding per offending coordinate.
 */
public class CoordinateBoundsRule extends RecordDomainRule {

    private static final BigDecimal MAX_LATITUDE = BigDecimal.valueOf(90);
    private static final BigDecimal MAX_LONGITUDE = BigDecimal.valueOf(180);

    private final String latitudeField;
    private final String longitudeField;

    public CoordinateBoundsRule(String ruleId, String latitudeField, String longitudeField) {
        super(ruleId, List.of(latitudeField, longitudeField));
        this.latitudeField = latitudeField;
        this.longitudeField = longitudeField;
    }

    @Override
    protected List<ValidationError> evaluateRecord(DatasetRecord record) {
        List<ValidationError> errors = new ArrayList<>(2);
        check(record, latitudeField, MAX_LATITUDE, errors);
        check(record, longitudeField, MAX_LONGITUDE, errors);
        return errors;
    }

    private void check(DatasetRecord record, String field, BigDecimal limit, List<ValidationError> errors) {
        BigDecimal value = number(record, field);
        if (value != null && value.abs().compareTo(limit) > 0) {
            errors.add(violation(record, field, String.format("%s %s outside [-%s, %s]",
                    field, value.toPlainString(), limit, limit)));
        }
    }
}
