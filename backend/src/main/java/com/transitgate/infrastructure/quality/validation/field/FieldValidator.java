package com.transitgate.infrastructure.quality.validation.field;

import com.transitgate.domain.dataset.model.Dataset;
import com.transitgate.domain.dataset.model.DatasetRecord;
import com.transitgate.domain.dataset.model.DatasetSchema;
import com.transitgate.domain.dataset.model.FieldSpec;
import com.transitgate.domain.quality.model.ValidationError;
import com.transitgate.domain.quality.model.ValidationStage;
import com.transitgate.infrastructure.quality.validation.DatasetValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Checks every declared field of every record in isolation.
 * One error per violated check; order is row, then field declaration, then check order.
 */
@Slf4j
@Component
public class FieldValidator implements DatasetValidator {

    private final Map<String, List<FieldRule>> rulesByField = new LinkedHashMap<>();

    public FieldValidator(DatasetSchema schema, Clock clock) {
        for (FieldSpec spec : schema.fields()) {
            rulesByField.put(spec.name(), FieldRules.compile(spec, clock));
        }
    }

    @Override
    public ValidationStage stage() {
        return ValidationStage.FIELD;
    }

    @Override
    public List<ValidationError> validate(Dataset cleaned) {
        List<ValidationError> errors = new ArrayList<>();

        for (DatasetRecord record : cleaned.records()) {
            for (Map.Entry<String, List<FieldRule>> entry : rulesByField.entrySet()) {
                checkField(record, entry.getKey(), entry.getValue(), errors);
            }
        }

        if (!errors.isEmpty()) {
            log.info("[FieldValidator] {}: {} findings over {} rows", cleaned.name(), errors.size(), cleaned.size());
        }
        return errors;
    }

    private void checkField(DatasetRecord record, String field, List<FieldRule> rules, List<ValidationError> errors) {
        Object value = record.get(field);
        for (FieldRule rule : rules) {
            if (value == null && !rule.appliesToNull()) {
                continue;
            }
            Optional<String> violation = rule.evaluate(value);
            if (violation.isPresent()) {
                errors.add(ValidationError.of(
                        ruleId(field, rule.check()), ValidationStage.FIELD,
                        record.rowIndex(), field, violation.get()));
                if (rule.stopsFieldOnViolation()) {
                    return;
                }
            }
        }
    }

    static String ruleId(String field, String check) {
        return "field." + field + "." + check;
    }
}
