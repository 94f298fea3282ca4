package com.transitgate.infrastructure.quality.validation.relational;

import com.transitgate.domain.dataset.model.Dataset;
import com.transitgate.domain.dataset.model.DatasetRecord;
import com.transitgate.domain.quality.model.ValidationError;
import com.transitgate.domain.quality.model.ValidationStage;
import com.transitgate.infrastructure.quality.validation.RuleValues;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The (possibly composite) key must be unique. Every record holding a duplicated key is reported,
 * including the first occurrence. Records with a null key part are skipped.
 */
public class UniqueKeyRule implements RelationalRule {

    private final String ruleId;
    private final List<String> keyFields;

    public UniqueKeyRule(String ruleId, List<String> keyFields) {
        if (keyFields.isEmpty()) {
            throw new IllegalArgumentException("Unique key needs at least one field: " + ruleId);
        }
        this.ruleId = ruleId;
        this.keyFields = List.copyOf(keyFields);
    }

    @Override
    public String ruleId() {
        return ruleId;
    }

    @Override
    public List<ValidationError> evaluate(Dataset dataset) {
        Map<List<String>, List<Integer>> rowsByKey = new HashMap<>();
        List<List<String>> keys = new ArrayList<>(dataset.size());
        for (DatasetRecord record : dataset.records()) {
            List<String> key = keyOf(record);
            keys.add(key);
            if (key != null) {
                rowsByKey.computeIfAbsent(key, k -> new ArrayList<>()).add(record.rowIndex());
            }
        }

        String field = keyFields.size() == 1 ? keyFields.get(0) : null;
        List<ValidationError> errors = new ArrayList<>();
        for (int i = 0; i < dataset.size(); i++) {
            List<String> key = keys.get(i);
            if (key == null) {
                continue;
            }
            List<Integer> rows = rowsByKey.get(key);
            if (rows.size() > 1) {
                errors.add(ValidationError.of(ruleId, ValidationStage.RELATIONAL,
                        dataset.records().get(i).rowIndex(), field,
                        String.format("duplicate %s %s (%d occurrences, first at row %d)",
                                String.join("+", keyFields), String.join("+", key), rows.size(), rows.get(0))));
            }
        }
        return errors;
    }

    private List<String> keyOf(DatasetRecord record) {
        List<String> parts = new ArrayList<>(keyFields.size());
        for (String keyField : keyFields) {
            String part = RuleValues.keyOf(record.get(keyField));
            if (part == null) {
                return null;
            }
            parts.add(part);
        }
        return parts;
    }
}
