package com.transitgate.infrastructure.quality.validation.relational;

import com.transitgate.domain.dataset.model.Dataset;
import com.transitgate.domain.dataset.model.DatasetRecord;
import com.transitgate.domain.quality.model.ValidationError;
import com.transitgate.domain.quality.model.ValidationStage;
import com.transitgate.infrastructure.quality.validation.RuleValues;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Every parent entity, identified by {@code groupField}, must own at least {@code minRecords} rows
 * (a trip needs two stop times to go anywhere). One finding per incomplete group, attributed to its rows.
 */
public class CompletenessRule implements RelationalRule {

    private final String ruleId;
    private final String groupField;
    private final int minRecords;

    public CompletenessRule(String ruleId, String groupField, int minRecords) {
        if (minRecords < 1) {
            throw new IllegalArgumentException("min-records must be at least 1: " + ruleId);
        }
        this.ruleId = ruleId;
        this.groupField = groupField;
        this.minRecords = minRecords;
    }

    @Override
    public String ruleId() {
        return ruleId;
    }

    @Override
    public List<ValidationError> evaluate(Dataset dataset) {
        Map<String, List<Integer>> rowsByGroup = new LinkedHashMap<>();
        for (DatasetRecord record : dataset.records()) {
            String key = RuleValues.keyOf(record.get(groupField));
            if (key != null) {
                rowsByGroup.computeIfAbsent(key, k -> new ArrayList<>()).add(record.rowIndex());
            }
        }

        List<ValidationError> errors = new ArrayList<>();
        rowsByGroup.forEach((key, rows) -> {
            if (rows.size() < minRecords) {
                errors.add(ValidationError.of(ruleId, ValidationStage.RELATIONAL, rows, groupField,
                        String.format("%s '%s' has %d rows, at least %d required",
                                groupField, key, rows.size(), minRecords)));
            }
        });
        return errors;
    }
}
