package com.transitgate.infrastructure.quality.validation.domain;

import com.transitgate.domain.dataset.model.Dataset;
import com.transitgate.domain.dataset.model.DatasetRecord;
import com.transitgate.domain.quality.model.ValidationError;
import com.transitgate.domain.quality.model.ValidationStage;
import com.transitgate.infrastructure.quality.validation.RuleValues;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Within each group (e.g. the stop times of one trip), the sequence field must strictly increase in
 * row order. One finding per broken group, attributed to every row of that group.
 * Rows with a null or non-numeric group key or sequence value are left out of their group.
 */
public class SequenceMonotonicRule implements DomainRule {

    private final String ruleId;
    private final String groupField;
    private final String sequenceField;

    public SequenceMonotonicRule(String ruleId, String groupField, String sequenceField) {
        this.ruleId = ruleId;
        this.groupField = groupField;
        this.sequenceField = sequenceField;
    }

    @Override
    public String ruleId() {
        return ruleId;
    }

    @Override
    public List<ValidationError> evaluate(Dataset dataset) {
        Map<String, List<DatasetRecord>> groups = new LinkedHashMap<>();
        for (DatasetRecord record : dataset.records()) {
            String key = RuleValues.keyOf(record.get(groupField));
            if (key != null && record.get(sequenceField) instanceof BigDecimal) {
                groups.computeIfAbsent(key, k -> new ArrayList<>()).add(record);
            }
        }

        List<ValidationError> errors = new ArrayList<>();
        groups.forEach((key, rows) -> checkGroup(key, rows, errors));
        return errors;
    }

    private void checkGroup(String key, List<DatasetRecord> rows, List<ValidationError> errors) {
        for (int i = 1; i < rows.size(); i++) {
            BigDecimal previous = (BigDecimal) rows.get(i - 1).get(sequenceField);
            BigDecimal current = (BigDecimal) rows.get(i).get(sequenceField);
            if (current.compareTo(previous) <= 0) {
                List<Integer> rowIndices = rows.stream().map(DatasetRecord::rowIndex).toList();
                errors.add(ValidationError.of(ruleId, ValidationStage.DOMAIN, rowIndices, sequenceField,
                        String.format("%s '%s': %s %s at row %d does not follow %s at row %d",
                                groupField, key, sequenceField, current.toPlainString(),
                                rows.get(i).rowIndex(), previous.toPlainString(), rows.get(i - 1).rowIndex())));
                return;
            }
        }
    }
}
