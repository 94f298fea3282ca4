package com.transitgate.infrastructure.quality.validation.relational;

import com.transitgate.domain.dataset.model.Dataset;
import com.transitgate.domain.dataset.model.DatasetRecord;
import com.transitgate.domain.quality.model.ValidationError;
import com.transitgate.domain.quality.model.ValidationStage;
import com.transitgate.infrastructure.quality.validation.RuleValues;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * Every non-null value of {@code field} must exist as a {@code referenceField} value of the reference
 * table (or of the dataset itself when no table is named). One finding per referencing record.
 * <p>
 * Reference tables are not typed by the cleaner: a numeric referencing value matches reference cells
 * by numeric value, so 7 finds "7", "07" and "7.0".
 * </p>
 */
public class ForeignKeyRule implements RelationalRule {

    private final String ruleId;
    private final String field;
    private final String referenceTable;
    private final String referenceField;

    public ForeignKeyRule(String ruleId, String field, String referenceTable, String referenceField) {
        this.ruleId = ruleId;
        this.field = field;
        this.referenceTable = referenceTable;
        this.referenceField = referenceField;
    }

    @Override
    public String ruleId() {
        return ruleId;
    }

    @Override
    public Set<String> referenceTables() {
        return referenceTable == null ? Set.of() : Set.of(referenceTable);
    }

    @Override
    public List<ValidationError> evaluate(Dataset dataset) {
        Dataset target = target(dataset);
        Set<String> knownKeys = index(target, RuleValues::keyOf);
        Set<String> knownNumbers = index(target, RuleValues::numericKeyOf);
        String targetName = (referenceTable != null ? referenceTable : dataset.name()) + "." + referenceField;

        List<ValidationError> errors = new ArrayList<>();
        for (DatasetRecord record : dataset.records()) {
            Object value = record.get(field);
            String key = RuleValues.keyOf(value);
            if (key == null) {
                continue;
            }
            Set<String> known = value instanceof BigDecimal ? knownNumbers : knownKeys;
            if (!known.contains(key)) {
                errors.add(ValidationError.of(ruleId, ValidationStage.RELATIONAL, record.rowIndex(), field,
                        String.format("%s '%s' not found in %s", field, key, targetName)));
            }
        }
        return errors;
    }

    private Dataset target(Dataset dataset) {
        if (referenceTable == null) {
            return dataset;
        }
        // Missing tables are rejected before the run; an empty index reports every reference.
        return dataset.referenceTables().getOrDefault(referenceTable, new Dataset(referenceTable, List.of()));
    }

    private Set<String> index(Dataset table, Function<Object, String> keyFunction) {
        Set<String> keys = new HashSet<>();
        for (DatasetRecord record : table.records()) {
            String key = keyFunction.apply(record.get(referenceField));
            if (key != null) {
                keys.add(key);
            }
        }
        return keys;
    }
}
