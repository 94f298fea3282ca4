package com.transitgate.infrastructure.quality.cleaning;

import com.transitgate.domain.dataset.model.Dataset;
import com.transitgate.domain.dataset.model.DatasetRecord;
import com.transitgate.domain.dataset.model.DatasetSchema;
import com.transitgate.domain.dataset.model.FieldSpec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Deterministic cleaning of a raw dataset before validation:
 * - Trim surrounding whitespace
 * - Null sentinels ("", "NA", "N/A", ...) → null
 * - Declared range columns split into start and end columns
 * - Declared case normalization (e.g. state codes to upper case)
 * - Declared type coercion (NUMBER, DATE, DATETIME, TIME)
 * <p>
 * A value that fails coercion stays as its trimmed string; the field validator reports it.
 * Rows are never dropped or reordered and the input dataset is never modified.
 * Reference tables only get trimming and null normalization.
 * </p>
 */
@Slf4j
@Component
public class DatasetCleaner {

    private final DatasetSchema schema;
    private final CleaningOptions options;
    private final ValueCoercer coercer;

    public DatasetCleaner(DatasetSchema schema, CleaningOptions options) {
        this.schema = schema;
        this.options = options;
        this.coercer = new ValueCoercer(options.stripThousandsSeparators());
    }

    /**
     * Clean the dataset.
     *
     * @param dataset raw dataset
     * @return a new dataset with the same row count, order and row indices
     */
    public Dataset clean(Dataset dataset) {
        List<DatasetRecord> cleaned = new ArrayList<>(dataset.size());
        int coercionFailures = 0;

        for (DatasetRecord record : dataset.records()) {
            Map<String, Object> fields = new LinkedHashMap<>();
            record.fields().forEach((field, value) -> fields.put(field, normalize(value)));
            splitRanges(fields);

            for (Map.Entry<String, Object> entry : fields.entrySet()) {
                Optional<FieldSpec> spec = schema.field(entry.getKey());
                if (spec.isPresent() && entry.getValue() != null) {
                    Object value = applySpec(entry.getValue(), spec.get());
                    if (!spec.get().type().accepts(value)) {
                        coercionFailures++;
                    }
                    entry.setValue(value);
                }
            }
            cleaned.add(new DatasetRecord(record.rowIndex(), fields));
        }

        Map<String, Dataset> references = new LinkedHashMap<>();
        dataset.referenceTables().forEach((name, table) -> references.put(name, cleanReference(table)));

        if (coercionFailures > 0) {
            log.debug("[Cleaner] {}: {} values left uncoerced", dataset.name(), coercionFailures);
        }
        return new Dataset(dataset.name(), cleaned, references);
    }

    private Dataset cleanReference(Dataset table) {
        List<DatasetRecord> cleaned = new ArrayList<>(table.size());
        for (DatasetRecord record : table.records()) {
            Map<String, Object> fields = new LinkedHashMap<>();
            record.fields().forEach((field, value) -> fields.put(field, normalize(value)));
            cleaned.add(new DatasetRecord(record.rowIndex(), fields));
        }
        return new Dataset(table.name(), cleaned, table.referenceTables());
    }

    // Split columns are re-derived from their source on every pass.
    private void splitRanges(Map<String, Object> fields) {
        for (RangeSplit split : options.rangeSplits()) {
            if (!fields.containsKey(split.sourceField())) {
                continue;
            }
            Object source = fields.get(split.sourceField());
            String[] parts = source == null ? new String[]{null, null} : split.split(source.toString());
            fields.put(split.startField(), parts[0] == null ? null : normalize(parts[0]));
            fields.put(split.endField(), parts[1] == null ? null : normalize(parts[1]));
        }
    }

    // 1. Trim, 2. null sentinels
    private Object normalize(Object value) {
        if (!(value instanceof String text)) {
            return value;
        }
        String trimmed = text.strip();
        return options.isNullSentinel(trimmed) ? null : trimmed;
    }

    // 3. Case, 4. type
    private Object applySpec(Object value, FieldSpec spec) {
        Object result = value;
        if (result instanceof String text) {
            result = spec.textCase().apply(text);
        }
        return coercer.coerce(result, spec.type()).orElse(result);
    }
}
