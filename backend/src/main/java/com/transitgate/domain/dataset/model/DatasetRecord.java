package com.transitgate.domain.dataset.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One row of a dataset.
 *
 * @param rowIndex 0-based position of the row in its source table; stable through every stage
 * @param fields   field name to value, in source column order. Values may be null.
 */
public record DatasetRecord(
        int rowIndex,
        Map<String, Object> fields
) {
    public DatasetRecord {
        if (rowIndex < 0) {
            throw new IllegalArgumentException("Row index cannot be negative: " + rowIndex);
        }
        Objects.requireNonNull(fields, "fields");
        // Map.copyOf rejects null values, which are legitimate here
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public Object get(String field) {
        return fields.get(field);
    }

    public boolean isNull(String field) {
        return fields.get(field) == null;
    }

    /**
     * Copy of this record with one field replaced. The row index is kept.
     */
    public DatasetRecord with(String field, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(fields);
        copy.put(field, value);
        return new DatasetRecord(rowIndex, copy);
    }
}
