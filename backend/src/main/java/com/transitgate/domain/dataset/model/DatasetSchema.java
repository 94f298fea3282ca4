package com.transitgate.domain.dataset.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Declared fields of the dataset under inspection, in declaration order.
 * Columns without a field declaration pass through cleaning untyped and are not field-validated.
 */
public final class DatasetSchema {

    private final Map<String, FieldSpec> fields = new LinkedHashMap<>();

    public DatasetSchema(List<FieldSpec> specs) {
        for (FieldSpec spec : specs) {
            if (fields.putIfAbsent(spec.name(), spec) != null) {
                throw new IllegalArgumentException("Duplicate field spec: " + spec.name());
            }
        }
    }

    public static DatasetSchema of(FieldSpec... specs) {
        return new DatasetSchema(List.of(specs));
    }

    public List<FieldSpec> fields() {
        return List.copyOf(fields.values());
    }

    public Optional<FieldSpec> field(String name) {
        return Optional.ofNullable(fields.get(name));
    }
}
