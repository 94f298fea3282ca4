package com.transitgate.domain.dataset.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A tabular transport dataset: the ordered records under inspection plus the named lookup tables
 * (stops, carriers, ...) that relational rules resolve references against.
 * Immutable; every stage that changes values produces a new instance.
 *
 * @param name            logical dataset name, used for report and output file names
 * @param records         rows in source order
 * @param referenceTables lookup tables by name; their rows are not validated themselves
 */
public record Dataset(
        String name,
        List<DatasetRecord> records,
        Map<String, Dataset> referenceTables
) {
    public Dataset {
        Objects.requireNonNull(name, "name");
        records = List.copyOf(records);
        referenceTables = referenceTables == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(referenceTables));
    }

    public Dataset(String name, List<DatasetRecord> records) {
        this(name, records, Map.of());
    }

    /**
     * Build a dataset from plain row maps, assigning row indices in iteration order.
     */
    public static Dataset fromRows(String name, List<? extends Map<String, ?>> rows) {
        List<DatasetRecord> records = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            records.add(new DatasetRecord(i, new LinkedHashMap<>(rows.get(i))));
        }
        return new Dataset(name, records);
    }

    public int size() {
        return records.size();
    }

    public Dataset withReferenceTable(String tableName, Dataset table) {
        Map<String, Dataset> tables = new LinkedHashMap<>(referenceTables);
        tables.put(tableName, table);
        return new Dataset(name, records, tables);
    }

    public Dataset withReferenceTables(Map<String, Dataset> tables) {
        return new Dataset(name, records, tables);
    }
}
