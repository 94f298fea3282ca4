package com.transitgate.infrastructure.io;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.transitgate.domain.dataset.model.Dataset;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * CSV with a header row. Every cell is read as a string; typing is the cleaner's job.
 */
@Slf4j
@Component
public class CsvDatasetLoader implements DatasetLoader {

    private final CsvMapper csvMapper = new CsvMapper();
    private final CsvSchema schema = CsvSchema.emptySchema().withHeader();

    @Override
    public boolean supports(Path path) {
        String extension = DatasetLoader.extensionOf(path);
        return extension.equals("csv") || extension.equals("txt");
    }

    @Override
    public Dataset load(Path path, String name) {
        if (!Files.isReadable(path)) {
            throw new DatasetLoadException("Dataset file not readable: " + path);
        }

        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
             MappingIterator<LinkedHashMap<String, String>> rows = csvMapper
                     .readerFor(LinkedHashMap.class)
                     .with(schema)
                     .readValues(reader)) {
            List<Map<String, String>> records = List.copyOf(rows.readAll());
            log.info("[Loader] {}: {} rows from {}", name, records.size(), path);
            return Dataset.fromRows(name, records);
        } catch (IOException | RuntimeException e) {
            throw new DatasetLoadException("Cannot read CSV dataset " + path + ": " + e.getMessage(), e);
        }
    }
}
