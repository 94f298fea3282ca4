package com.transitgate.infrastructure.io;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.transitgate.domain.dataset.model.Dataset;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * JSON array of flat objects, one object per row.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JsonDatasetLoader implements DatasetLoader {

    private static final TypeReference<List<LinkedHashMap<String, Object>>> ROWS_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    @Override
    public boolean supports(Path path) {
        return DatasetLoader.extensionOf(path).equals("json");
    }

    @Override
    public Dataset load(Path path, String name) {
        if (!Files.isReadable(path)) {
            throw new DatasetLoadException("Dataset file not readable: " + path);
        }

        try (InputStream in = Files.newInputStream(path)) {
            List<LinkedHashMap<String, Object>> rows = objectMapper.readValue(in, ROWS_TYPE);
            if (rows == null || rows.contains(null)) {
                throw new DatasetLoadException("JSON dataset " + path + " must be an array of objects");
            }
            log.info("[Loader] {}: {} rows from {}", name, rows.size(), path);
            return Dataset.fromRows(name, rows);
        } catch (IOException e) {
            throw new DatasetLoadException("Cannot read JSON dataset " + path + ": " + e.getMessage(), e);
        }
    }
}
