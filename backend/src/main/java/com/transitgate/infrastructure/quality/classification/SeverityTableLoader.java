package com.transitgate.infrastructure.quality.classification;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.transitgate.domain.quality.exception.QualityGateConfigurationException;
import com.transitgate.domain.quality.model.Severity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Reads a severity table from a JSON object of {@code "rule-id-or-glob": "SEVERITY"} pairs.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SeverityTableLoader {

    private static final TypeReference<LinkedHashMap<String, String>> TABLE_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public SeverityTable load(Resource resource) {
        if (resource == null || !resource.exists()) {
            throw new QualityGateConfigurationException("Severity table not found: " + resource);
        }

        Map<String, String> raw;
        try (InputStream in = resource.getInputStream()) {
            raw = objectMapper.readValue(in, TABLE_TYPE);
        } catch (IOException e) {
            throw new QualityGateConfigurationException("Cannot read severity table " + resource, e);
        }

        Map<String, Severity> entries = new LinkedHashMap<>();
        raw.forEach((ruleId, severity) -> entries.put(ruleId, parse(ruleId, severity)));

        log.info("[Classifier] Loaded {} severity entries from {}", entries.size(), resource.getDescription());
        return new SeverityTable(entries);
    }

    private static Severity parse(String ruleId, String severity) {
        if (severity == null) {
            throw new QualityGateConfigurationException("Missing severity for rule " + ruleId);
        }
        try {
            return Severity.valueOf(severity.strip().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new QualityGateConfigurationException(
                    "Unknown severity '" + severity + "' for rule " + ruleId, e);
        }
    }
}
