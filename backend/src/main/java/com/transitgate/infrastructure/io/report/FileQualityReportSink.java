package com.transitgate.infrastructure.io.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.transitgate.domain.dataset.model.Dataset;
import com.transitgate.domain.dataset.model.DatasetRecord;
import com.transitgate.domain.quality.model.QualityGateResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Writes {@code <name>.report.json} for every run and {@code <name>.cleaned.csv} unless the run halted.
 */
@Slf4j
@Component
public class FileQualityReportSink implements QualityReportSink {

    private final ObjectMapper objectMapper;
    private final CsvMapper csvMapper = new CsvMapper();
    private final Path outputDir;

    public FileQualityReportSink(ObjectMapper objectMapper,
                                 @Value("${quality-gate.output-dir:quality-gate-output}") String outputDir) {
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
        this.outputDir = Path.of(outputDir);
    }

    @Override
    public List<Path> deliver(QualityGateResult result) {
        Dataset cleaned = result.cleanedDataset();
        List<Path> written = new ArrayList<>(2);
        try {
            Files.createDirectories(outputDir);

            Path reportFile = outputDir.resolve(cleaned.name() + ".report.json");
            objectMapper.writeValue(reportFile.toFile(),
                    ErrorReportDocument.from(cleaned.name(), result.errorReport()));
            written.add(reportFile);

            if (result.decision().allowsDelivery()) {
                Path dataFile = outputDir.resolve(cleaned.name() + ".cleaned.csv");
                writeCsv(cleaned, dataFile);
                written.add(dataFile);
            } else {
                log.warn("[Sink] {} halted; cleaned dataset not written", cleaned.name());
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write quality-gate output to " + outputDir, e);
        }

        log.info("[Sink] Wrote {}", written);
        return written;
    }

    private void writeCsv(Dataset dataset, Path file) throws IOException {
        Set<String> columns = new LinkedHashSet<>();
        dataset.records().forEach(r -> columns.addAll(r.fields().keySet()));

        CsvSchema.Builder schema = CsvSchema.builder().setUseHeader(true);
        columns.forEach(schema::addColumn);

        List<Map<String, String>> rows = new ArrayList<>(dataset.size());
        for (DatasetRecord record : dataset.records()) {
            Map<String, String> row = new LinkedHashMap<>();
            for (String column : columns) {
                row.put(column, ValueFormatter.format(record.get(column)));
            }
            rows.add(row);
        }

        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
             SequenceWriter out = csvMapper.writer(schema.build()).writeValues(writer)) {
            out.writeAll(rows);
        }
    }
}
