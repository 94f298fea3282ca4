package com.transitgate.application.quality;

import com.transitgate.domain.dataset.model.Dataset;
import com.transitgate.domain.quality.model.QualityGateResult;
import com.transitgate.domain.quality.model.Severity;
import com.transitgate.domain.quality.model.SeverityPolicy;
import com.transitgate.infrastructure.io.DatasetLoadException;
import com.transitgate.infrastructure.io.DatasetLoader;
import com.transitgate.infrastructure.io.report.ErrorReportLogger;
import com.transitgate.infrastructure.io.report.QualityReportSink;
import com.transitgate.infrastructure.quality.pipeline.QualityGatePipeline;
import com.transitgate.infrastructure.quality.validation.relational.RelationalValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Entry point for one quality-gate run: load → pipeline → log report → deliver.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QualityGateAppService {

    private final List<DatasetLoader> loaders;
    private final QualityGatePipeline pipeline;
    private final RelationalValidator relationalValidator;
    private final ErrorReportLogger reportLogger;
    private final QualityReportSink sink;
    private final SeverityPolicy defaultSeverityPolicy;

    /**
     * Load a dataset file and its reference tables, run the gate, and hand the outcome to the sink.
     *
     * @param datasetPath     main dataset file
     * @param referencePaths  reference table name → file
     * @throws DatasetLoadException before any stage runs if a file cannot be loaded
     */
    public QualityGateResult runFile(Path datasetPath, Map<String, Path> referencePaths) {
        Dataset dataset = load(datasetPath, DatasetLoader.baseNameOf(datasetPath));

        Map<String, Dataset> references = new LinkedHashMap<>();
        referencePaths.forEach((name, path) -> references.put(name, load(path, name)));

        QualityGateResult result = run(dataset.withReferenceTables(references), defaultSeverityPolicy);
        sink.deliver(result);
        return result;
    }

    /**
     * Run the gate on an in-memory dataset. The report is logged before the result is returned.
     *
     * @param policy policy for this run, or null for the configured default
     */
    public QualityGateResult run(Dataset dataset, SeverityPolicy policy) {
        requireReferenceTables(dataset);

        QualityGateResult result = pipeline.run(dataset, policy != null ? policy : defaultSeverityPolicy);
        reportLogger.log(dataset.name(), result.errorReport());

        if (result.halted()) {
            log.warn("[QualityGate] {} HALTED: {} critical, {} error findings", dataset.name(),
                    result.errorReport().count(Severity.CRITICAL),
                    result.errorReport().count(Severity.ERROR));
        }
        return result;
    }

    public SeverityPolicy defaultPolicy() {
        return defaultSeverityPolicy;
    }

    private Dataset load(Path path, String name) {
        return loaders.stream()
                .filter(loader -> loader.supports(path))
                .findFirst()
                .orElseThrow(() -> new DatasetLoadException("Unsupported dataset format: " + path))
                .load(path, name);
    }

    private void requireReferenceTables(Dataset dataset) {
        Set<String> required = relationalValidator.requiredReferenceTables();
        for (String table : required) {
            if (!dataset.referenceTables().containsKey(table)) {
                throw new DatasetLoadException("Reference table '" + table + "' is required by the relational rules");
            }
        }
    }
}
