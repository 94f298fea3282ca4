package com.transitgate.infrastructure.quality.pipeline;

import com.transitgate.domain.dataset.model.Dataset;
import com.transitgate.domain.quality.model.ClassifiedError;
import com.transitgate.domain.quality.model.Decision;
import com.transitgate.domain.quality.model.ErrorReport;
import com.transitgate.domain.quality.model.QualityGateResult;
import com.transitgate.domain.quality.model.SeverityPolicy;
import com.transitgate.domain.quality.model.ValidationError;
import com.transitgate.domain.quality.model.ValidationStage;
import lombok.Data;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable state of one pipeline run, filled stage by stage. Never shared between runs.
 */
@Data
public class QualityGatePipelineContext {

    // --- Input ---
    private Dataset rawDataset;
    private SeverityPolicy policy;

    // --- Cleaning ---
    private Dataset cleanedDataset;

    // --- Validation ---
    private Map<ValidationStage, List<ValidationError>> findingsByStage = new EnumMap<>(ValidationStage.class);

    // --- Classification ---
    private List<ClassifiedError> classifiedErrors = new ArrayList<>();

    // --- Policy ---
    private ErrorReport report = ErrorReport.empty();
    private Decision decision;

    /**
     * All findings merged in stage priority order (field, domain, relational), each stage keeping its
     * own discovery order. Independent of which validator finished first.
     */
    public List<ValidationError> mergedFindings() {
        List<ValidationError> merged = new ArrayList<>();
        for (ValidationStage stage : ValidationStage.values()) {
            merged.addAll(findingsByStage.getOrDefault(stage, List.of()));
        }
        return merged;
    }

    public QualityGateResult toResult() {
        return new QualityGateResult(cleanedDataset, report, decision);
    }
}
