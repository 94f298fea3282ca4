package com.transitgate.infrastructure.quality.pipeline;

import com.transitgate.domain.dataset.model.Dataset;
import com.transitgate.domain.quality.model.QualityGateResult;
import com.transitgate.domain.quality.model.SeverityPolicy;
import com.transitgate.domain.quality.model.ValidationError;
import com.transitgate.domain.quality.model.ValidationStage;
import com.transitgate.infrastructure.quality.classification.ErrorClassifier;
import com.transitgate.infrastructure.quality.cleaning.DatasetCleaner;
import com.transitgate.infrastructure.quality.policy.SeverityPolicyEngine;
import com.transitgate.infrastructure.quality.validation.DatasetValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Orchestrates one quality-gate run:
 * <p>
 * clean → validate (field | domain | relational, concurrently) → merge by stage → classify → decide
 * </p>
 * Every validator always runs to completion, and the policy is applied once, after the report holds
 * every finding. A HALT is returned in the result; the pipeline never throws because of data.
 */
@Slf4j
@Component
public class QualityGatePipeline {

    private final DatasetCleaner cleaner;
    private final List<DatasetValidator> validators;
    private final ErrorClassifier classifier;
    private final SeverityPolicyEngine policyEngine;
    private final Executor validatorExecutor;
    private final boolean parallelValidation;

    public QualityGatePipeline(DatasetCleaner cleaner,
                               List<DatasetValidator> validators,
                               ErrorClassifier classifier,
                               SeverityPolicyEngine policyEngine,
                               @Qualifier("validatorExecutor") Executor validatorExecutor,
                               @Value("${quality-gate.parallel-validation:true}") boolean parallelValidation) {
        this.cleaner = cleaner;
        this.validators = validators.stream()
                .sorted(Comparator.comparing(DatasetValidator::stage))
                .toList();
        this.classifier = classifier;
        this.policyEngine = policyEngine;
        this.validatorExecutor = validatorExecutor;
        this.parallelValidation = parallelValidation;
    }

    /**
     * Run the full pipeline on one dataset.
     *
     * @param rawDataset dataset as loaded; not modified
     * @param policy     policy for this run
     * @return cleaned dataset, finalized report and decision
     */
    public QualityGateResult run(Dataset rawDataset, SeverityPolicy policy) {
        QualityGatePipelineContext ctx = new QualityGatePipelineContext();
        ctx.setRawDataset(rawDataset);
        ctx.setPolicy(policy);

        log.info("[Pipeline] Start {}: {} rows, reference tables {}",
                rawDataset.name(), rawDataset.size(), rawDataset.referenceTables().keySet());

        // 1. Clean
        ctx.setCleanedDataset(cleaner.clean(rawDataset));

        // 2. Validate
        ctx.setFindingsByStage(parallelValidation ? validateConcurrently(ctx.getCleanedDataset())
                : validateSequentially(ctx.getCleanedDataset()));

        // 3. Classify the merged findings
        List<ValidationError> merged = ctx.mergedFindings();
        ctx.setClassifiedErrors(classifier.classify(merged, policy.defaultUnclassifiedSeverity()));
        ctx.getReport().appendAll(ctx.getClassifiedErrors());

        // 4. Decide once, on the complete report
        ctx.setDecision(policyEngine.decide(ctx.getReport().errors(), policy));
        ctx.getReport().finalizeWith(ctx.getDecision());

        log.info("[Pipeline] Done {}: {} findings, decision {}",
                rawDataset.name(), ctx.getReport().size(), ctx.getDecision());
        return ctx.toResult();
    }

    private Map<ValidationStage, List<ValidationError>> validateSequentially(Dataset cleaned) {
        Map<ValidationStage, List<ValidationError>> findings = new EnumMap<>(ValidationStage.class);
        for (DatasetValidator validator : validators) {
            findings.computeIfAbsent(validator.stage(), s -> new ArrayList<>()).addAll(validator.validate(cleaned));
        }
        return findings;
    }

    private Map<ValidationStage, List<ValidationError>> validateConcurrently(Dataset cleaned) {
        Map<DatasetValidator, CompletableFuture<List<ValidationError>>> futures = new LinkedHashMap<>();
        for (DatasetValidator validator : validators) {
            futures.put(validator, CompletableFuture.supplyAsync(() -> validator.validate(cleaned), validatorExecutor));
        }

        try {
            CompletableFuture.allOf(futures.values().toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) throw re;
            throw new QualityGatePipelineException("Validator failed on " + cleaned.name(), cause);
        }

        // validators are already in stage order, so the fan-in is independent of completion order
        Map<ValidationStage, List<ValidationError>> findings = new EnumMap<>(ValidationStage.class);
        futures.forEach((validator, future) ->
                findings.computeIfAbsent(validator.stage(), s -> new ArrayList<>()).addAll(future.join()));
        return findings;
    }
}
