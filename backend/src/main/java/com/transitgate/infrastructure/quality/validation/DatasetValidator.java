package com.transitgate.infrastructure.quality.validation;

import com.transitgate.domain.dataset.model.Dataset;
import com.transitgate.domain.quality.model.ValidationError;
import com.transitgate.domain.quality.model.ValidationStage;

import java.util.List;

/**
 * One validation stage. Implementations scan the whole cleaned dataset, never modify it, and never
 * throw on bad data: every problem becomes a {@link ValidationError}.
 */
public interface DatasetValidator {

    ValidationStage stage();

    /**
     * @param cleaned cleaned dataset, shared read-only with the other validators
     * @return findings in this validator's deterministic order
     */
    List<ValidationError> validate(Dataset cleaned);
}
