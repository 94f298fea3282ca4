package com.transitgate.infrastructure.quality.validation.domain;

import com.transitgate.domain.dataset.model.Dataset;
import com.transitgate.domain.quality.model.ValidationError;
import com.transitgate.infrastructure.quality.validation.QualityRule;

import java.util.List;

/**
 * Transport-domain semantic rule. Implementations are stateless between calls.
 */
public interface DomainRule extends QualityRule {

    /**
     * @return findings in row order, all with stage DOMAIN
     */
    List<ValidationError> evaluate(Dataset dataset);
}
