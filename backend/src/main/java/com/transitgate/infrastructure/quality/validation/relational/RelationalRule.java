package com.transitgate.infrastructure.quality.validation.relational;

import com.transitgate.domain.dataset.model.Dataset;
import com.transitgate.domain.quality.model.ValidationError;
import com.transitgate.infrastructure.quality.validation.QualityRule;

import java.util.List;
import java.util.Set;

/**
 * Constraint over the dataset as a whole. Any lookup index is built inside {@link #evaluate} and
 * discarded when it returns.
 */
public interface RelationalRule extends QualityRule {

    /**
     * @return findings ordered by first offending row, all with stage RELATIONAL
     */
    List<ValidationError> evaluate(Dataset dataset);

    /**
     * Reference tables that must accompany the dataset for this rule to be meaningful.
     */
    default Set<String> referenceTables() {
        return Set.of();
    }
}
