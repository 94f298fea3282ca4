package com.transitgate.domain.quality.model;

import com.transitgate.domain.dataset.model.Dataset;

/**
 * Output of one pipeline run. On HALT the cleaned dataset is still returned; refusing to deliver it is
 * the caller's job.
 */
public record QualityGateResult(
        Dataset cleanedDataset,
        ErrorReport errorReport,
        Decision decision
) {
    public boolean halted() {
        return decision == Decision.HALT;
    }
}
