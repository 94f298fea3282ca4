package com.transitgate.interfaces.api.dto;

import com.transitgate.domain.quality.model.Severity;
import com.transitgate.domain.quality.model.SeverityPolicy;
import jakarta.validation.constraints.Min;

/**
 * Per-request policy override. Absent values fall back to the configured policy.
 */
public record PolicyRequest(
        Boolean criticalHalts,

        @Min(value = 1, message = "errorThreshold must be at least 1")
        Integer errorThreshold,

        Severity defaultUnclassifiedSeverity
) {
    public SeverityPolicy mergeInto(SeverityPolicy defaults) {
        return new SeverityPolicy(
                criticalHalts != null ? criticalHalts : defaults.criticalHalts(),
                errorThreshold != null ? errorThreshold : defaults.errorThreshold(),
                defaultUnclassifiedSeverity != null ? defaultUnclassifiedSeverity : defaults.defaultUnclassifiedSeverity());
    }
}
