package com.transitgate.domain.quality.model;

import com.transitgate.domain.quality.exception.QualityGateConfigurationException;

/**
 * Policy deciding when classified findings halt delivery.
 *
 * @param criticalHalts               any CRITICAL finding halts the run
 * @param errorThreshold              HALT once ERROR + CRITICAL findings reach this count (at least 1)
 * @param defaultUnclassifiedSeverity severity for rule ids missing from the severity table
 */
public record SeverityPolicy(
        boolean criticalHalts,
        int errorThreshold,
        Severity defaultUnclassifiedSeverity
) {
    public static final int DEFAULT_ERROR_THRESHOLD = 1;

    public SeverityPolicy {
        if (errorThreshold < 1) {
            throw new QualityGateConfigurationException(
                    "error-threshold must be at least 1, was " + errorThreshold);
        }
        if (defaultUnclassifiedSeverity == null) {
            throw new QualityGateConfigurationException("default-unclassified-severity is required");
        }
    }

    public static SeverityPolicy defaults() {
        return new SeverityPolicy(true, DEFAULT_ERROR_THRESHOLD, Severity.WARNING);
    }
}
