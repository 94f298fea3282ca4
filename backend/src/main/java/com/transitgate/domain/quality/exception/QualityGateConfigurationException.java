package com.transitgate.domain.quality.exception;

/**
 * Invalid or missing quality-gate configuration: policy values, rule catalog entries or the severity
 * table. Always fatal; raised before any dataset is processed.
 */
public class QualityGateConfigurationException extends RuntimeException {

    public QualityGateConfigurationException(String message) {
        super(message);
    }

    public QualityGateConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
