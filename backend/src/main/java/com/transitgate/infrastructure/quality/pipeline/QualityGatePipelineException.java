package com.transitgate.infrastructure.quality.pipeline;

/**
 * A pipeline stage failed unexpectedly (a defect, not a data problem; bad data never throws).
 */
public class QualityGatePipelineException extends RuntimeException {

    public QualityGatePipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
