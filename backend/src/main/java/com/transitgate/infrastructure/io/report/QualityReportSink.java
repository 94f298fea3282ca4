package com.transitgate.infrastructure.io.report;

import com.transitgate.domain.quality.model.QualityGateResult;

import java.nio.file.Path;
import java.util.List;

/**
 * Receives the outcome of a run. Always keeps the error report; keeps the cleaned dataset only when the
 * decision allows delivery.
 */
public interface QualityReportSink {

    /**
     * @return paths of the files written
     */
    List<Path> deliver(QualityGateResult result);
}
