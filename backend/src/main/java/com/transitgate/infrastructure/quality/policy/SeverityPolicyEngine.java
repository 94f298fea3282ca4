package com.transitgate.infrastructure.quality.policy;

import com.transitgate.domain.quality.model.ClassifiedError;
import com.transitgate.domain.quality.model.Decision;
import com.transitgate.domain.quality.model.Severity;
import com.transitgate.domain.quality.model.SeverityPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Turns the complete list of classified findings into a run decision:
 * <ul>
 *   <li>HALT: a CRITICAL finding while {@code criticalHalts}, or ERROR + CRITICAL count ≥ {@code errorThreshold}</li>
 *   <li>PASS_WITH_WARNINGS: any other non-empty report</li>
 *   <li>PASS: no findings</li>
 * </ul>
 * Only ever called once the report is complete.
 */
@Slf4j
@Component
public class SeverityPolicyEngine {

    public Decision decide(List<ClassifiedError> errors, SeverityPolicy policy) {
        Map<Severity, Integer> counts = new EnumMap<>(Severity.class);
        for (ClassifiedError error : errors) {
            counts.merge(error.severity(), 1, Integer::sum);
        }

        int critical = counts.getOrDefault(Severity.CRITICAL, 0);
        int blocking = critical + counts.getOrDefault(Severity.ERROR, 0);

        Decision decision;
        if (policy.criticalHalts() && critical > 0) {
            decision = Decision.HALT;
        } else if (blocking >= policy.errorThreshold()) {
            decision = Decision.HALT;
        } else if (!errors.isEmpty()) {
            decision = Decision.PASS_WITH_WARNINGS;
        } else {
            decision = Decision.PASS;
        }

        log.info("[Policy] {} (critical={}, error={}, warning={}, info={}, threshold={}, criticalHalts={})",
                decision, critical, counts.getOrDefault(Severity.ERROR, 0),
                counts.getOrDefault(Severity.WARNING, 0), counts.getOrDefault(Severity.INFO, 0),
                policy.errorThreshold(), policy.criticalHalts());
        return decision;
    }
}
