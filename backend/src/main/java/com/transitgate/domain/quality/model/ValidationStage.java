package com.transitgate.domain.quality.model;

import java.util.Locale;

/**
 * Pipeline stage that raised a finding. Declaration order is the merge priority of the final report.
 */
public enum ValidationStage {
    CLEANING,
    FIELD,
    DOMAIN,
    RELATIONAL;

    /**
     * Lowercase name used in the serialized error report.
     */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
