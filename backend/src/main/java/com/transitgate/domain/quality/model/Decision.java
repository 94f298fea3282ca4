package com.transitgate.domain.quality.model;

/**
 * Run-level outcome of the severity policy.
 */
public enum Decision {
    PASS,
    PASS_WITH_WARNINGS,
    HALT;

    public boolean allowsDelivery() {
        return this != HALT;
    }
}
