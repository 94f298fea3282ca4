package com.transitgate.domain.quality.model;

/**
 * Ordinal severity tiers, lowest first.
 */
public enum Severity {
    INFO,
    WARNING,
    ERROR,
    CRITICAL
}
