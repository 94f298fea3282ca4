package com.transitgate.infrastructure.config;

public enum DomainRuleKind {
    /** fields: [earlier, later] */
    FIELD_ORDER,
    /** fields: [latitude, longitude] */
    COORDINATE_BOUNDS,
    /** fields: one or more numeric fields */
    NON_NEGATIVE,
    /** fields: [value]; threshold, exemption-field, exempt-values */
    THRESHOLD_EXEMPTION,
    /** group-field; fields: [sequence] */
    SEQUENCE_MONOTONIC
}
