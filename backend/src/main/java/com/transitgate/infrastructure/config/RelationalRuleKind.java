package com.transitgate.infrastructure.config;

public enum RelationalRuleKind {
    /** fields: [field]; reference-table (optional), reference-field */
    FOREIGN_KEY,
    /** fields: key parts */
    UNIQUE,
    /** group-field, min-records */
    COMPLETENESS
}
