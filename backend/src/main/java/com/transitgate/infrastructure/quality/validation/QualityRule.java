package com.transitgate.infrastructure.quality.validation;

/**
 * A registrable rule. The rule id is the key of the severity table.
 */
public interface QualityRule {

    String ruleId();
}
