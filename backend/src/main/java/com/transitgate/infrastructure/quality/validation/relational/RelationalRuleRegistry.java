package com.transitgate.infrastructure.quality.validation.relational;

import com.transitgate.infrastructure.quality.validation.RuleRegistry;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public class RelationalRuleRegistry extends RuleRegistry<RelationalRule> {

    public RelationalRuleRegistry(List<? extends RelationalRule> rules) {
        super(rules);
    }

    /**
     * Names of all reference tables the registered rules resolve against.
     */
    public Set<String> requiredReferenceTables() {
        Set<String> tables = new LinkedHashSet<>();
        rules().forEach(rule -> tables.addAll(rule.referenceTables()));
        return tables;
    }
}
