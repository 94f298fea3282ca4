package com.transitgate.infrastructure.quality.validation.domain;

import com.transitgate.infrastructure.quality.validation.RuleRegistry;

import java.util.List;

public class DomainRuleRegistry extends RuleRegistry<DomainRule> {

    public DomainRuleRegistry(List<? extends DomainRule> rules) {
        super(rules);
    }
}
