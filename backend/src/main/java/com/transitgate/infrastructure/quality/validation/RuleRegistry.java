package com.transitgate.infrastructure.quality.validation;

import com.transitgate.domain.quality.exception.QualityGateConfigurationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Ordered set of rules evaluated by a validator. Registration order is evaluation and report order.
 *
 * @param <R> rule type
 */
public abstract class RuleRegistry<R extends QualityRule> {

    private final List<R> rules = new ArrayList<>();
    private final Set<String> ruleIds = new HashSet<>();

    protected RuleRegistry(List<? extends R> initialRules) {
        initialRules.forEach(this::register);
    }

    /**
     * @throws QualityGateConfigurationException if a rule with the same id is already registered
     */
    public final synchronized void register(R rule) {
        if (!ruleIds.add(rule.ruleId())) {
            throw new QualityGateConfigurationException("Duplicate rule id: " + rule.ruleId());
        }
        rules.add(rule);
    }

    public final synchronized List<R> rules() {
        return Collections.unmodifiableList(new ArrayList<>(rules));
    }

    public final synchronized int size() {
        return rules.size();
    }
}
