package com.transitgate.infrastructure.quality.validation.relational;

import com.transitgate.domain.dataset.model.Dataset;
import com.transitgate.domain.quality.model.ValidationError;
import com.transitgate.domain.quality.model.ValidationStage;
import com.transitgate.infrastructure.quality.validation.DatasetValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Cross-record checks: foreign keys, uniqueness, completeness. Rule registration order, then first
 * offending row within each rule.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RelationalValidator implements DatasetValidator {

    private final RelationalRuleRegistry registry;

    @Override
    public ValidationStage stage() {
        return ValidationStage.RELATIONAL;
    }

    public Set<String> requiredReferenceTables() {
        return registry.requiredReferenceTables();
    }

    @Override
    public List<ValidationError> validate(Dataset cleaned) {
        List<ValidationError> errors = new ArrayList<>();
        for (RelationalRule rule : registry.rules()) {
            errors.addAll(rule.evaluate(cleaned));
        }

        if (!errors.isEmpty()) {
            log.info("[RelationalValidator] {}: {} findings from {} rules", cleaned.name(), errors.size(), registry.size());
        }
        return errors;
    }
}
