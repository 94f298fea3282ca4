package com.transitgate.infrastructure.quality.validation.domain;

import com.transitgate.domain.dataset.model.Dataset;
import com.transitgate.domain.quality.model.ValidationError;
import com.transitgate.domain.quality.model.ValidationStage;
import com.transitgate.infrastructure.quality.validation.DatasetValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs the registered transport-domain rules in registration order.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DomainValidator implements DatasetValidator {

    private final DomainRuleRegistry registry;

    @Override
    public ValidationStage stage() {
        return ValidationStage.DOMAIN;
    }

    @Override
    public List<ValidationError> validate(Dataset cleaned) {
        List<ValidationError> errors = new ArrayList<>();
        for (DomainRule rule : registry.rules()) {
            List<ValidationError> found = rule.evaluate(cleaned);
            if (!found.isEmpty()) {
                log.debug("[DomainValidator] {} raised {} findings", rule.ruleId(), found.size());
            }
            errors.addAll(found);
        }

        if (!errors.isEmpty()) {
            log.info("[DomainValidator] {}: {} findings from {} rules", cleaned.name(), errors.size(), registry.size());
        }
        return errors;
    }
}
