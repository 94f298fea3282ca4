package com.transitgate.infrastructure.quality.policy;

import com.transitgate.domain.quality.exception.QualityGateConfigurationException;
import com.transitgate.domain.quality.model.ClassifiedError;
import com.transitgate.domain.quality.model.Decision;
import com.transitgate.domain.quality.model.Severity;
import com.transitgate.domain.quality.model.SeverityPolicy;
import com.transitgate.domain.quality.model.ValidationError;
import com.transitgate.domain.quality.model.ValidationStage;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SeverityPolicyEngineTest {

    private final SeverityPolicyEngine engine = new SeverityPolicyEngine();

    private static List<ClassifiedError> findings(Severity... severities) {
        List<ClassifiedError> errors = new ArrayList<>();
        for (int i = 0; i < severities.length; i++) {
            ValidationError error = ValidationError.of("rule." + i, ValidationStage.DOMAIN, i, null, "finding " + i);
            errors.add(new ClassifiedError(error, severities[i]));
        }
        return errors;
    }

    @Test
    @DisplayName("No findings: PASS")
    void pass() {
        assertThat(engine.decide(List.of(), SeverityPolicy.defaults())).isEqualTo(Decision.PASS);
    }

    @Test
    @DisplayName("Only INFO and WARNING: PASS_WITH_WARNINGS")
    void warnings() {
        assertThat(engine.decide(findings(Severity.INFO), SeverityPolicy.defaults()))
                .isEqualTo(Decision.PASS_WITH_WARNINGS);
        assertThat(engine.decide(findings(Severity.WARNING, Severity.INFO, Severity.WARNING), SeverityPolicy.defaults()))
                .isEqualTo(Decision.PASS_WITH_WARNINGS);
    }

    @Test
    @DisplayName("Any CRITICAL halts when criticalHalts is on")
    void criticalHalts() {
        SeverityPolicy policy = new SeverityPolicy(true, 100, Severity.WARNING);

        assertThat(engine.decide(findings(Severity.WARNING, Severity.CRITICAL), policy)).isEqualTo(Decision.HALT);
    }

    @Test
    @DisplayName("With criticalHalts off, CRITICAL only counts toward the threshold")
    void criticalCountsTowardThreshold() {
        SeverityPolicy policy = new SeverityPolicy(false, 3, Severity.WARNING);

        assertThat(engine.decide(findings(Severity.CRITICAL, Severity.ERROR), policy))
                .isEqualTo(Decision.PASS_WITH_WARNINGS);
        assertThat(engine.decide(findings(Severity.CRITICAL, Severity.ERROR, Severity.ERROR), policy))
                .isEqualTo(Decision.HALT);
    }

    @Test
    @DisplayName("ERROR count reaching the threshold halts")
    void errorThreshold() {
        SeverityPolicy policy = new SeverityPolicy(true, 2, Severity.WARNING);

        assertThat(engine.decide(findings(Severity.ERROR, Severity.WARNING), policy))
                .isEqualTo(Decision.PASS_WITH_WARNINGS);
        assertThat(engine.decide(findings(Severity.ERROR, Severity.WARNING, Severity.ERROR), policy))
                .isEqualTo(Decision.HALT);
    }

    @Test
    @DisplayName("Default threshold of 1 halts on a single ERROR")
    void defaultThreshold() {
        assertThat(engine.decide(findings(Severity.ERROR), SeverityPolicy.defaults())).isEqualTo(Decision.HALT);
    }

    @Test
    @DisplayName("Invalid policies are configuration errors")
    void invalidPolicy() {
        assertThatThrownBy(() -> new SeverityPolicy(true, 0, Severity.WARNING))
                .isInstanceOf(QualityGateConfigurationException.class)
                .hasMessageContaining("error-threshold");
        assertThatThrownBy(() -> new SeverityPolicy(true, 1, null))
                .isInstanceOf(QualityGateConfigurationException.class);
    }
}
