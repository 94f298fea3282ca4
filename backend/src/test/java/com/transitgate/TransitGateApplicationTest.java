package com.transitgate;

import com.transitgate.application.quality.QualityGateAppService;
import com.transitgate.domain.dataset.model.DatasetSchema;
import com.transitgate.domain.quality.model.ClassifiedError;
import com.transitgate.domain.quality.model.Decision;
import com.transitgate.domain.quality.model.QualityGateResult;
import com.transitgate.domain.quality.model.Severity;
import com.transitgate.infrastructure.quality.validation.domain.DomainRuleRegistry;
import com.transitgate.infrastructure.quality.validation.relational.RelationalRuleRegistry;
import com.transitgate.support.StopTimeFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

@SpringBootTest
class TransitGateApplicationTest {

    @Autowired
    private DatasetSchema schema;
    @Autowired
    private DomainRuleRegistry domainRules;
    @Autowired
    private RelationalRuleRegistry relationalRules;
    @Autowired
    private QualityGateAppService appService;

    @Test
    @DisplayName("The bundled stop_times catalog binds from application.yml")
    void catalogBinds() {
        assertThat(schema.fields()).hasSize(8);
        assertThat(domainRules.size()).isEqualTo(4);
        assertThat(relationalRules.size()).isEqualTo(3);
        assertThat(relationalRules.requiredReferenceTables()).containsExactly("stops");
    }

    @Test
    @DisplayName("A clean stop_times dataset passes end to end")
    void cleanDatasetPasses() {
        QualityGateResult result = appService.run(StopTimeFixtures.stopTimes(StopTimeFixtures.validRows()), null);

        assertThat(result.decision()).isEqualTo(Decision.PASS);
    }

    @Test
    @DisplayName("Findings are classified with the bundled severity table")
    void bundledSeverities() {
        List<Map<String, Object>> rows = StopTimeFixtures.validRows();
        rows.get(0).put("stop_id", "S404");
        rows.add(StopTimeFixtures.row("T3", "S1", "1", "10:00", "10:00"));

        QualityGateResult result = appService.run(StopTimeFixtures.stopTimes(rows), null);

        assertThat(result.errorReport().errors())
                .extracting(ClassifiedError::ruleId, ClassifiedError::severity)
                .containsExactly(
                        tuple("stop_time.stop_exists", Severity.CRITICAL),
                        tuple("trip.min_stop_times", Severity.WARNING));
        assertThat(result.decision()).isEqualTo(Decision.HALT);
    }

    @Test
    @DisplayName("Dataset arguments switch the application into batch mode")
    void batchModeDetection() {
        assertThat(TransitGateApplication.hasDatasetArgument(new String[]{"--server.port=0"})).isFalse();
        assertThat(TransitGateApplication.hasDatasetArgument(new String[]{"stop_times.csv", "--reference=stops=s.csv"}))
                .isTrue();
    }
}
