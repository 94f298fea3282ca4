package com.transitgate.infrastructure.quality.classification;

import com.transitgate.domain.quality.model.ClassifiedError;
import com.transitgate.domain.quality.model.Severity;
import com.transitgate.domain.quality.model.ValidationError;
import com.transitgate.domain.quality.model.ValidationStage;
import com.transitgate.support.StopTimeFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ErrorClassifierTest {

    private ErrorClassifier classifier;

    @BeforeEach
    void setUp() {
        classifier = new ErrorClassifier(StopTimeFixtures.severityTable());
    }

    @Test
    @DisplayName("Severity comes from the rule id, input order is preserved")
    void classifiesByRuleId() {
        List<ValidationError> errors = List.of(
                ValidationError.of("trip.min_stop_times", ValidationStage.RELATIONAL, 4, "trip_id", "short trip"),
                ValidationError.of("field.stop_id.required", ValidationStage.FIELD, 1, "stop_id", "missing"),
                ValidationError.of("stop_time.arrival_before_departure", ValidationStage.DOMAIN, 2, "arrival_time", "late"));

        List<ClassifiedError> classified = classifier.classify(errors, Severity.WARNING);

        assertThat(classified).extracting(ClassifiedError::ruleId).containsExactly(
                "trip.min_stop_times", "field.stop_id.required", "stop_time.arrival_before_departure");
        assertThat(classified).extracting(ClassifiedError::severity).containsExactly(
                Severity.WARNING, Severity.CRITICAL, Severity.ERROR);
        assertThat(classified.get(1).error()).isSameAs(errors.get(1));
    }

    @Test
    @DisplayName("Unclassified rule ids get the default severity")
    void defaultSeverity() {
        List<ValidationError> errors = List.of(
                ValidationError.of("stop_time.timepoint_flag", ValidationStage.DOMAIN, 0, "timepoint", "odd"),
                ValidationError.of("stop_time.timepoint_flag", ValidationStage.DOMAIN, 3, "timepoint", "odd"));

        assertThat(classifier.classify(errors, Severity.INFO))
                .extracting(ClassifiedError::severity)
                .containsExactly(Severity.INFO, Severity.INFO);
        assertThat(classifier.classify(errors, Severity.ERROR))
                .extracting(ClassifiedError::severity)
                .containsOnly(Severity.ERROR);
    }

    @Test
    @DisplayName("A rawSeverity hint on the finding does not influence classification")
    void ignoresRawSeverity() {
        ValidationError hinted = new ValidationError("trip.min_stop_times", ValidationStage.RELATIONAL,
                List.of(0), "trip_id", "short trip", Severity.CRITICAL);

        assertThat(classifier.classify(List.of(hinted), Severity.WARNING).get(0).severity())
                .isEqualTo(Severity.WARNING);
    }

    @Test
    @DisplayName("No findings, no classified errors")
    void empty() {
        assertThat(classifier.classify(List.of(), Severity.WARNING)).isEmpty();
    }
}
