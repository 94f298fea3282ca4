package com.transitgate.infrastructure.config;

import com.transitgate.domain.dataset.model.DatasetSchema;
import com.transitgate.domain.dataset.model.FieldSpec;
import com.transitgate.domain.dataset.model.FieldType;
import com.transitgate.domain.quality.exception.QualityGateConfigurationException;
import com.transitgate.infrastructure.config.QualityGateProperties.DomainRuleDefinition;
import com.transitgate.infrastructure.config.QualityGateProperties.FieldDefinition;
import com.transitgate.infrastructure.config.QualityGateProperties.RangeSplitDefinition;
import com.transitgate.infrastructure.config.QualityGateProperties.RelationalRuleDefinition;
import com.transitgate.infrastructure.quality.cleaning.RangeSplit;
import com.transitgate.infrastructure.quality.validation.domain.DomainRule;
import com.transitgate.infrastructure.quality.validation.domain.SequenceMonotonicRule;
import com.transitgate.infrastructure.quality.validation.domain.ThresholdExemptionRule;
import com.transitgate.infrastructure.quality.validation.relational.ForeignKeyRule;
import com.transitgate.infrastructure.quality.validation.relational.RelationalRule;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RuleCatalogFactoryTest {

    private static FieldDefinition field(String name, FieldType type) {
        FieldDefinition def = new FieldDefinition();
        def.setName(name);
        def.setType(type);
        return def;
    }

    private static DomainRuleDefinition domainRule(String id, DomainRuleKind kind, String... fields) {
        DomainRuleDefinition def = new DomainRuleDefinition();
        def.setId(id);
        def.setKind(kind);
        def.setFields(List.of(fields));
        return def;
    }

    private static RelationalRuleDefinition relationalRule(String id, RelationalRuleKind kind, String... fields) {
        RelationalRuleDefinition def = new RelationalRuleDefinition();
        def.setId(id);
        def.setKind(kind);
        def.setFields(List.of(fields));
        return def;
    }

    @Test
    @DisplayName("Field definitions become specs in declaration order")
    void schema() {
        FieldDefinition created = field("Create Date", FieldType.DATETIME);
        created.setRequired(true);
        created.setNotBefore("2020-01-01");
        created.setNotInFuture(true);
        FieldDefinition reference = field("Primary Reference", FieldType.STRING);
        reference.setPattern("[A-Z]+-\\d+");

        DatasetSchema schema = RuleCatalogFactory.schema(List.of(created, reference));

        assertThat(schema.fields()).extracting(FieldSpec::name).containsExactly("Create Date", "Primary Reference");
        FieldSpec spec = schema.field("Create Date").orElseThrow();
        assertThat(spec.required()).isTrue();
        assertThat(spec.notBefore()).isEqualTo(LocalDate.of(2020, 1, 1));
        assertThat(spec.notInFuture()).isTrue();
        assertThat(schema.field("Primary Reference").orElseThrow().pattern().pattern()).isEqualTo("[A-Z]+-\\d+");
    }

    @Test
    @DisplayName("Duplicate field names, bad patterns and bad dates are configuration errors")
    void invalidFields() {
        FieldDefinition badPattern = field("ref", FieldType.STRING);
        badPattern.setPattern("[unclosed");
        FieldDefinition badDate = field("created", FieldType.DATE);
        badDate.setNotBefore("01/01/2020");

        assertThatThrownBy(() -> RuleCatalogFactory.schema(List.of(
                field("stop_id", FieldType.STRING), field("stop_id", FieldType.STRING))))
                .isInstanceOf(QualityGateConfigurationException.class);
        assertThatThrownBy(() -> RuleCatalogFactory.schema(List.of(badPattern)))
                .isInstanceOf(QualityGateConfigurationException.class)
                .hasMessageContaining("ref");
        assertThatThrownBy(() -> RuleCatalogFactory.schema(List.of(badDate)))
                .isInstanceOf(QualityGateConfigurationException.class)
                .hasMessageContaining("not-before");
    }

    @Test
    @DisplayName("Domain rule definitions keep their ids and order")
    void domainRules() {
        DomainRuleDefinition sequence = domainRule("trip.stop_sequence_increasing",
                DomainRuleKind.SEQUENCE_MONOTONIC, "stop_sequence");
        sequence.setGroupField("trip_id");
        DomainRuleDefinition overweight = domainRule("weight.overweight", DomainRuleKind.THRESHOLD_EXEMPTION, "Weight");
        overweight.setThreshold(new BigDecimal("49000"));
        overweight.setExemptionField("Create By");
        overweight.setExemptValues(List.of("ops@company.com"));

        List<DomainRule> rules = RuleCatalogFactory.domainRules(List.of(
                domainRule("stop_time.arrival_before_departure", DomainRuleKind.FIELD_ORDER,
                        "arrival_time", "departure_time"),
                sequence,
                overweight));

        assertThat(rules).extracting(DomainRule::ruleId).containsExactly(
                "stop_time.arrival_before_departure", "trip.stop_sequence_increasing", "weight.overweight");
        assertThat(rules.get(1)).isInstanceOf(SequenceMonotonicRule.class);
        assertThat(rules.get(2)).isInstanceOf(ThresholdExemptionRule.class);
    }

    @Test
    @DisplayName("Incomplete domain rule definitions are rejected")
    void invalidDomainRules() {
        assertThatThrownBy(() -> RuleCatalogFactory.domainRule(
                domainRule("order", DomainRuleKind.FIELD_ORDER, "arrival_time")))
                .isInstanceOf(QualityGateConfigurationException.class)
                .hasMessageContaining("order");
        assertThatThrownBy(() -> RuleCatalogFactory.domainRule(
                domainRule("seq", DomainRuleKind.SEQUENCE_MONOTONIC, "stop_sequence")))
                .isInstanceOf(QualityGateConfigurationException.class)
                .hasMessageContaining("group-field");
        assertThatThrownBy(() -> RuleCatalogFactory.domainRule(
                domainRule("heavy", DomainRuleKind.THRESHOLD_EXEMPTION, "Weight")))
                .isInstanceOf(QualityGateConfigurationException.class);
        assertThatThrownBy(() -> RuleCatalogFactory.domainRule(
                domainRule("positive", DomainRuleKind.NON_NEGATIVE)))
                .isInstanceOf(QualityGateConfigurationException.class);
    }

    @Test
    @DisplayName("Relational rules declare the reference tables they need")
    void relationalRules() {
        RelationalRuleDefinition foreignKey = relationalRule("stop_time.stop_exists",
                RelationalRuleKind.FOREIGN_KEY, "stop_id");
        foreignKey.setReferenceTable("stops");
        foreignKey.setReferenceField("stop_id");
        RelationalRuleDefinition completeness = relationalRule("trip.min_stop_times", RelationalRuleKind.COMPLETENESS);
        completeness.setGroupField("trip_id");
        completeness.setMinRecords(2);

        List<RelationalRule> rules = RuleCatalogFactory.relationalRules(List.of(
                foreignKey,
                relationalRule("stop_time.unique_trip_sequence", RelationalRuleKind.UNIQUE, "trip_id", "stop_sequence"),
                completeness));

        assertThat(rules).extracting(RelationalRule::ruleId).containsExactly(
                "stop_time.stop_exists", "stop_time.unique_trip_sequence", "trip.min_stop_times");
        assertThat(rules.get(0)).isInstanceOf(ForeignKeyRule.class);
        assertThat(rules.get(0).referenceTables()).containsExactly("stops");
    }

    @Test
    @DisplayName("Incomplete relational rule definitions are rejected")
    void invalidRelationalRules() {
        RelationalRuleDefinition noGroup = relationalRule("complete", RelationalRuleKind.COMPLETENESS);
        RelationalRuleDefinition zeroMin = relationalRule("complete", RelationalRuleKind.COMPLETENESS);
        zeroMin.setGroupField("trip_id");
        zeroMin.setMinRecords(0);

        assertThatThrownBy(() -> RuleCatalogFactory.relationalRule(
                relationalRule("fk", RelationalRuleKind.FOREIGN_KEY, "stop_id")))
                .isInstanceOf(QualityGateConfigurationException.class)
                .hasMessageContaining("reference-field");
        assertThatThrownBy(() -> RuleCatalogFactory.relationalRule(relationalRule("unique", RelationalRuleKind.UNIQUE)))
                .isInstanceOf(QualityGateConfigurationException.class);
        assertThatThrownBy(() -> RuleCatalogFactory.relationalRule(noGroup))
                .isInstanceOf(QualityGateConfigurationException.class);
        assertThatThrownBy(() -> RuleCatalogFactory.relationalRule(zeroMin))
                .isInstanceOf(QualityGateConfigurationException.class)
                .hasMessageContaining("min-records");
    }

    @Test
    @DisplayName("Range split definitions default to a '-' separator; blank targets are rejected")
    void rangeSplits() {
        RangeSplitDefinition ship = new RangeSplitDefinition();
        ship.setSource("Target Ship (Range)");
        ship.setStartField("Ship Start");
        ship.setEndField("Ship End");
        RangeSplitDefinition noEnd = new RangeSplitDefinition();
        noEnd.setSource("Target Delivery (Range)");
        noEnd.setStartField("Delivery Start");

        assertThat(RuleCatalogFactory.rangeSplits(List.of(ship)))
                .containsExactly(new RangeSplit("Target Ship (Range)", "-", "Ship Start", "Ship End"));
        assertThatThrownBy(() -> RuleCatalogFactory.rangeSplits(List.of(noEnd)))
                .isInstanceOf(QualityGateConfigurationException.class)
                .hasMessageContaining("endField");
    }
}
