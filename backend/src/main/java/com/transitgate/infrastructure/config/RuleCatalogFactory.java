package com.transitgate.infrastructure.config;

import com.transitgate.domain.dataset.model.DatasetSchema;
import com.transitgate.domain.dataset.model.FieldSpec;
import com.transitgate.domain.quality.exception.QualityGateConfigurationException;
import com.transitgate.infrastructure.config.QualityGateProperties.DomainRuleDefinition;
import com.transitgate.infrastructure.config.QualityGateProperties.FieldDefinition;
import com.transitgate.infrastructure.config.QualityGateProperties.RangeSplitDefinition;
import com.transitgate.infrastructure.config.QualityGateProperties.RelationalRuleDefinition;
import com.transitgate.infrastructure.quality.cleaning.RangeSplit;
import com.transitgate.infrastructure.quality.validation.domain.CoordinateBoundsRule;
import com.transitgate.infrastructure.quality.validation.domain.DomainRule;
import com.transitgate.infrastructure.quality.validation.domain.FieldOrderRule;
import com.transitgate.infrastructure.quality.validation.domain.NonNegativeRule;
import com.transitgate.infrastructure.quality.validation.domain.SequenceMonotonicRule;
import com.transitgate.infrastructure.quality.validation.domain.ThresholdExemptionRule;
import com.transitgate.infrastructure.quality.validation.relational.CompletenessRule;
import com.transitgate.infrastructure.quality.validation.relational.ForeignKeyRule;
import com.transitgate.infrastructure.quality.validation.relational.RelationalRule;
import com.transitgate.infrastructure.quality.validation.relational.UniqueKeyRule;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Turns the declarative catalog of {@link QualityGateProperties} into schema and rule objects.
 * Any malformed entry is a {@link QualityGateConfigurationException}.
 */
public final class RuleCatalogFactory {

    private RuleCatalogFactory() {
    }

    public static DatasetSchema schema(List<FieldDefinition> definitions) {
        List<FieldSpec> specs = new ArrayList<>(definitions.size());
        for (FieldDefinition def : definitions) {
            specs.add(fieldSpec(def));
        }
        try {
            return new DatasetSchema(specs);
        } catch (IllegalArgumentException e) {
            throw new QualityGateConfigurationException(e.getMessage(), e);
        }
    }

    public static List<DomainRule> domainRules(List<DomainRuleDefinition> definitions) {
        List<DomainRule> rules = new ArrayList<>(definitions.size());
        for (DomainRuleDefinition def : definitions) {
            rules.add(domainRule(def));
        }
        return rules;
    }

    public static List<RelationalRule> relationalRules(List<RelationalRuleDefinition> definitions) {
        List<RelationalRule> rules = new ArrayList<>(definitions.size());
        for (RelationalRuleDefinition def : definitions) {
            rules.add(relationalRule(def));
        }
        return rules;
    }

    public static List<RangeSplit> rangeSplits(List<RangeSplitDefinition> definitions) {
        List<RangeSplit> splits = new ArrayList<>(definitions.size());
        for (RangeSplitDefinition def : definitions) {
            try {
                splits.add(new RangeSplit(def.getSource(), def.getSeparator(), def.getStartField(), def.getEndField()));
            } catch (IllegalArgumentException e) {
                throw new QualityGateConfigurationException("Invalid range split: " + e.getMessage(), e);
            }
        }
        return splits;
    }

    static FieldSpec fieldSpec(FieldDefinition def) {
        return new FieldSpec(
                def.getName(),
                def.getType(),
                def.isRequired(),
                def.getTextCase(),
                compile(def.getName(), def.getPattern()),
                def.getMin(),
                def.getMax(),
                def.getMinLength(),
                def.getMaxLength(),
                def.getAllowedValues(),
                parseDate(def.getName(), def.getNotBefore()),
                def.isNotInFuture());
    }

    static DomainRule domainRule(DomainRuleDefinition def) {
        List<String> fields = def.getFields();
        return switch (def.getKind()) {
            case FIELD_ORDER -> {
                requireFieldCount(def.getId(), fields, 2);
                yield new FieldOrderRule(def.getId(), fields.get(0), fields.get(1), def.isStrict());
            }
            case COORDINATE_BOUNDS -> {
                requireFieldCount(def.getId(), fields, 2);
                yield new CoordinateBoundsRule(def.getId(), fields.get(0), fields.get(1));
            }
            case NON_NEGATIVE -> {
                if (fields.isEmpty()) {
                    throw invalid(def.getId(), "needs at least one field");
                }
                yield new NonNegativeRule(def.getId(), fields, def.isStrict());
            }
            case THRESHOLD_EXEMPTION -> {
                requireFieldCount(def.getId(), fields, 1);
                if (def.getThreshold() == null || def.getExemptionField() == null) {
                    throw invalid(def.getId(), "needs threshold and exemption-field");
                }
                yield new ThresholdExemptionRule(def.getId(), fields.get(0), def.getThreshold(),
                        def.getExemptionField(), new HashSet<>(def.getExemptValues()));
            }
            case SEQUENCE_MONOTONIC -> {
                requireFieldCount(def.getId(), fields, 1);
                requireValue(def.getId(), "group-field", def.getGroupField());
                yield new SequenceMonotonicRule(def.getId(), def.getGroupField(), fields.get(0));
            }
        };
    }

    static RelationalRule relationalRule(RelationalRuleDefinition def) {
        List<String> fields = def.getFields();
        return switch (def.getKind()) {
            case FOREIGN_KEY -> {
                requireFieldCount(def.getId(), fields, 1);
                requireValue(def.getId(), "reference-field", def.getReferenceField());
                yield new ForeignKeyRule(def.getId(), fields.get(0), def.getReferenceTable(), def.getReferenceField());
            }
            case UNIQUE -> {
                if (fields.isEmpty()) {
                    throw invalid(def.getId(), "needs at least one key field");
                }
                yield new UniqueKeyRule(def.getId(), fields);
            }
            case COMPLETENESS -> {
                requireValue(def.getId(), "group-field", def.getGroupField());
                if (def.getMinRecords() < 1) {
                    throw invalid(def.getId(), "min-records must be at least 1");
                }
                yield new CompletenessRule(def.getId(), def.getGroupField(), def.getMinRecords());
            }
        };
    }

    private static Pattern compile(String field, String regex) {
        if (regex == null || regex.isBlank()) {
            return null;
        }
        try {
            return Pattern.compile(regex);
        } catch (PatternSyntaxException e) {
            throw new QualityGateConfigurationException("Invalid pattern for field " + field + ": " + regex, e);
        }
    }

    private static LocalDate parseDate(String field, String date) {
        if (date == null || date.isBlank()) {
            return null;
        }
        try {
            return LocalDate.parse(date.strip());
        } catch (DateTimeParseException e) {
            throw new QualityGateConfigurationException("Invalid not-before date for field " + field + ": " + date, e);
        }
    }

    private static void requireFieldCount(String ruleId, List<String> fields, int expected) {
        if (fields.size() != expected) {
            throw invalid(ruleId, "expects " + expected + " field(s), got " + fields);
        }
    }

    private static void requireValue(String ruleId, String property, String value) {
        if (value == null || value.isBlank()) {
            throw invalid(ruleId, property + " is required");
        }
    }

    private static QualityGateConfigurationException invalid(String ruleId, String problem) {
        return new QualityGateConfigurationException("Rule " + ruleId + ": " + problem);
    }
}
