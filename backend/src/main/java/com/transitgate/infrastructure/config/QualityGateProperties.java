package com.transitgate.infrastructure.config;

import com.transitgate.domain.dataset.model.FieldType;
import com.transitgate.domain.dataset.model.TextCase;
import com.transitgate.domain.quality.model.Severity;
import com.transitgate.domain.quality.model.SeverityPolicy;
import com.transitgate.infrastructure.quality.cleaning.CleaningOptions;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Everything under {@code quality-gate.*}: policy, cleaning options and the declarative rule catalog.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "quality-gate")
public class QualityGateProperties {

    private boolean parallelValidation = true;

    @Min(1)
    private int validatorThreads = 3;

    @NotBlank
    private String severityTable = "classpath:quality-gate/severity-table.json";

    @NotBlank
    private String outputDir = "quality-gate-output";

    @Valid
    private Policy policy = new Policy();

    @Valid
    private Cleaning cleaning = new Cleaning();

    @Valid
    private List<FieldDefinition> fields = new ArrayList<>();

    @Valid
    private List<DomainRuleDefinition> domainRules = new ArrayList<>();

    @Valid
    private List<RelationalRuleDefinition> relationalRules = new ArrayList<>();

    @Data
    public static class Policy {
        private boolean criticalHalts = true;

        @Min(1)
        private int errorThreshold = SeverityPolicy.DEFAULT_ERROR_THRESHOLD;

        @NotNull
        private Severity defaultUnclassifiedSeverity = Severity.WARNING;

        public SeverityPolicy toSeverityPolicy() {
            return new SeverityPolicy(criticalHalts, errorThreshold, defaultUnclassifiedSeverity);
        }
    }

    @Data
    public static class Cleaning {
        private List<String> nullSentinels = new ArrayList<>(CleaningOptions.DEFAULT_NULL_SENTINELS);
        private boolean stripThousandsSeparators = true;
        @Valid
        private List<RangeSplitDefinition> rangeSplits = new ArrayList<>();
    }

    @Data
    public static class RangeSplitDefinition {
        @NotBlank
        private String source;
        @NotEmpty
        private String separator = "-";
        @NotBlank
        private String startField;
        @NotBlank
        private String endField;
    }

    @Data
    public static class FieldDefinition {
        @NotBlank
        private String name;
        private FieldType type = FieldType.STRING;
        private boolean required;
        private TextCase textCase = TextCase.NONE;
        private String pattern;
        private BigDecimal min;
        private BigDecimal max;
        private Integer minLength;
        private Integer maxLength;
        private List<String> allowedValues = new ArrayList<>();
        /** ISO date, e.g. 2020-01-01 */
        private String notBefore;
        private boolean notInFuture;
    }

    @Data
    public static class DomainRuleDefinition {
        @NotBlank
        private String id;
        @NotNull
        private DomainRuleKind kind;
        private List<String> fields = new ArrayList<>();
        private String groupField;
        private boolean strict;
        private BigDecimal threshold;
        private String exemptionField;
        private List<String> exemptValues = new ArrayList<>();
    }

    @Data
    public static class RelationalRuleDefinition {
        @NotBlank
        private String id;
        @NotNull
        private RelationalRuleKind kind;
        private List<String> fields = new ArrayList<>();
        private String referenceTable;
        private String referenceField;
        private String groupField;
        private int minRecords = 1;
    }
}
