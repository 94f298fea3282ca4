package com.transitgate.domain.dataset.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Declared shape of one field: its type and the value constraints checked in isolation.
 * Optional constraints are null when not declared.
 *
 * @param name          field (column) name
 * @param type          declared type; the cleaner coerces to it
 * @param required      null is a violation
 * @param textCase      case normalization applied by the cleaner to string values
 * @param pattern       full-match regex on string values
 * @param min           inclusive lower bound for NUMBER values
 * @param max           inclusive upper bound for NUMBER values
 * @param minLength     minimum string length
 * @param maxLength     maximum string length
 * @param allowedValues closed value set for string values (empty = unrestricted)
 * @param notBefore     earliest accepted DATE / DATETIME
 * @param notInFuture   DATE / DATETIME values after "now" are violations
 */
public record FieldSpec(
        String name,
        FieldType type,
        boolean required,
        TextCase textCase,
        Pattern pattern,
        BigDecimal min,
        BigDecimal max,
        Integer minLength,
        Integer maxLength,
        List<String> allowedValues,
        LocalDate notBefore,
        boolean notInFuture
) {
    public FieldSpec {
        Objects.requireNonNull(name, "name");
        type = type != null ? type : FieldType.STRING;
        textCase = textCase != null ? textCase : TextCase.NONE;
        allowedValues = allowedValues != null ? List.copyOf(allowedValues) : List.of();
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public boolean hasRange() {
        return min != null || max != null;
    }

    public boolean hasLengthBounds() {
        return minLength != null || maxLength != null;
    }

    public static final class Builder {
        private final String name;
        private FieldType type = FieldType.STRING;
        private boolean required;
        private TextCase textCase = TextCase.NONE;
        private Pattern pattern;
        private BigDecimal min;
        private BigDecimal max;
        private Integer minLength;
        private Integer maxLength;
        private List<String> allowedValues = List.of();
        private LocalDate notBefore;
        private boolean notInFuture;

        private Builder(String name) {
            this.name = name;
        }

        public Builder type(FieldType type) { this.type = type; return this; }
        public Builder required() { this.required = true; return this; }
        public Builder textCase(TextCase textCase) { this.textCase = textCase; return this; }
        public Builder pattern(String regex) { this.pattern = Pattern.compile(regex); return this; }
        public Builder min(String min) { this.min = new BigDecimal(min); return this; }
        public Builder max(String max) { this.max = new BigDecimal(max); return this; }
        public Builder length(Integer minLength, Integer maxLength) {
            this.minLength = minLength;
            this.maxLength = maxLength;
            return this;
        }
        public Builder allowedValues(String... values) { this.allowedValues = List.of(values); return this; }
        public Builder notBefore(LocalDate notBefore) { this.notBefore = notBefore; return this; }
        public Builder notInFuture() { this.notInFuture = true; return this; }

        public FieldSpec build() {
            return new FieldSpec(name, type, required, textCase, pattern, min, max,
                    minLength, maxLength, allowedValues, notBefore, notInFuture);
        }
    }
}
