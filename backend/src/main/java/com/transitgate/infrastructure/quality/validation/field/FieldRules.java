package com.transitgate.infrastructure.quality.validation.field;

import com.transitgate.domain.dataset.model.FieldSpec;
import com.transitgate.domain.dataset.model.FieldType;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Compiles a {@link FieldSpec} into its ordered check list:
 * required → type → allowed → pattern → length → range → not-before → future.
 */
final class FieldRules {

    private FieldRules() {
    }

    static List<FieldRule> compile(FieldSpec spec, Clock clock) {
        List<FieldRule> rules = new ArrayList<>();
        if (spec.required()) {
            rules.add(new Required(spec.name()));
        }
        rules.add(new TypeCheck(spec.name(), spec.type()));
        if (!spec.allowedValues().isEmpty()) {
            rules.add(new AllowedValues(spec.name(), spec.allowedValues()));
        }
        if (spec.pattern() != null) {
            rules.add(new PatternCheck(spec.name(), spec.pattern()));
        }
        if (spec.hasLengthBounds()) {
            rules.add(new LengthCheck(spec.name(), spec.minLength(), spec.maxLength()));
        }
        if (spec.hasRange()) {
            rules.add(new RangeCheck(spec.name(), spec.min(), spec.max()));
        }
        if (spec.notBefore() != null) {
            rules.add(new NotBefore(spec.name(), spec.notBefore()));
        }
        if (spec.notInFuture()) {
            rules.add(new NotInFuture(spec.name(), clock));
        }
        return List.copyOf(rules);
    }

    record Required(String field) implements FieldRule {
        @Override public String check() { return "required"; }
        @Override public boolean appliesToNull() { return true; }
        @Override public boolean stopsFieldOnViolation() { return true; }

        @Override
        public Optional<String> evaluate(Object value) {
            return value == null
                    ? Optional.of(field + " is required but missing")
                    : Optional.empty();
        }
    }

    record TypeCheck(String field, FieldType type) implements FieldRule {
        @Override public String check() { return "type"; }
        @Override public boolean stopsFieldOnViolation() { return true; }

        @Override
        public Optional<String> evaluate(Object value) {
            return type.accepts(value)
                    ? Optional.empty()
                    : Optional.of(String.format("%s: '%s' is not a valid %s", field, value, type));
        }
    }

    record AllowedValues(String field, List<String> allowed) implements FieldRule {
        @Override public String check() { return "allowed"; }

        @Override
        public Optional<String> evaluate(Object value) {
            return allowed.contains(value.toString())
                    ? Optional.empty()
                    : Optional.of(String.format("%s: '%s' is not one of %s", field, value, allowed));
        }
    }

    record PatternCheck(String field, Pattern pattern) implements FieldRule {
        @Override public String check() { return "pattern"; }

        @Override
        public Optional<String> evaluate(Object value) {
            return pattern.matcher(value.toString()).matches()
                    ? Optional.empty()
                    : Optional.of(String.format("%s: '%s' does not match %s", field, value, pattern.pattern()));
        }
    }

    record LengthCheck(String field, Integer minLength, Integer maxLength) implements FieldRule {
        @Override public String check() { return "length"; }

        @Override
        public Optional<String> evaluate(Object value) {
            int length = value.toString().length();
            if (minLength != null && length < minLength || maxLength != null && length > maxLength) {
                return Optional.of(String.format("%s: length %d outside [%s, %s]",
                        field, length, bound(minLength), bound(maxLength)));
            }
            return Optional.empty();
        }
    }

    record RangeCheck(String field, BigDecimal min, BigDecimal max) implements FieldRule {
        @Override public String check() { return "range"; }

        @Override
        public Optional<String> evaluate(Object value) {
            if (!(value instanceof BigDecimal number)) {
                return Optional.empty();
            }
            if (min != null && number.compareTo(min) < 0 || max != null && number.compareTo(max) > 0) {
                return Optional.of(String.format("%s: %s outside [%s, %s]",
                        field, number.toPlainString(), bound(min), bound(max)));
            }
            return Optional.empty();
        }
    }

    record NotBefore(String field, LocalDate earliest) implements FieldRule {
        @Override public String check() { return "not-before"; }

        @Override
        public Optional<String> evaluate(Object value) {
            LocalDate date = toDate(value);
            return date != null && date.isBefore(earliest)
                    ? Optional.of(String.format("%s: %s is before %s", field, value, earliest))
                    : Optional.empty();
        }
    }

    record NotInFuture(String field, Clock clock) implements FieldRule {
        @Override public String check() { return "future"; }

        @Override
        public Optional<String> evaluate(Object value) {
            boolean future;
            if (value instanceof LocalDateTime dateTime) {
                future = dateTime.isAfter(LocalDateTime.now(clock));
            } else if (value instanceof LocalDate date) {
                future = date.isAfter(LocalDate.now(clock));
            } else {
                return Optional.empty();
            }
            return future
                    ? Optional.of(String.format("%s: %s is in the future", field, value))
                    : Optional.empty();
        }
    }

    private static LocalDate toDate(Object value) {
        if (value instanceof LocalDateTime dateTime) {
            return dateTime.toLocalDate();
        }
        return value instanceof LocalDate date ? date : null;
    }

    private static String bound(Object bound) {
        if (bound == null) {
            return "-";
        }
        return bound instanceof BigDecimal decimal ? decimal.toPlainString() : bound.toString();
    }
}
