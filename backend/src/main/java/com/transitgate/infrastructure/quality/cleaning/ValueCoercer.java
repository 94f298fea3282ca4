package com.transitgate.infrastructure.quality.cleaning;

import com.transitgate.domain.dataset.model.FieldType;
import com.transitgate.domain.dataset.model.ServiceTime;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.List;
import java.util.Optional;

/**
 * Converts raw values into the Java type of a declared {@link FieldType}.
 * Returns empty when the value cannot be represented; never throws on bad data.
 */
final class ValueCoercer {

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE,
            DateTimeFormatter.ofPattern("M/d/uuuu").withResolverStyle(ResolverStyle.STRICT),
            DateTimeFormatter.ofPattern("uuuu/MM/dd").withResolverStyle(ResolverStyle.STRICT)
    );

    private static final List<DateTimeFormatter> DATETIME_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE_TIME,
            DateTimeFormatter.ofPattern("uuuu-MM-dd HH:mm[:ss]").withResolverStyle(ResolverStyle.STRICT),
            DateTimeFormatter.ofPattern("M/d/uuuu H:mm[:ss]").withResolverStyle(ResolverStyle.STRICT)
    );

    private final boolean stripThousandsSeparators;

    ValueCoercer(boolean stripThousandsSeparators) {
        this.stripThousandsSeparators = stripThousandsSeparators;
    }

    Optional<Object> coerce(Object value, FieldType type) {
        if (type.accepts(value)) {
            return Optional.of(value);
        }
        return switch (type) {
            case STRING -> toText(value);
            case NUMBER -> toNumber(value);
            case DATE -> value instanceof String s ? parse(s, DATE_FORMATS, LocalDate::parse) : Optional.empty();
            case DATETIME -> value instanceof String s ? toDateTime(s) : Optional.empty();
            case TIME -> value instanceof String s ? ServiceTime.parse(s).<Object>map(t -> t) : Optional.empty();
        };
    }

    // A bare date means the start of that day.
    private static Optional<Object> toDateTime(String text) {
        Optional<Object> dateTime = parse(text, DATETIME_FORMATS, LocalDateTime::parse);
        if (dateTime.isPresent()) {
            return dateTime;
        }
        return parse(text, DATE_FORMATS, LocalDate::parse).<Object>map(date -> ((LocalDate) date).atStartOfDay());
    }

    private Optional<Object> toText(Object value) {
        if (value instanceof Number || value instanceof Boolean) {
            return Optional.of(String.valueOf(value));
        }
        return Optional.empty();
    }

    private Optional<Object> toNumber(Object value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short) {
            return Optional.of(BigDecimal.valueOf(((Number) value).longValue()));
        }
        if (value instanceof Double d && Double.isFinite(d)) {
            return Optional.of(BigDecimal.valueOf(d));
        }
        if (value instanceof Float f && Float.isFinite(f)) {
            return Optional.of(new BigDecimal(f.toString()));
        }
        if (value instanceof BigInteger bi) {
            return Optional.of(new BigDecimal(bi));
        }
        if (!(value instanceof String text)) {
            return Optional.empty();
        }
        String candidate = stripThousandsSeparators ? text.replace(",", "") : text;
        try {
            return Optional.of(new BigDecimal(candidate));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private interface Parser {
        Object parse(CharSequence text, DateTimeFormatter formatter);
    }

    private static Optional<Object> parse(String text, List<DateTimeFormatter> formats, Parser parser) {
        for (DateTimeFormatter format : formats) {
            Optional<Object> parsed = tryParse(text, format, parser);
            if (parsed.isPresent()) {
                return parsed;
            }
        }
        return Optional.empty();
    }

    private static Optional<Object> tryParse(String text, DateTimeFormatter format, Parser parser) {
        try {
            return Optional.of(parser.parse(text, format));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
