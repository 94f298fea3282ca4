package com.transitgate.infrastructure.quality.cleaning;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Tunables of the cleaner.
 *
 * @param nullSentinels            raw strings (compared case-insensitively, after trimming) that mean "no value"
 * @param stripThousandsSeparators remove ',' from NUMBER fields before parsing ("49,000" → 49000)
 * @param rangeSplits              range columns split into start/end columns before typing
 */
public record CleaningOptions(
        Set<String> nullSentinels,
        boolean stripThousandsSeparators,
        List<RangeSplit> rangeSplits
) {
    public static final Set<String> DEFAULT_NULL_SENTINELS = Set.of("", "NA", "N/A", "NULL", "NaN", "None");

    public CleaningOptions {
        nullSentinels = nullSentinels.stream()
                .map(s -> s.strip().toUpperCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
        rangeSplits = rangeSplits == null ? List.of() : List.copyOf(rangeSplits);
    }

    public CleaningOptions(Set<String> nullSentinels, boolean stripThousandsSeparators) {
        this(nullSentinels, stripThousandsSeparators, List.of());
    }

    public static CleaningOptions defaults() {
        return new CleaningOptions(DEFAULT_NULL_SENTINELS, true);
    }

    public CleaningOptions withRangeSplits(List<RangeSplit> splits) {
        return new CleaningOptions(nullSentinels, stripThousandsSeparators, splits);
    }

    public boolean isNullSentinel(String trimmed) {
        return nullSentinels.contains(trimmed.toUpperCase(Locale.ROOT));
    }
}
