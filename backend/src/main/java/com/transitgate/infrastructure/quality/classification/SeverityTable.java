package com.transitgate.infrastructure.quality.classification;

import com.transitgate.domain.quality.model.Severity;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Central rule id → severity table.
 * <p>
 * Keys are exact rule ids ({@code field.stop_id.required}) or globs where {@code *} matches any run of
 * characters ({@code field.*.required}). Exact ids win; otherwise the glob with the most literal
 * characters wins, ties broken by the glob text, so lookups never depend on table order.
 * </p>
 */
public final class SeverityTable {

    private final Map<String, Severity> exact = new LinkedHashMap<>();
    private final List<GlobEntry> globs = new ArrayList<>();

    public SeverityTable(Map<String, Severity> entries) {
        entries.forEach((key, severity) -> {
            if (key.contains("*")) {
                globs.add(new GlobEntry(key, toRegex(key), key.replace("*", "").length(), severity));
            } else {
                exact.put(key, severity);
            }
        });
        globs.sort(Comparator.comparingInt(GlobEntry::literalLength).reversed()
                .thenComparing(GlobEntry::glob));
    }

    public static SeverityTable empty() {
        return new SeverityTable(Map.of());
    }

    public Optional<Severity> lookup(String ruleId) {
        Severity severity = exact.get(ruleId);
        if (severity != null) {
            return Optional.of(severity);
        }
        return globs.stream()
                .filter(g -> g.regex().matcher(ruleId).matches())
                .map(GlobEntry::severity)
                .findFirst();
    }

    public int size() {
        return exact.size() + globs.size();
    }

    private static Pattern toRegex(String glob) {
        return Pattern.compile(Arrays.stream(glob.split("\\*", -1))
                .map(Pattern::quote)
                .collect(Collectors.joining(".*")));
    }

    private record GlobEntry(String glob, Pattern regex, int literalLength, Severity severity) {
    }
}
