package com.transitgate.domain.quality.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Ordered collection of classified findings for one run plus the decision taken on them.
 * <p>
 * Lifecycle: created empty, appended to while stages complete, then finalized exactly once with the
 * {@link Decision}. A finalized report is read-only.
 * </p>
 */
public final class ErrorReport {

    private final List<ClassifiedError> errors = new ArrayList<>();
    private Decision decision;

    public static ErrorReport empty() {
        return new ErrorReport();
    }

    public void append(ClassifiedError error) {
        requireOpen();
        errors.add(error);
    }

    public void appendAll(Collection<ClassifiedError> newErrors) {
        requireOpen();
        errors.addAll(newErrors);
    }

    /**
     * Attach the decision and freeze the report.
     *
     * @throws IllegalStateException if the report was already finalized
     */
    public void finalizeWith(Decision decision) {
        requireOpen();
        this.decision = Objects.requireNonNull(decision, "decision");
    }

    public boolean isFinalized() {
        return decision != null;
    }

    /**
     * @return the decision, or null while the report is still open
     */
    public Decision decision() {
        return decision;
    }

    public List<ClassifiedError> errors() {
        return Collections.unmodifiableList(errors);
    }

    public boolean isEmpty() {
        return errors.isEmpty();
    }

    public int size() {
        return errors.size();
    }

    public long count(Severity severity) {
        return errors.stream().filter(e -> e.severity() == severity).count();
    }

    public Map<Severity, Long> severityCounts() {
        Map<Severity, Long> counts = new EnumMap<>(Severity.class);
        for (Severity severity : Severity.values()) {
            counts.put(severity, count(severity));
        }
        return counts;
    }

    public List<ClassifiedError> errorsOf(ValidationStage stage) {
        return errors.stream().filter(e -> e.stage() == stage).toList();
    }

    /**
     * Per-rule aggregates in order of each rule's first finding.
     */
    public List<RuleSummary> summarizeByRule() {
        Map<String, List<ClassifiedError>> byRule = new LinkedHashMap<>();
        for (ClassifiedError error : errors) {
            byRule.computeIfAbsent(error.ruleId(), k -> new ArrayList<>()).add(error);
        }

        List<RuleSummary> summaries = new ArrayList<>(byRule.size());
        for (Map.Entry<String, List<ClassifiedError>> entry : byRule.entrySet()) {
            TreeSet<Integer> rows = new TreeSet<>();
            entry.getValue().forEach(e -> rows.addAll(e.rowIndices()));
            summaries.add(new RuleSummary(
                    entry.getKey(),
                    entry.getValue().get(0).severity(),
                    entry.getValue().size(),
                    new ArrayList<>(rows)));
        }
        return summaries;
    }

    private void requireOpen() {
        if (decision != null) {
            throw new IllegalStateException("Error report is finalized (decision=" + decision + ")");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ErrorReport other)) return false;
        return errors.equals(other.errors) && decision == other.decision;
    }

    @Override
    public int hashCode() {
        return 31 * errors.hashCode() + (decision != null ? decision.hashCode() : 0);
    }

    @Override
    public String toString() {
        return "ErrorReport{errors=" + errors.size() + ", decision=" + decision + "}";
    }
}
