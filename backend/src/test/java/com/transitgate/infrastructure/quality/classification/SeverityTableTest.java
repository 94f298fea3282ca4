package com.transitgate.infrastructure.quality.classification;

import com.transitgate.domain.quality.model.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class SeverityTableTest {

    @Test
    @DisplayName("Exact ids win over globs")
    void exactWins() {
        SeverityTable table = new SeverityTable(Map.of(
                "field.*.required", Severity.CRITICAL,
                "field.stop_lat.required", Severity.INFO));

        assertThat(table.lookup("field.stop_lat.required")).contains(Severity.INFO);
        assertThat(table.lookup("field.stop_id.required")).contains(Severity.CRITICAL);
    }

    @Test
    @DisplayName("The most specific glob wins regardless of table order")
    void specificGlobWins() {
        Map<String, Severity> forward = new LinkedHashMap<>();
        forward.put("field.*", Severity.INFO);
        forward.put("field.*.required", Severity.ERROR);
        forward.put("field.*State.required", Severity.CRITICAL);
        Map<String, Severity> reversed = new LinkedHashMap<>();
        reversed.put("field.*State.required", Severity.CRITICAL);
        reversed.put("field.*.required", Severity.ERROR);
        reversed.put("field.*", Severity.INFO);

        for (SeverityTable table : new SeverityTable[]{new SeverityTable(forward), new SeverityTable(reversed)}) {
            assertThat(table.lookup("field.Origin State.required")).contains(Severity.CRITICAL);
            assertThat(table.lookup("field.Weight.required")).contains(Severity.ERROR);
            assertThat(table.lookup("field.Weight.type")).contains(Severity.INFO);
        }
    }

    @Test
    @DisplayName("Equally specific globs are ordered by their text")
    void tieBreak() {
        SeverityTable table = new SeverityTable(Map.of(
                "b.*", Severity.ERROR,
                "*.x", Severity.WARNING));

        assertThat(table.lookup("b.x")).contains(Severity.WARNING);
    }

    @Test
    @DisplayName("Glob text is literal apart from '*'")
    void literalCharacters() {
        SeverityTable table = new SeverityTable(Map.of("field.(a|b).*", Severity.ERROR));

        assertThat(table.lookup("field.a.required")).isEmpty();
        assertThat(table.lookup("field.(a|b).required")).contains(Severity.ERROR);
    }

    @Test
    @DisplayName("Unknown ids resolve to nothing")
    void unknown() {
        assertThat(SeverityTable.empty().lookup("stop_time.stop_exists")).isEmpty();
        assertThat(SeverityTable.empty().size()).isZero();
    }
}
