package com.transitgate.support;

import com.transitgate.domain.dataset.model.Dataset;
import com.transitgate.domain.dataset.model.DatasetSchema;
import com.transitgate.domain.dataset.model.FieldSpec;
import com.transitgate.domain.dataset.model.FieldType;
import com.transitgate.domain.quality.model.Severity;
import com.transitgate.infrastructure.quality.classification.SeverityTable;
import com.transitgate.infrastructure.quality.validation.domain.CoordinateBoundsRule;
import com.transitgate.infrastructure.quality.validation.domain.DomainRuleRegistry;
import com.transitgate.infrastructure.quality.validation.domain.FieldOrderRule;
import com.transitgate.infrastructure.quality.validation.domain.NonNegativeRule;
import com.transitgate.infrastructure.quality.validation.domain.SequenceMonotonicRule;
import com.transitgate.infrastructure.quality.validation.relational.CompletenessRule;
import com.transitgate.infrastructure.quality.validation.relational.ForeignKeyRule;
import com.transitgate.infrastructure.quality.validation.relational.RelationalRuleRegistry;
import com.transitgate.infrastructure.quality.validation.relational.UniqueKeyRule;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * GTFS-style stop_times rows and the rule catalog the default configuration ships.
 */
public final class StopTimeFixtures {

    public static final Clock FIXED_CLOCK = Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC);

    private StopTimeFixtures() {
    }

    public static DatasetSchema schema() {
        return DatasetSchema.of(
                FieldSpec.builder("trip_id").required().build(),
                FieldSpec.builder("stop_id").required().build(),
                FieldSpec.builder("stop_sequence").type(FieldType.NUMBER).required().min("0").build(),
                FieldSpec.builder("arrival_time").type(FieldType.TIME).required().build(),
                FieldSpec.builder("departure_time").type(FieldType.TIME).required().build(),
                FieldSpec.builder("stop_lat").type(FieldType.NUMBER).build(),
                FieldSpec.builder("stop_lon").type(FieldType.NUMBER).build(),
                FieldSpec.builder("shape_dist_traveled").type(FieldType.NUMBER).build());
    }

    public static Map<String, Object> row(String tripId, String stopId, String sequence,
                                          String arrival, String departure) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("trip_id", tripId);
        row.put("stop_id", stopId);
        row.put("stop_sequence", sequence);
        row.put("arrival_time", arrival);
        row.put("departure_time", departure);
        row.put("stop_lat", "40.7128");
        row.put("stop_lon", "-74.0060");
        row.put("shape_dist_traveled", "0.0");
        return row;
    }

    /**
     * Two well-formed trips of two stops each, all stops known.
     */
    public static List<Map<String, Object>> validRows() {
        List<Map<String, Object>> rows = new ArrayList<>();
        rows.add(row("T1", "S1", "1", "08:00:00", "08:01:00"));
        rows.add(row("T1", "S2", "2", "08:10:00", "08:11:00"));
        rows.add(row("T2", "S2", "1", "09:00:00", "09:00:00"));
        rows.add(row("T2", "S3", "2", "24:15:00", "24:16:00"));
        return rows;
    }

    public static Dataset stopTimes(List<Map<String, Object>> rows) {
        return Dataset.fromRows("stop_times", rows).withReferenceTable("stops", stops("S1", "S2", "S3"));
    }

    public static Dataset stops(String... stopIds) {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (String stopId : stopIds) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("stop_id", stopId);
            row.put("stop_name", "Stop " + stopId);
            rows.add(row);
        }
        return Dataset.fromRows("stops", rows);
    }

    public static DomainRuleRegistry domainRules() {
        return new DomainRuleRegistry(List.of(
                new FieldOrderRule("stop_time.arrival_before_departure", "arrival_time", "departure_time", false),
                new CoordinateBoundsRule("stop_time.coordinates_in_range", "stop_lat", "stop_lon"),
                new NonNegativeRule("stop_time.distance_non_negative", List.of("shape_dist_traveled"), false),
                new SequenceMonotonicRule("trip.stop_sequence_increasing", "trip_id", "stop_sequence")));
    }

    public static RelationalRuleRegistry relationalRules() {
        return new RelationalRuleRegistry(List.of(
                new ForeignKeyRule("stop_time.stop_exists", "stop_id", "stops", "stop_id"),
                new UniqueKeyRule("stop_time.unique_trip_sequence", List.of("trip_id", "stop_sequence")),
                new CompletenessRule("trip.min_stop_times", "trip_id", 2)));
    }

    public static SeverityTable severityTable() {
        Map<String, Severity> entries = new LinkedHashMap<>();
        entries.put("field.*.required", Severity.CRITICAL);
        entries.put("field.*.type", Severity.ERROR);
        entries.put("field.*.range", Severity.ERROR);
        entries.put("stop_time.arrival_before_departure", Severity.ERROR);
        entries.put("stop_time.coordinates_in_range", Severity.ERROR);
        entries.put("stop_time.distance_non_negative", Severity.ERROR);
        entries.put("trip.stop_sequence_increasing", Severity.CRITICAL);
        entries.put("stop_time.stop_exists", Severity.CRITICAL);
        entries.put("stop_time.unique_trip_sequence", Severity.CRITICAL);
        entries.put("trip.min_stop_times", Severity.WARNING);
        return new SeverityTable(entries);
    }
}
