package com.transitgate.interfaces.api.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.List;
import java.util.Map;
import java.util.Objects;

public record QualityGateRunRequest(
        @NotBlank(message = "Dataset name is required")
        @Size(max = 200, message = "Dataset name must not exceed 200 characters")
        String name,

        @NotNull(message = "Records are required")
        List<Map<String, Object>> records,

        Map<String, List<Map<String, Object>>> referenceTables,

        @Valid
        PolicyRequest policy
) {

    @AssertTrue(message = "Record rows must not be null")
    public boolean isRecordRowsPresent() {
        return records == null || records.stream().allMatch(Objects::nonNull);
    }

    @AssertTrue(message = "Reference table rows must not be null")
    public boolean isReferenceTableRowsPresent() {
        return referenceTables == null || referenceTables.values().stream()
                .allMatch(rows -> rows != null && rows.stream().allMatch(Objects::nonNull));
    }
}
