package com.orchestrator.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;

/**
 * Rows returned by the warehouse for one query, column label -> value.
 */
@Value
@Builder
@Jacksonized
public class RawResult {

    @Builder.Default
    List<Map<String, Object>> rows = List.of();

    Long durationMs;

    public static RawResult of(List<Map<String, Object>> rows) {
        return RawResult.builder().rows(List.copyOf(rows)).build();
    }

    @JsonIgnore
    public int size() {
        return rows.size();
    }
}
