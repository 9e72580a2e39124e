package com.orchestrator.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Most common values per dimension of an exposure query.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DimensionSlicesResult {

    private List<DimensionSlices> dimensions;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class DimensionSlices {
        private String dimension;
        private long totalUnits;
        private List<Slice> slices;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Slice {
        private String value;
        private long units;
        private double percent;
    }
}
