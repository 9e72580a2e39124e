package com.orchestrator.domain.model;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Request to compute dimension slices for an exposure query.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DimensionSlicesRequest {

    @NotBlank
    private String dataSourceId;

    @NotBlank
    private String exposureQueryId;

    @NotBlank
    private String exposureQuery;

    @NotEmpty
    private List<String> dimensions;

    @Min(1)
    @Max(365)
    private Integer lookbackDays;

    // Defaults
    public Integer getLookbackDays() {
        return lookbackDays == null ? 30 : lookbackDays;
    }
}
