package com.orchestrator.domain.model;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MetricAggregateRequest {

    @NotBlank
    private String dataSourceId;

    @NotBlank
    private String metricId;

    @NotBlank
    private String metricQuery;

    @Min(1)
    @Max(365)
    private Integer lookbackDays;

    public Integer getLookbackDays() {
        return lookbackDays == null ? 30 : lookbackDays;
    }
}
