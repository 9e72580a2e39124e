package com.orchestrator.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class MetricAggregateParams {

    String dataSourceId;
    String metricId;

    // SQL of the metric; its rows carry timestamp and value columns
    String metricQuery;

    Instant startDate;
}
