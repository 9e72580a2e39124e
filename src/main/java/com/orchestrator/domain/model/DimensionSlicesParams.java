package com.orchestrator.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class DimensionSlicesParams {

    String dataSourceId;
    String exposureQueryId;

    // SQL of the exposure query; its rows carry a timestamp column and the dimension columns
    String exposureQuery;

    @Singular
    List<String> dimensions;

    Instant startDate;
}
