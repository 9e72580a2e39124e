package com.orchestrator.domain.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * One query produced by a query builder, before it is submitted.
 */
@Value
@Builder
public class QuerySpec {

    String name;

    String sql;

    @Builder.Default
    Map<String, String> templateVariables = Map.of();
}
