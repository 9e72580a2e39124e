package com.orchestrator.domain.model;

public enum AnalysisKind {
    DIMENSION_SLICES,
    METRIC_AGGREGATE,
    CUSTOM
}
