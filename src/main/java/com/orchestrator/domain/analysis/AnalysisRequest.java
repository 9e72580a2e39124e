package com.orchestrator.domain.analysis;

import com.orchestrator.domain.model.AnalysisKind;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Everything the runner needs to start one analysis.
 */
@Value
@Builder
public class AnalysisRequest<P, A> {

    @NonNull
    String targetKey;

    @Builder.Default
    AnalysisKind kind = AnalysisKind.CUSTOM;

    P params;

    @Singular
    List<QueryBuilder<P>> queryBuilders;

    @NonNull
    ResultTransform<A> resultTransform;
}
