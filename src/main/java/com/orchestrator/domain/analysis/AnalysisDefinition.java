package com.orchestrator.domain.analysis;

import com.orchestrator.domain.model.AnalysisKind;

import java.util.List;

/**
 * A kind of analysis: how its queries are built and how their results are aggregated.
 *
 * The transform must not depend on params, so an analysis can be aggregated
 * from its persisted query records alone (see the recovery job).
 */
public interface AnalysisDefinition<P, A> {

    AnalysisKind kind();

    String targetKey(P params);

    List<QueryBuilder<P>> queryBuilders(P params);

    ResultTransform<A> resultTransform();

    default AnalysisRequest<P, A> toRequest(P params) {
        return AnalysisRequest.<P, A>builder()
                .targetKey(targetKey(params))
                .kind(kind())
                .params(params)
                .queryBuilders(queryBuilders(params))
                .resultTransform(resultTransform())
                .build();
    }
}
