package com.orchestrator.domain.analysis;

import com.orchestrator.domain.model.RawResult;

import java.util.List;

/**
 * Turns the raw results of an analysis into its aggregate.
 *
 * Implementations must be deterministic and must not modify their input; the
 * runner passes an unmodifiable list ordered like the submitted queries.
 * Rejections are signalled with {@link com.orchestrator.domain.exception.ResultTransformException}.
 */
@FunctionalInterface
public interface ResultTransform<A> {

    A apply(List<RawResult> orderedResults);

    /**
     * Logical query names this transform expects, in order. Empty means any.
     */
    default List<String> expectedQueries() {
        return List.of();
    }
}
