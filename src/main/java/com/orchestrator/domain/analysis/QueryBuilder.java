package com.orchestrator.domain.analysis;

import com.orchestrator.domain.model.QuerySpec;

/**
 * Builds one query from analysis params. Failures should be reported as
 * {@link com.orchestrator.domain.exception.QueryBuildException}; any other
 * runtime exception is wrapped into one by the runner.
 */
@FunctionalInterface
public interface QueryBuilder<P> {

    QuerySpec build(P params);
}
