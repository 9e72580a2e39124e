package com.orchestrator.domain.exception;

/**
 * Query construction from analysis params failed. Raised before anything is persisted.
 */
public class QueryBuildException extends RuntimeException {

    public QueryBuildException(String message) {
        super(message);
    }

    public QueryBuildException(String message, Throwable cause) {
        super(message, cause);
    }
}
