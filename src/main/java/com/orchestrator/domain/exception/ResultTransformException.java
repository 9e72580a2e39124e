package com.orchestrator.domain.exception;

/**
 * A result transform rejected otherwise successful raw results.
 */
public class ResultTransformException extends RuntimeException {

    public ResultTransformException(String message) {
        super(message);
    }

    public ResultTransformException(String message, Throwable cause) {
        super(message, cause);
    }
}
