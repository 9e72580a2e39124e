package com.orchestrator.domain.model;

/**
 * Error categories recorded on queries and analyses.
 *
 * BUILD, CONFLICT and NOT_FOUND are only ever thrown to callers; the other
 * kinds are captured into records.
 */
public enum ErrorKind {
    BUILD,
    SUBMISSION,
    EXECUTION,
    TIMEOUT,
    TRANSFORM,
    CONFLICT,
    NOT_FOUND,
    ABANDONED
}
