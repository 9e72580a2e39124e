package com.orchestrator.domain.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.time.Instant;

/**
 * Patch applied to a running query record.
 *
 * A handle patch keeps the record RUNNING; every other patch is a terminal transition.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class QueryUpdate {

    QueryStatus status;
    String externalHandle;
    RawResult rawResult;
    String error;
    ErrorKind errorKind;
    Instant finishedAt;

    public static QueryUpdate handle(String externalHandle) {
        return new QueryUpdate(QueryStatus.RUNNING, externalHandle, null, null, null, null);
    }

    public static QueryUpdate succeeded(RawResult rawResult, Instant at) {
        return new QueryUpdate(QueryStatus.SUCCEEDED, null, rawResult, null, null, at);
    }

    public static QueryUpdate failed(ErrorKind kind, String error, Instant at) {
        return new QueryUpdate(QueryStatus.FAILED, null, null, error, kind, at);
    }

    public static QueryUpdate canceled(Instant at) {
        return new QueryUpdate(QueryStatus.CANCELED, null, null, null, null, at);
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }
}
