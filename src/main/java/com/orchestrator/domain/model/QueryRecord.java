package com.orchestrator.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Map;

/**
 * Persisted state of one submitted query.
 *
 * rawResult is set iff status is SUCCEEDED, error iff status is FAILED.
 * Once terminal the record is never modified.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class QueryRecord {

    String id;
    String analysisId;
    String name;
    String sql;

    @Builder.Default
    Map<String, String> templateVariables = Map.of();

    QueryStatus status;
    String externalHandle;
    RawResult rawResult;
    String error;
    ErrorKind errorKind;
    Instant startedAt;
    Instant finishedAt;

    @JsonIgnore
    public boolean isRunning() {
        return status == QueryStatus.RUNNING;
    }
}
