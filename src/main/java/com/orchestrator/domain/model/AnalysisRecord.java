package com.orchestrator.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * Persisted state of one analysis request.
 *
 * result is present iff status is SUCCESS, error iff status is ERROR.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class AnalysisRecord {

    String id;
    String targetKey;
    AnalysisKind kind;
    String integrationId;
    AnalysisStatus status;

    @Builder.Default
    List<String> queryIds = List.of();

    JsonNode result;
    String error;
    ErrorKind errorKind;
    Instant createdAt;
    Instant startedAt;
    Instant finishedAt;

    @JsonIgnore
    public boolean isTerminal() {
        return status.isTerminal();
    }
}
