package com.orchestrator.domain.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.time.Instant;

/**
 * Patch applied to an analysis record.
 *
 * Every patch moves the status forward. Query ids are fixed when the analysis
 * is inserted and never patched.
 * running() only applies to a QUEUED record; terminal patches apply to any active record.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class AnalysisUpdate {

    AnalysisStatus status;
    JsonNode result;
    String error;
    ErrorKind errorKind;
    Instant at;

    public static AnalysisUpdate running(Instant at) {
        return new AnalysisUpdate(AnalysisStatus.RUNNING, null, null, null, at);
    }

    public static AnalysisUpdate success(JsonNode result, Instant at) {
        return new AnalysisUpdate(AnalysisStatus.SUCCESS, result, null, null, at);
    }

    public static AnalysisUpdate error(ErrorKind kind, String error, Instant at) {
        return new AnalysisUpdate(AnalysisStatus.ERROR, null, error, kind, at);
    }

    public static AnalysisUpdate canceled(Instant at) {
        return new AnalysisUpdate(AnalysisStatus.CANCELED, null, null, null, at);
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }
}
