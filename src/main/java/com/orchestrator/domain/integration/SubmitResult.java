package com.orchestrator.domain.integration;

import com.orchestrator.domain.model.RawResult;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Outcome of submitting a query: rows, a failure, or a handle to poll.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SubmitResult {

    RawResult rows;
    String error;
    String handle;

    public static SubmitResult rows(RawResult rows) {
        return new SubmitResult(rows, null, null);
    }

    public static SubmitResult failed(String error) {
        return new SubmitResult(null, error, null);
    }

    public static SubmitResult handle(String handle) {
        return new SubmitResult(null, null, handle);
    }

    public boolean isPollable() {
        return handle != null;
    }

    public boolean isFailed() {
        return error != null;
    }
}
