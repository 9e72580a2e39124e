package com.orchestrator.domain.service;

import com.orchestrator.domain.integration.Integration;
import com.orchestrator.domain.model.ErrorKind;
import lombok.Getter;
import lombok.Value;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-process state of one running analysis: the cancellation flag its poll
 * loops check, and the first query failure.
 */
final class RunContext {

    @Getter
    private final String analysisId;

    @Getter
    private final Integration integration;

    private final AtomicBoolean canceled = new AtomicBoolean();
    private final AtomicReference<Failure> firstFailure = new AtomicReference<>();

    RunContext(String analysisId, Integration integration) {
        this.analysisId = analysisId;
        this.integration = integration;
    }

    void cancel() {
        canceled.set(true);
    }

    boolean isCanceled() {
        return canceled.get();
    }

    /**
     * @return true if this is the first failure of the analysis
     */
    boolean recordFailure(String queryId, ErrorKind kind, String message) {
        return firstFailure.compareAndSet(null, new Failure(queryId, kind, message));
    }

    Failure getFirstFailure() {
        return firstFailure.get();
    }

    boolean shouldStop() {
        return canceled.get() || firstFailure.get() != null;
    }

    @Value
    static class Failure {
        String queryId;
        ErrorKind kind;
        String message;
    }
}
