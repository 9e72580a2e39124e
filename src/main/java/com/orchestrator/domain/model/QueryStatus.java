package com.orchestrator.domain.model;

public enum QueryStatus {
    RUNNING,
    SUCCEEDED,
    FAILED,
    CANCELED;

    public boolean isTerminal() {
        return this != RUNNING;
    }
}
