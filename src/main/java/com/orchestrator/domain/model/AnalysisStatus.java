package com.orchestrator.domain.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of an analysis.
 *
 * QUEUED -> RUNNING -> {SUCCESS | ERROR | CANCELED}. Terminal statuses never change.
 */
public enum AnalysisStatus {
    QUEUED,
    RUNNING,
    SUCCESS,
    ERROR,
    CANCELED;

    public static final Set<AnalysisStatus> ACTIVE = EnumSet.of(QUEUED, RUNNING);

    public boolean isTerminal() {
        return !ACTIVE.contains(this);
    }
}
