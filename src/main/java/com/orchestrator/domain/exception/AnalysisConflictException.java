package com.orchestrator.domain.exception;

import lombok.Getter;

/**
 * Thrown when an analysis is already queued or running for the same target key.
 */
@Getter
public class AnalysisConflictException extends RuntimeException {

    private final String targetKey;
    private final String existingAnalysisId;

    public AnalysisConflictException(String targetKey, String existingAnalysisId) {
        super("Analysis " + existingAnalysisId + " is already in progress for " + targetKey);
        this.targetKey = targetKey;
        this.existingAnalysisId = existingAnalysisId;
    }
}
