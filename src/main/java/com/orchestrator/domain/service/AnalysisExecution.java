package com.orchestrator.domain.service;

import com.orchestrator.domain.model.AnalysisRecord;
import lombok.Value;

import java.util.concurrent.CompletableFuture;

/**
 * A launched analysis: the record as it was when its queries were submitted,
 * and a future completing with the settled record.
 */
@Value
public class AnalysisExecution {

    AnalysisRecord started;

    CompletableFuture<AnalysisRecord> completion;
}
