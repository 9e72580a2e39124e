package com.orchestrator.domain.integration;

import java.util.Map;

/**
 * Adapter to one external data warehouse.
 *
 * Synchronous warehouses answer submitQuery with rows directly. Job-based
 * warehouses return a handle that is then polled until terminal.
 * Transport or authentication problems surface as {@link IntegrationException}.
 */
public interface Integration {

    /**
     * Identifier the analysis records refer to.
     */
    String getId();

    SubmitResult submitQuery(String sql, Map<String, String> templateVariables);

    PollResult pollQuery(String handle);

    /**
     * Best-effort request to stop a running external job.
     */
    void cancelQuery(String handle);
}
