package com.orchestrator.domain.store;

import com.orchestrator.domain.model.AnalysisRecord;
import com.orchestrator.domain.model.AnalysisUpdate;
import com.orchestrator.domain.model.QueryRecord;
import com.orchestrator.domain.model.QueryUpdate;

import java.util.List;
import java.util.Optional;

/**
 * Persistence for analysis and query records.
 *
 * Updates are conditional: a query patch only applies while the query is
 * RUNNING and an analysis patch only while the analysis is QUEUED or RUNNING
 * (RUNNING patches only from QUEUED). They return false when nothing changed.
 */
public interface AnalysisStore {

    QueryRecord createQuery(QueryRecord record);

    boolean updateQuery(String queryId, QueryUpdate update);

    /**
     * Records in the order of the given ids; unknown ids are skipped.
     */
    List<QueryRecord> getQueriesByIds(List<String> queryIds);

    Optional<QueryRecord> getQueryById(String queryId);

    /**
     * Inserts the record unless another QUEUED or RUNNING record exists for
     * its target key. Atomic with respect to concurrent callers.
     *
     * @throws com.orchestrator.domain.exception.AnalysisConflictException naming the existing analysis
     */
    AnalysisRecord createAnalysisIfAbsent(AnalysisRecord initial);

    boolean updateAnalysis(String analysisId, AnalysisUpdate update);

    Optional<AnalysisRecord> getAnalysisById(String analysisId);

    List<AnalysisRecord> findActiveAnalyses();

    Optional<AnalysisRecord> findLatestAnalysis(String targetKey);
}
