package com.orchestrator.infrastructure.persistence.repository;

import com.orchestrator.domain.model.AnalysisStatus;
import com.orchestrator.domain.model.ErrorKind;
import com.orchestrator.infrastructure.persistence.entity.AnalysisRecordEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface AnalysisRecordRepository extends JpaRepository<AnalysisRecordEntity, String> {

    Optional<AnalysisRecordEntity> findByActiveTargetKey(String activeTargetKey);

    List<AnalysisRecordEntity> findByStatusIn(Collection<AnalysisStatus> statuses);

    Optional<AnalysisRecordEntity> findFirstByTargetKeyOrderByCreatedAtDesc(String targetKey);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE AnalysisRecordEntity a SET a.status = :running, a.startedAt = :at, a.version = a.version + 1 " +
           "WHERE a.id = :id AND a.status = :queued")
    int markRunning(
            @Param("id") String id,
            @Param("at") Instant at,
            @Param("queued") AnalysisStatus queued,
            @Param("running") AnalysisStatus running
    );

    /**
     * Terminal transition. Releases the active target key in the same statement.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE AnalysisRecordEntity a SET a.status = :status, a.result = :result, " +
           "a.error = :error, a.errorKind = :errorKind, a.finishedAt = :at, a.activeTargetKey = NULL, " +
           "a.version = a.version + 1 " +
           "WHERE a.id = :id AND a.status IN :active")
    int complete(
            @Param("id") String id,
            @Param("status") AnalysisStatus status,
            @Param("result") String result,
            @Param("error") String error,
            @Param("errorKind") ErrorKind errorKind,
            @Param("at") Instant at,
            @Param("active") Collection<AnalysisStatus> active
    );
}
