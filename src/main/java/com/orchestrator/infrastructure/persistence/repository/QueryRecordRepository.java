package com.orchestrator.infrastructure.persistence.repository;

import com.orchestrator.domain.model.ErrorKind;
import com.orchestrator.domain.model.QueryStatus;
import com.orchestrator.infrastructure.persistence.entity.QueryRecordEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

@Repository
public interface QueryRecordRepository extends JpaRepository<QueryRecordEntity, String> {

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE QueryRecordEntity q SET q.externalHandle = :handle " +
           "WHERE q.id = :id AND q.status = :running")
    int attachHandle(
            @Param("id") String id,
            @Param("handle") String handle,
            @Param("running") QueryStatus running
    );

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE QueryRecordEntity q SET q.status = :status, q.rawResult = :rawResult, " +
           "q.error = :error, q.errorKind = :errorKind, q.finishedAt = :at " +
           "WHERE q.id = :id AND q.status = :running")
    int complete(
            @Param("id") String id,
            @Param("status") QueryStatus status,
            @Param("rawResult") String rawResult,
            @Param("error") String error,
            @Param("errorKind") ErrorKind errorKind,
            @Param("at") Instant at,
            @Param("running") QueryStatus running
    );
}
