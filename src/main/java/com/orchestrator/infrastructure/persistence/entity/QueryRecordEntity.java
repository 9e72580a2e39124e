package com.orchestrator.infrastructure.persistence.entity;

import com.orchestrator.domain.model.ErrorKind;
import com.orchestrator.domain.model.QueryStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Entity for one submitted query. Rows are only updated while status is RUNNING.
 */
@Entity
@Table(name = "analysis_queries", indexes = {
        @Index(name = "idx_query_analysis", columnList = "analysis_id"),
        @Index(name = "idx_query_status", columnList = "status")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryRecordEntity {

    @Id
    @Column(name = "id", length = 40)
    private String id;

    @Version
    private Long version;

    @Column(name = "analysis_id", nullable = false, length = 40)
    private String analysisId;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "query_sql", nullable = false, updatable = false, columnDefinition = "TEXT")
    private String sql;

    // JSON object
    @Column(name = "template_variables", columnDefinition = "TEXT")
    private String templateVariables;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private QueryStatus status;

    @Column(name = "external_handle", length = 512)
    private String externalHandle;

    // JSON rows, can be large
    @Column(name = "raw_result", columnDefinition = "TEXT")
    private String rawResult;

    @Column(name = "error", columnDefinition = "TEXT")
    private String error;

    @Enumerated(EnumType.STRING)
    @Column(name = "error_kind", length = 20)
    private ErrorKind errorKind;

    @Column(name = "started_at", nullable = false)
    private Instant startedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;
}
