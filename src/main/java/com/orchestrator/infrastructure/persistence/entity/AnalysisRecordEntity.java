package com.orchestrator.infrastructure.persistence.entity;

import com.orchestrator.domain.model.AnalysisKind;
import com.orchestrator.domain.model.AnalysisStatus;
import com.orchestrator.domain.model.ErrorKind;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Entity for one analysis.
 *
 * Single-flight guard: active_target_key holds the target key while the
 * analysis is QUEUED or RUNNING and is set to NULL by the same statement that
 * writes a terminal status. The unique constraint on it lets the database
 * reject a second active analysis for a target, whatever the race.
 */
@Entity
@Table(name = "analyses",
        indexes = {
                @Index(name = "idx_analysis_target_created", columnList = "target_key,created_at"),
                @Index(name = "idx_analysis_status", columnList = "status")
        },
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_analysis_active_target", columnNames = "active_target_key")
        })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisRecordEntity {

    @Id
    @Column(name = "id", length = 40)
    private String id;

    @Version
    private Long version;

    @Column(name = "target_key", nullable = false)
    private String targetKey;

    @Column(name = "active_target_key")
    private String activeTargetKey;

    @Enumerated(EnumType.STRING)
    @Column(name = "kind", nullable = false, length = 30)
    private AnalysisKind kind;

    @Column(name = "integration_id", nullable = false, length = 100)
    private String integrationId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private AnalysisStatus status;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "analysis_query_order", joinColumns = @JoinColumn(name = "analysis_id"))
    @OrderColumn(name = "query_order")
    @Column(name = "query_id", length = 40)
    @Builder.Default
    private List<String> queryIds = new ArrayList<>();

    // Aggregate as JSON
    @Column(name = "result", columnDefinition = "TEXT")
    private String result;

    @Column(name = "error", columnDefinition = "TEXT")
    private String error;

    @Enumerated(EnumType.STRING)
    @Column(name = "error_kind", length = 20)
    private ErrorKind errorKind;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;
}
