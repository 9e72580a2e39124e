package com.orchestrator.domain.service;

import com.orchestrator.config.QueryRunnerProperties;
import com.orchestrator.domain.analysis.AnalysisDefinition;
import com.orchestrator.domain.analysis.AnalysisDefinitions;
import com.orchestrator.domain.analysis.ResultTransform;
import com.orchestrator.domain.integration.Integration;
import com.orchestrator.domain.model.AnalysisRecord;
import com.orchestrator.domain.store.AnalysisStore;
import com.orchestrator.infrastructure.integration.IntegrationRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Closes analyses left QUEUED or RUNNING by a process that died.
 *
 * An active analysis holds the single-flight slot of its target, so without
 * this job a crash would block the target forever.
 *
 * Processing Flow:
 * 1. Find active analyses every few minutes
 * 2. Skip the ones this process is still running
 * 3. Recover the ones older than app.runner.stale-after
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AnalysisRecoveryJob {

    private final AnalysisStore store;
    private final QueryRunner queryRunner;
    private final IntegrationRegistry integrations;
    private final AnalysisDefinitions definitions;
    private final QueryRunnerProperties properties;
    private final Clock clock;

    @Scheduled(
            fixedDelayString = "${app.runner.recovery-interval-ms:300000}",
            initialDelayString = "${app.runner.recovery-initial-delay-ms:30000}")
    public void recoverAbandonedAnalyses() {
        try {
            Instant cutoff = clock.instant().minus(properties.getStaleAfter());
            List<AnalysisRecord> stale = store.findActiveAnalyses().stream()
                    .filter(analysis -> !queryRunner.isActive(analysis.getId()))
                    .filter(analysis -> lastActivity(analysis).isBefore(cutoff))
                    .collect(Collectors.toList());

            if (stale.isEmpty()) {
                return;
            }

            log.info("Recovering {} abandoned analyses", stale.size());

            for (AnalysisRecord analysis : stale) {
                recover(analysis);
            }

        } catch (Exception e) {
            log.error("Error recovering abandoned analyses: {}", e.getMessage(), e);
        }
    }

    private void recover(AnalysisRecord analysis) {
        try {
            Integration integration = integrations.find(analysis.getIntegrationId()).orElse(null);

            ResultTransform<?> transform = null;
            Optional<AnalysisDefinition<?, ?>> definition = definitions.forKind(analysis.getKind());
            if (definition.isPresent()) {
                transform = definition.get().resultTransform();
            }

            AnalysisRecord recovered = queryRunner.recoverAbandoned(analysis, integration, transform);
            log.info("Abandoned analysis {} closed as {}", analysis.getId(), recovered.getStatus());

        } catch (Exception e) {
            log.error("Error recovering analysis {}: {}", analysis.getId(), e.getMessage(), e);
        }
    }

    private static Instant lastActivity(AnalysisRecord analysis) {
        return analysis.getStartedAt() != null ? analysis.getStartedAt() : analysis.getCreatedAt();
    }
}
