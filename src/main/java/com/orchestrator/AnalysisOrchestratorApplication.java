package com.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Analysis Query Orchestrator
 *
 * Runs analyses (dimension slices, metric aggregates, ...) as sets of queries
 * against pluggable data warehouses and persists the aggregated result.
 *
 * Architecture:
 * - REST API to start, cancel and read analyses
 * - Query runner submitting queries concurrently and polling long-running jobs
 * - At most one active analysis per target, enforced by the database
 * - Redis cache for finished analyses
 * - Scheduled recovery of analyses abandoned by a crashed process
 */
@SpringBootApplication
@EnableScheduling
public class AnalysisOrchestratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(AnalysisOrchestratorApplication.class, args);
    }
}
