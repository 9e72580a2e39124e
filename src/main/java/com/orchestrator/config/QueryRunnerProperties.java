package com.orchestrator.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Settings of the query runner, bound from app.runner.*
 */
@Data
@ConfigurationProperties(prefix = "app.runner")
public class QueryRunnerProperties {

    private Duration pollInterval = Duration.ofSeconds(5);

    // Warehouse jobs can legitimately run for hours
    private Duration queryTimeout = Duration.ofHours(2);

    private int workerPoolSize = 16;

    private int queueCapacity = 500;

    private int maxErrorLength = 1000;

    private long cacheTtlSeconds = 3600;

    // Active analyses not owned by this process and older than this are recovered
    private Duration staleAfter = Duration.ofHours(6);
}
