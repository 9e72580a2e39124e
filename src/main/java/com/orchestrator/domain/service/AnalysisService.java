package com.orchestrator.domain.service;

import com.orchestrator.config.QueryRunnerProperties;
import com.orchestrator.domain.analysis.AnalysisRequest;
import com.orchestrator.domain.analysis.DimensionSlicesAnalysis;
import com.orchestrator.domain.analysis.MetricAggregateAnalysis;
import com.orchestrator.domain.analysis.QueryBuilder;
import com.orchestrator.domain.analysis.ResultTransform;
import com.orchestrator.domain.exception.AnalysisNotFoundException;
import com.orchestrator.domain.integration.Integration;
import com.orchestrator.domain.model.AnalysisKind;
import com.orchestrator.domain.model.AnalysisRecord;
import com.orchestrator.domain.model.DimensionSlicesParams;
import com.orchestrator.domain.model.DimensionSlicesRequest;
import com.orchestrator.domain.model.MetricAggregateParams;
import com.orchestrator.domain.model.MetricAggregateRequest;
import com.orchestrator.domain.model.QueryRecord;
import com.orchestrator.domain.store.AnalysisStore;
import com.orchestrator.infrastructure.cache.AnalysisCacheService;
import com.orchestrator.infrastructure.integration.IntegrationRegistry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Entry point for callers: start, cancel and read analyses.
 *
 * Resolves the integration for a data source and hands the work to the
 * {@link QueryRunner}. Finished analyses are served from the Redis cache.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AnalysisService {

    private final QueryRunner queryRunner;
    private final AnalysisStore store;
    private final IntegrationRegistry integrations;
    private final AnalysisCacheService cacheService;
    private final DimensionSlicesAnalysis dimensionSlicesAnalysis;
    private final MetricAggregateAnalysis metricAggregateAnalysis;
    private final QueryRunnerProperties properties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    /**
     * Runs an analysis and waits until it is settled.
     */
    public <P, A> AnalysisRecord startAnalysis(
            String integrationId,
            String targetKey,
            AnalysisKind kind,
            P params,
            List<QueryBuilder<P>> queryBuilders,
            ResultTransform<A> resultTransform) {
        AnalysisRequest<P, A> request = toRequest(targetKey, kind, params, queryBuilders, resultTransform);
        return queryRunner.startAnalysis(integrations.get(integrationId), request);
    }

    /**
     * Starts an analysis and returns the RUNNING record; poll {@link #getAnalysis} for the outcome.
     */
    public <P, A> AnalysisRecord submitAnalysis(
            String integrationId,
            String targetKey,
            AnalysisKind kind,
            P params,
            List<QueryBuilder<P>> queryBuilders,
            ResultTransform<A> resultTransform) {
        AnalysisRequest<P, A> request = toRequest(targetKey, kind, params, queryBuilders, resultTransform);
        return submit(integrationId, request);
    }

    public AnalysisRecord startDimensionSlices(DimensionSlicesRequest request) {
        DimensionSlicesParams params = DimensionSlicesParams.builder()
                .dataSourceId(request.getDataSourceId())
                .exposureQueryId(request.getExposureQueryId())
                .exposureQuery(request.getExposureQuery())
                .dimensions(request.getDimensions() != null ? request.getDimensions() : List.of())
                .startDate(lookbackStart(request.getLookbackDays()))
                .build();

        log.info("Start dimension slices: dataSource={}, exposureQuery={}, dimensions={}",
                request.getDataSourceId(), request.getExposureQueryId(), request.getDimensions());

        return submit(request.getDataSourceId(), dimensionSlicesAnalysis.toRequest(params));
    }

    public AnalysisRecord startMetricAggregate(MetricAggregateRequest request) {
        MetricAggregateParams params = MetricAggregateParams.builder()
                .dataSourceId(request.getDataSourceId())
                .metricId(request.getMetricId())
                .metricQuery(request.getMetricQuery())
                .startDate(lookbackStart(request.getLookbackDays()))
                .build();

        log.info("Start metric aggregate: dataSource={}, metric={}", request.getDataSourceId(), request.getMetricId());

        return submit(request.getDataSourceId(), metricAggregateAnalysis.toRequest(params));
    }

    public void cancelAnalysis(String analysisId) {
        AnalysisRecord analysis = store.getAnalysisById(analysisId)
                .orElseThrow(() -> new AnalysisNotFoundException(analysisId));

        // The data source may have been removed since the analysis started
        Integration integration = integrations.find(analysis.getIntegrationId()).orElse(null);
        queryRunner.cancelQueries(integration, analysisId);
    }

    /**
     * Reads an analysis, from the cache when it is already finished.
     */
    public AnalysisRecord getAnalysis(String analysisId) {
        Optional<AnalysisRecord> cached = cacheService.get(analysisId);
        if (cached.isPresent()) {
            Counter.builder("analysis.cache")
                    .tag("result", "hit")
                    .register(meterRegistry)
                    .increment();
            return cached.get();
        }

        Counter.builder("analysis.cache")
                .tag("result", "miss")
                .register(meterRegistry)
                .increment();

        AnalysisRecord analysis = store.getAnalysisById(analysisId)
                .orElseThrow(() -> new AnalysisNotFoundException(analysisId));

        if (analysis.isTerminal()) {
            cacheService.put(analysis, properties.getCacheTtlSeconds());
        }
        return analysis;
    }

    /**
     * Queries in the requested order, with null for unknown ids.
     */
    public List<QueryRecord> getQueries(List<String> queryIds) {
        Map<String, QueryRecord> byId = store.getQueriesByIds(queryIds).stream()
                .collect(Collectors.toMap(QueryRecord::getId, Function.identity(), (first, second) -> first));

        List<QueryRecord> queries = new ArrayList<>(queryIds.size());
        for (String id : queryIds) {
            queries.add(byId.get(id));
        }
        return queries;
    }

    public Optional<AnalysisRecord> getLatestAnalysis(String targetKey) {
        return store.findLatestAnalysis(targetKey);
    }

    public Optional<AnalysisRecord> getLatestDimensionSlices(String dataSourceId, String exposureQueryId) {
        DimensionSlicesParams params = DimensionSlicesParams.builder()
                .dataSourceId(dataSourceId)
                .exposureQueryId(exposureQueryId)
                .build();
        return getLatestAnalysis(dimensionSlicesAnalysis.targetKey(params));
    }

    private <P, A> AnalysisRecord submit(String integrationId, AnalysisRequest<P, A> request) {
        return queryRunner.submitAnalysis(integrations.get(integrationId), request);
    }

    private Instant lookbackStart(int lookbackDays) {
        if (lookbackDays < 1 || lookbackDays > 365) {
            throw new IllegalArgumentException("lookbackDays must be between 1 and 365: " + lookbackDays);
        }
        return clock.instant().minus(Duration.ofDays(lookbackDays));
    }

    private static <P, A> AnalysisRequest<P, A> toRequest(
            String targetKey,
            AnalysisKind kind,
            P params,
            List<QueryBuilder<P>> queryBuilders,
            ResultTransform<A> resultTransform) {
        return AnalysisRequest.<P, A>builder()
                .targetKey(targetKey)
                .kind(kind != null ? kind : AnalysisKind.CUSTOM)
                .params(params)
                .queryBuilders(queryBuilders)
                .resultTransform(resultTransform)
                .build();
    }
}
