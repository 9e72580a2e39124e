package com.orchestrator.domain.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.orchestrator.config.QueryRunnerProperties;
import com.orchestrator.domain.analysis.AnalysisRequest;
import com.orchestrator.domain.analysis.QueryBuilder;
import com.orchestrator.domain.analysis.ResultTransform;
import com.orchestrator.domain.exception.AnalysisNotFoundException;
import com.orchestrator.domain.exception.QueryBuildException;
import com.orchestrator.domain.exception.ResultTransformException;
import com.orchestrator.domain.integration.Integration;
import com.orchestrator.domain.integration.PollResult;
import com.orchestrator.domain.integration.SubmitResult;
import com.orchestrator.domain.model.AnalysisRecord;
import com.orchestrator.domain.model.AnalysisStatus;
import com.orchestrator.domain.model.AnalysisUpdate;
import com.orchestrator.domain.model.ErrorKind;
import com.orchestrator.domain.model.QueryRecord;
import com.orchestrator.domain.model.QuerySpec;
import com.orchestrator.domain.model.QueryStatus;
import com.orchestrator.domain.model.QueryUpdate;
import com.orchestrator.domain.model.RawResult;
import com.orchestrator.domain.store.AnalysisStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.stream.Collectors;

/**
 * Runs the queries of an analysis and turns their results into the analysis outcome.
 *
 * Lifecycle:
 * 1. Build every query from the params (nothing is persisted if this fails)
 * 2. Insert the analysis as QUEUED, with its query ids, through the single-flight guard
 * 3. Create one RUNNING query record per query, mark the analysis RUNNING
 * 4. Submit all queries concurrently on the query executor; pollable ones are
 *    polled until terminal or timed out
 * 5. Once every query is terminal, settle the analysis:
 *    all succeeded -> transform -> SUCCESS, any failed -> ERROR, canceled -> CANCELED
 *
 * The first failed query stops the others (fail-fast). Cancellation is
 * cooperative: poll loops check the run's flag and the persisted query status
 * on every iteration.
 *
 * Errors after step 2 never escape: they end up in the query and analysis records.
 */
@Slf4j
@Service
public class QueryRunner {

    private final AnalysisStore store;
    private final Executor queryExecutor;
    private final QueryRunnerProperties properties;
    private final MeterRegistry meterRegistry;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final PollSleeper sleeper;

    private final ConcurrentHashMap<String, RunContext> activeRuns = new ConcurrentHashMap<>();

    public QueryRunner(
            AnalysisStore store,
            @Qualifier("queryExecutor") Executor queryExecutor,
            QueryRunnerProperties properties,
            MeterRegistry meterRegistry,
            ObjectMapper objectMapper,
            Clock clock,
            PollSleeper sleeper) {
        this.store = store;
        this.queryExecutor = queryExecutor;
        this.properties = properties;
        this.meterRegistry = meterRegistry;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    /**
     * Runs the analysis and blocks until it is settled.
     *
     * @throws QueryBuildException if a query cannot be built from the params
     * @throws com.orchestrator.domain.exception.AnalysisConflictException if the target is busy
     */
    public <P, A> AnalysisRecord startAnalysis(Integration integration, AnalysisRequest<P, A> request) {
        return launch(integration, request).getCompletion().join();
    }

    /**
     * Starts the analysis and returns as soon as its queries are submitted.
     */
    public <P, A> AnalysisRecord submitAnalysis(Integration integration, AnalysisRequest<P, A> request) {
        return launch(integration, request).getStarted();
    }

    public <P, A> AnalysisExecution launch(Integration integration, AnalysisRequest<P, A> request) {
        List<QuerySpec> specs = buildQueries(request);

        // Ids are fixed up front so the analysis row is never rewritten after insert
        List<String> queryIds = new ArrayList<>(specs.size());
        for (int i = 0; i < specs.size(); i++) {
            queryIds.add(newId("qry"));
        }

        AnalysisRecord analysis = store.createAnalysisIfAbsent(AnalysisRecord.builder()
                .id(newId("ana"))
                .targetKey(request.getTargetKey())
                .kind(request.getKind())
                .integrationId(integration.getId())
                .status(AnalysisStatus.QUEUED)
                .queryIds(queryIds)
                .createdAt(clock.instant())
                .build());
        String analysisId = analysis.getId();

        RunContext ctx = new RunContext(analysisId, integration);
        activeRuns.put(analysisId, ctx);

        try {
            List<QueryRecord> queries = createQueries(analysisId, queryIds, specs);

            if (!store.updateAnalysis(analysisId, AnalysisUpdate.running(clock.instant()))) {
                // Canceled while queued: nothing was submitted yet
                log.info("Analysis {} was canceled before its queries were submitted", analysisId);
                for (QueryRecord query : queries) {
                    cancelQuery(integration, query.getId(), null);
                }
                activeRuns.remove(analysisId);
                AnalysisRecord current = load(analysisId);
                return new AnalysisExecution(current, CompletableFuture.completedFuture(current));
            }

            AnalysisRecord started = load(analysisId);
            log.info("Analysis {} started: target={}, kind={}, queries={}",
                    analysisId, request.getTargetKey(), request.getKind(), queries.size());

            List<CompletableFuture<Void>> futures = new ArrayList<>();
            for (QueryRecord query : queries) {
                futures.add(dispatch(ctx, query));
            }

            ResultTransform<A> transform = request.getResultTransform();
            CompletableFuture<AnalysisRecord> completion = CompletableFuture
                    .allOf(futures.toArray(new CompletableFuture[0]))
                    .handle((ignored, error) -> settle(ctx, transform, error));

            return new AnalysisExecution(started, completion);

        } catch (RuntimeException e) {
            log.error("Failed to start analysis {}: {}", analysisId, e.getMessage(), e);
            activeRuns.remove(analysisId);
            closeAfterFailure(analysisId, "Failed to start analysis: " + describe(e));
            throw e;
        }
    }

    /**
     * Cancels every running query of the analysis and marks it CANCELED.
     * Does nothing if the analysis is already terminal.
     */
    public void cancelQueries(Integration integration, String analysisId) {
        AnalysisRecord analysis = store.getAnalysisById(analysisId)
                .orElseThrow(() -> new AnalysisNotFoundException(analysisId));

        if (analysis.isTerminal()) {
            log.debug("Analysis {} already {}, nothing to cancel", analysisId, analysis.getStatus());
            return;
        }

        RunContext ctx = activeRuns.get(analysisId);
        if (ctx != null) {
            ctx.cancel();
        }

        int canceled = 0;
        for (QueryRecord query : store.getQueriesByIds(analysis.getQueryIds())) {
            if (query.isRunning()) {
                cancelQuery(integration, query.getId(), query.getExternalHandle());
                canceled++;
            }
        }

        log.info("Canceling analysis {} ({} running queries)", analysisId, canceled);
        finish(analysis, AnalysisUpdate.canceled(clock.instant()));
    }

    /**
     * Closes an analysis no process is running anymore.
     *
     * Running queries are canceled. An analysis whose queries all succeeded is
     * aggregated when a transform is available, otherwise it ends in ERROR.
     *
     * @param integration may be null when the integration is no longer registered
     * @param transform may be null when the analysis kind has no registered definition
     */
    public AnalysisRecord recoverAbandoned(AnalysisRecord analysis, Integration integration,
                                           ResultTransform<?> transform) {
        String analysisId = analysis.getId();
        if (activeRuns.containsKey(analysisId)) {
            return analysis;
        }

        List<QueryRecord> queries = store.getQueriesByIds(analysis.getQueryIds());
        long stillRunning = queries.stream().filter(QueryRecord::isRunning).count();
        for (QueryRecord query : queries) {
            if (query.isRunning()) {
                cancelQuery(integration, query.getId(), query.getExternalHandle());
            }
        }

        AnalysisUpdate outcome;
        if (queries.isEmpty() || stillRunning > 0) {
            outcome = AnalysisUpdate.error(ErrorKind.ABANDONED, truncate(
                    "Analysis was abandoned with " + stillRunning + " of " + queries.size()
                            + " queries still running"), clock.instant());
        } else if (transform == null && firstFailed(null, queries).isEmpty() && !hasCanceled(queries)) {
            outcome = AnalysisUpdate.error(ErrorKind.ABANDONED,
                    "No result transform is registered for analysis kind " + analysis.getKind(), clock.instant());
        } else {
            outcome = outcomeFromQueries(null, queries, transform);
        }

        log.warn("Recovering abandoned analysis {} -> {}", analysisId, outcome.getStatus());
        finish(analysis, outcome);
        return load(analysisId);
    }

    public boolean isActive(String analysisId) {
        return activeRuns.containsKey(analysisId);
    }

    private <P, A> List<QuerySpec> buildQueries(AnalysisRequest<P, A> request) {
        List<QueryBuilder<P>> builders = request.getQueryBuilders();
        if (builders.isEmpty()) {
            throw new QueryBuildException("An analysis needs at least one query");
        }
        List<QuerySpec> specs = new ArrayList<>(builders.size());
        for (int i = 0; i < builders.size(); i++) {
            QuerySpec spec;
            try {
                spec = builders.get(i).build(request.getParams());
            } catch (QueryBuildException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new QueryBuildException("Query " + i + " could not be built: " + describe(e), e);
            }
            if (spec == null || spec.getSql() == null || spec.getSql().isBlank()) {
                throw new QueryBuildException("Query " + i + " produced no SQL");
            }
            specs.add(spec);
        }
        return specs;
    }

    private List<QueryRecord> createQueries(String analysisId, List<String> queryIds, List<QuerySpec> specs) {
        List<QueryRecord> queries = new ArrayList<>(specs.size());
        for (int i = 0; i < specs.size(); i++) {
            QuerySpec spec = specs.get(i);
            queries.add(store.createQuery(QueryRecord.builder()
                    .id(queryIds.get(i))
                    .analysisId(analysisId)
                    .name(spec.getName() != null ? spec.getName() : "query-" + i)
                    .sql(spec.getSql())
                    .templateVariables(spec.getTemplateVariables())
                    .status(QueryStatus.RUNNING)
                    .startedAt(clock.instant())
                    .build()));
        }
        return queries;
    }

    private CompletableFuture<Void> dispatch(RunContext ctx, QueryRecord query) {
        try {
            return CompletableFuture.runAsync(() -> runQuery(ctx, query), queryExecutor);
        } catch (RejectedExecutionException e) {
            fail(ctx, query, ErrorKind.SUBMISSION, "Query worker pool is saturated");
            return CompletableFuture.completedFuture(null);
        }
    }

    private void runQuery(RunContext ctx, QueryRecord query) {
        try {
            if (ctx.shouldStop()) {
                cancelQuery(ctx.getIntegration(), query.getId(), null);
                return;
            }

            SubmitResult submitted;
            try {
                submitted = ctx.getIntegration().submitQuery(query.getSql(), query.getTemplateVariables());
            } catch (RuntimeException e) {
                fail(ctx, query, ErrorKind.SUBMISSION, describe(e));
                return;
            }

            if (submitted == null) {
                fail(ctx, query, ErrorKind.SUBMISSION, "Integration returned no result");
            } else if (submitted.isFailed()) {
                fail(ctx, query, ErrorKind.EXECUTION, submitted.getError());
            } else if (!submitted.isPollable()) {
                if (ctx.shouldStop()) {
                    // A sibling failed or the analysis was canceled while this one ran
                    cancelQuery(ctx.getIntegration(), query.getId(), null);
                } else {
                    succeed(query, submitted.getRows());
                }
            } else if (!store.updateQuery(query.getId(), QueryUpdate.handle(submitted.getHandle()))) {
                // Canceled while it was being submitted
                cancelExternal(ctx.getIntegration(), query.getId(), submitted.getHandle());
            } else {
                poll(ctx, query, submitted.getHandle());
            }
        } catch (RuntimeException e) {
            log.error("Unexpected error running query {}: {}", query.getId(), e.getMessage(), e);
            fail(ctx, query, ErrorKind.EXECUTION, describe(e));
        }
    }

    private void poll(RunContext ctx, QueryRecord query, String handle) {
        Integration integration = ctx.getIntegration();
        Duration timeout = properties.getQueryTimeout();
        Instant deadline = clock.instant().plus(timeout);
        int attempts = 0;

        while (true) {
            if (ctx.shouldStop() || !isStillRunning(query.getId())) {
                cancelQuery(integration, query.getId(), handle);
                return;
            }

            PollResult result;
            try {
                result = integration.pollQuery(handle);
                attempts++;
            } catch (RuntimeException e) {
                fail(ctx, query, ErrorKind.EXECUTION, "Polling failed: " + describe(e));
                cancelExternal(integration, query.getId(), handle);
                return;
            }

            if (result == null) {
                fail(ctx, query, ErrorKind.EXECUTION, "Integration returned no poll result");
                cancelExternal(integration, query.getId(), handle);
                return;
            }
            if (result.getState() == PollResult.State.SUCCEEDED) {
                succeed(query, result.getRows());
                return;
            }
            if (result.getState() == PollResult.State.FAILED) {
                fail(ctx, query, ErrorKind.EXECUTION, result.getError());
                return;
            }

            try {
                sleeper.sleep(properties.getPollInterval());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                cancelQuery(integration, query.getId(), handle);
                return;
            }

            if (!clock.instant().isBefore(deadline)) {
                fail(ctx, query, ErrorKind.TIMEOUT,
                        "Query timed out after " + timeout + " (" + attempts + " polls)");
                cancelExternal(integration, query.getId(), handle);
                return;
            }
        }
    }

    private boolean isStillRunning(String queryId) {
        return store.getQueryById(queryId).map(QueryRecord::isRunning).orElse(false);
    }

    private void succeed(QueryRecord query, RawResult rows) {
        RawResult result = rows != null ? rows : RawResult.of(List.of());
        if (store.updateQuery(query.getId(), QueryUpdate.succeeded(result, clock.instant()))) {
            countQuery(QueryStatus.SUCCEEDED, null);
            log.debug("Query {} ({}) succeeded with {} rows", query.getId(), query.getName(), result.size());
        }
    }

    private void fail(RunContext ctx, QueryRecord query, ErrorKind kind, String message) {
        String error = truncate(message);
        // Flag first so sibling poll loops stop as early as possible
        boolean first = ctx.recordFailure(query.getId(), kind, error);
        if (store.updateQuery(query.getId(), QueryUpdate.failed(kind, error, clock.instant()))) {
            countQuery(QueryStatus.FAILED, kind);
            log.warn("Query {} ({}) of analysis {} failed [{}]: {}",
                    query.getId(), query.getName(), ctx.getAnalysisId(), kind, error);
            if (first) {
                log.info("Canceling remaining queries of analysis {}", ctx.getAnalysisId());
            }
        }
    }

    /**
     * Cancels one query record. Idempotent: a terminal record is left untouched.
     */
    private void cancelQuery(Integration integration, String queryId, String handle) {
        if (handle != null) {
            cancelExternal(integration, queryId, handle);
        }
        if (store.updateQuery(queryId, QueryUpdate.canceled(clock.instant()))) {
            countQuery(QueryStatus.CANCELED, null);
            log.info("Query {} canceled", queryId);
        }
    }

    private void cancelExternal(Integration integration, String queryId, String handle) {
        if (integration == null) {
            log.warn("No integration available to cancel external job {} of query {}", handle, queryId);
            return;
        }
        try {
            integration.cancelQuery(handle);
        } catch (RuntimeException e) {
            // Best-effort: the local record is canceled regardless
            log.warn("Failed to cancel external job {} of query {}: {}", handle, queryId, e.getMessage());
        }
    }

    private AnalysisRecord settle(RunContext ctx, ResultTransform<?> transform, Throwable joinError) {
        String analysisId = ctx.getAnalysisId();
        try {
            if (joinError != null) {
                log.error("Query tasks of analysis {} ended abnormally", analysisId, joinError);
            }
            AnalysisRecord analysis = load(analysisId);
            List<QueryRecord> queries = store.getQueriesByIds(analysis.getQueryIds());

            if (queries.stream().anyMatch(QueryRecord::isRunning)) {
                // Every query must be terminal before the analysis is
                for (QueryRecord query : queries) {
                    if (query.isRunning()) {
                        cancelQuery(ctx.getIntegration(), query.getId(), query.getExternalHandle());
                    }
                }
                queries = store.getQueriesByIds(analysis.getQueryIds());
            }

            AnalysisUpdate outcome = ctx.isCanceled()
                    ? AnalysisUpdate.canceled(clock.instant())
                    : outcomeFromQueries(ctx, queries, transform);

            finish(analysis, outcome);
            return load(analysisId);

        } catch (RuntimeException e) {
            log.error("Failed to settle analysis {}: {}", analysisId, e.getMessage(), e);
            closeAfterFailure(analysisId, "Failed to settle analysis: " + describe(e));
            return store.getAnalysisById(analysisId).orElse(null);
        } finally {
            activeRuns.remove(analysisId);
        }
    }

    private AnalysisUpdate outcomeFromQueries(RunContext ctx, List<QueryRecord> queries, ResultTransform<?> transform) {
        Optional<QueryRecord> failed = firstFailed(ctx, queries);
        if (failed.isPresent()) {
            QueryRecord query = failed.get();
            return AnalysisUpdate.error(query.getErrorKind(),
                    truncate("Query '" + query.getName() + "' failed: " + query.getError()), clock.instant());
        }
        if (hasCanceled(queries)) {
            return AnalysisUpdate.canceled(clock.instant());
        }
        return aggregate(queries, transform);
    }

    private AnalysisUpdate aggregate(List<QueryRecord> queries, ResultTransform<?> transform) {
        List<String> names = queries.stream().map(QueryRecord::getName).collect(Collectors.toList());
        List<String> expected = transform.expectedQueries();
        if (!expected.isEmpty() && !expected.equals(names)) {
            return AnalysisUpdate.error(ErrorKind.TRANSFORM,
                    truncate("Result transform expects queries " + expected + " but got " + names), clock.instant());
        }

        List<RawResult> results = Collections.unmodifiableList(
                queries.stream().map(QueryRecord::getRawResult).collect(Collectors.toList()));
        try {
            Object aggregate = transform.apply(results);
            if (aggregate == null) {
                return AnalysisUpdate.error(ErrorKind.TRANSFORM, "Result transform produced no result", clock.instant());
            }
            JsonNode tree = objectMapper.valueToTree(aggregate);
            return AnalysisUpdate.success(tree, clock.instant());
        } catch (ResultTransformException e) {
            return AnalysisUpdate.error(ErrorKind.TRANSFORM,
                    truncate("Result transform failed: " + describe(e)), clock.instant());
        } catch (RuntimeException e) {
            log.error("Result transform threw unexpectedly: {}", e.getMessage(), e);
            return AnalysisUpdate.error(ErrorKind.TRANSFORM,
                    truncate("Result transform failed: " + describe(e)), clock.instant());
        }
    }

    /**
     * The failure recorded first by the run, if its record really ended FAILED;
     * otherwise the first FAILED record in submission order.
     */
    private Optional<QueryRecord> firstFailed(RunContext ctx, List<QueryRecord> queries) {
        RunContext.Failure first = ctx != null ? ctx.getFirstFailure() : null;
        if (first != null) {
            Optional<QueryRecord> recorded = queries.stream()
                    .filter(q -> q.getId().equals(first.getQueryId()) && q.getStatus() == QueryStatus.FAILED)
                    .findFirst();
            if (recorded.isPresent()) {
                return recorded;
            }
        }
        return queries.stream().filter(q -> q.getStatus() == QueryStatus.FAILED).findFirst();
    }

    private static boolean hasCanceled(List<QueryRecord> queries) {
        return queries.stream().anyMatch(q -> q.getStatus() == QueryStatus.CANCELED);
    }

    private void finish(AnalysisRecord analysis, AnalysisUpdate outcome) {
        if (!store.updateAnalysis(analysis.getId(), outcome)) {
            log.debug("Analysis {} was already terminal, {} not applied", analysis.getId(), outcome.getStatus());
            return;
        }

        Counter.builder("analysis.completed")
                .tag("status", outcome.getStatus().name())
                .tag("kind", String.valueOf(analysis.getKind()))
                .register(meterRegistry)
                .increment();

        if (analysis.getStartedAt() != null) {
            Timer.builder("analysis.duration")
                    .tag("status", outcome.getStatus().name())
                    .register(meterRegistry)
                    .record(Duration.between(analysis.getStartedAt(), outcome.getAt()));
        }

        if (outcome.getStatus() == AnalysisStatus.ERROR) {
            log.info("Analysis {} finished with ERROR [{}]: {}",
                    analysis.getId(), outcome.getErrorKind(), outcome.getError());
        } else {
            log.info("Analysis {} finished with {}", analysis.getId(), outcome.getStatus());
        }
    }

    private void closeAfterFailure(String analysisId, String message) {
        try {
            store.updateAnalysis(analysisId, AnalysisUpdate.error(ErrorKind.EXECUTION, truncate(message), clock.instant()));
        } catch (RuntimeException e) {
            log.error("Could not close analysis {}: {}", analysisId, e.getMessage(), e);
        }
    }

    private void countQuery(QueryStatus status, ErrorKind kind) {
        Counter.builder("query.completed")
                .tag("status", status.name())
                .tag("errorKind", kind != null ? kind.name() : "none")
                .register(meterRegistry)
                .increment();
    }

    private AnalysisRecord load(String analysisId) {
        return store.getAnalysisById(analysisId).orElseThrow(() -> new AnalysisNotFoundException(analysisId));
    }

    private String truncate(String text) {
        if (text == null || text.isBlank()) {
            return "unknown error";
        }
        int max = properties.getMaxErrorLength();
        return text.length() <= max ? text : text.substring(0, max);
    }

    private static String describe(Throwable e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }

    private static String newId(String prefix) {
        return prefix + "_" + UUID.randomUUID().toString().replace("-", "");
    }
}
