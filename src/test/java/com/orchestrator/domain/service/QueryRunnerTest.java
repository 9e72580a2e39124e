package com.orchestrator.domain.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.orchestrator.config.QueryRunnerProperties;
import com.orchestrator.domain.analysis.AnalysisRequest;
import com.orchestrator.domain.analysis.QueryBuilder;
import com.orchestrator.domain.analysis.ResultTransform;
import com.orchestrator.domain.exception.QueryBuildException;
import com.orchestrator.domain.exception.ResultTransformException;
import com.orchestrator.domain.integration.IntegrationException;
import com.orchestrator.domain.integration.PollResult;
import com.orchestrator.domain.integration.SubmitResult;
import com.orchestrator.domain.model.AnalysisKind;
import com.orchestrator.domain.model.AnalysisRecord;
import com.orchestrator.domain.model.AnalysisStatus;
import com.orchestrator.domain.model.ErrorKind;
import com.orchestrator.domain.model.QueryRecord;
import com.orchestrator.domain.model.QuerySpec;
import com.orchestrator.domain.model.QueryStatus;
import com.orchestrator.domain.model.RawResult;
import com.orchestrator.support.FakeIntegration;
import com.orchestrator.support.InMemoryAnalysisStore;
import com.orchestrator.support.ManualClock;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for QueryRunner against an in-memory store and a scripted warehouse.
 *
 * Poll waits advance a manual clock, so nothing here depends on wall-clock timing
 * except the tests that need a query to stay in flight.
 */
class QueryRunnerTest {

    private static final Instant T0 = Instant.parse("2024-03-01T00:00:00Z");

    private InMemoryAnalysisStore store;
    private ManualClock clock;
    private QueryRunnerProperties properties;
    private MeterRegistry meterRegistry;
    private ObjectMapper objectMapper;
    private ExecutorService executor;
    private FakeIntegration integration;

    @BeforeEach
    void setUp() {
        store = new InMemoryAnalysisStore();
        clock = new ManualClock(T0);
        properties = new QueryRunnerProperties();
        properties.setPollInterval(Duration.ofSeconds(1));
        properties.setQueryTimeout(Duration.ofMinutes(10));
        meterRegistry = new SimpleMeterRegistry();
        objectMapper = new ObjectMapper().findAndRegisterModules();
        executor = Executors.newFixedThreadPool(8);
        integration = new FakeIntegration("warehouse");
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void testStartAnalysis_SingleSyncQuery_Success() {
        // Given
        integration.returns("SELECT COUNT", SubmitResult.rows(RawResult.of(List.of(Map.of("count", 10)))));
        QueryRunner runner = runner(advancingSleeper());

        AnalysisRequest<String, Map<String, Object>> request = AnalysisRequest.<String, Map<String, Object>>builder()
                .targetKey("target-a")
                .params("params")
                .queryBuilder(query("count", "SELECT COUNT(*) AS count FROM events"))
                .resultTransform(results -> results.get(0).getRows().get(0))
                .build();

        // When
        AnalysisRecord analysis = runner.startAnalysis(integration, request);

        // Then
        assertEquals(AnalysisStatus.SUCCESS, analysis.getStatus());
        assertEquals(10, analysis.getResult().get("count").asInt());
        assertNull(analysis.getError());
        assertEquals(1, analysis.getQueryIds().size());

        QueryRecord query = store.getQueryById(analysis.getQueryIds().get(0)).orElseThrow();
        assertEquals(QueryStatus.SUCCEEDED, query.getStatus());
        assertEquals(1, query.getRawResult().size());
        assertNull(query.getError());

        assertEquals(1.0, meterRegistry.get("analysis.completed").tag("status", "SUCCESS").counter().count());
    }

    @Test
    void testStartAnalysis_StatusIsMonotonic() {
        // Given
        integration.returns("SELECT 1", SubmitResult.rows(RawResult.of(List.of(Map.of("one", 1)))));
        QueryRunner runner = runner(advancingSleeper());

        // When
        AnalysisRecord analysis = runner.startAnalysis(integration, request("target-monotonic",
                List.of(query("one", "SELECT 1")), results -> results.size()));

        // Then
        assertEquals(List.of(AnalysisStatus.QUEUED, AnalysisStatus.RUNNING, AnalysisStatus.SUCCESS),
                store.statusHistory(analysis.getId()));
    }

    @Test
    void testStartAnalysis_ResultIsTransformOfOrderedResults() {
        // Given
        integration.returns("SELECT 'a'", SubmitResult.rows(RawResult.of(List.of(Map.of("n", 1)))));
        integration.returns("SELECT 'b'", SubmitResult.rows(RawResult.of(List.of(Map.of("n", 2)))));
        integration.returns("SELECT 'c'", SubmitResult.rows(RawResult.of(List.of(Map.of("n", 3)))));
        QueryRunner runner = runner(advancingSleeper());

        ResultTransform<List<Object>> transform = results -> {
            List<Object> values = new ArrayList<>();
            for (RawResult result : results) {
                values.add(result.getRows().get(0).get("n"));
            }
            return values;
        };

        // When
        AnalysisRecord analysis = runner.startAnalysis(integration, request("target-ordered", List.of(
                query("a", "SELECT 'a'"),
                query("b", "SELECT 'b'"),
                query("c", "SELECT 'c'")), transform));

        // Then
        assertEquals(AnalysisStatus.SUCCESS, analysis.getStatus());
        JsonNode result = analysis.getResult();
        assertEquals(3, result.size());
        assertEquals(1, result.get(0).asInt());
        assertEquals(2, result.get(1).asInt());
        assertEquals(3, result.get(2).asInt());

        List<QueryRecord> queries = store.getQueriesByIds(analysis.getQueryIds());
        assertEquals(List.of("a", "b", "c"), queries.stream().map(QueryRecord::getName).toList());
    }

    @Test
    void testStartAnalysis_SyncFailure_CancelsPollableSibling() {
        // Given: the pollable query would need 3 polls, but the sibling fails first
        integration.pollable("FROM slow_table", "job-slow", 2,
                PollResult.succeeded(RawResult.of(List.of(Map.of("x", 1)))));
        integration.returns("FROM broken_table", SubmitResult.failed("division by zero"));

        // Poll waits block until the failure has been persisted
        QueryRunner runner = runner(duration -> {
            awaitCondition(() -> hasQueryWithStatus(QueryStatus.FAILED));
            clock.advance(duration);
        });

        // When
        AnalysisRecord analysis = runner.startAnalysis(integration, request("target-b", List.of(
                query("slow", "SELECT x FROM slow_table"),
                query("broken", "SELECT 1 / 0 FROM broken_table")), results -> results.size()));

        // Then
        assertEquals(AnalysisStatus.ERROR, analysis.getStatus());
        assertEquals(ErrorKind.EXECUTION, analysis.getErrorKind());
        assertTrue(analysis.getError().contains("division by zero"));
        assertTrue(analysis.getError().contains("broken"));

        List<QueryRecord> queries = store.getQueriesByIds(analysis.getQueryIds());
        assertEquals(QueryStatus.CANCELED, queries.get(0).getStatus());
        assertEquals(QueryStatus.FAILED, queries.get(1).getStatus());
        assertTrue(integration.pollCount("job-slow") < 3);

        boolean slowWasSubmitted = integration.submittedQueries().stream().anyMatch(sql -> sql.contains("slow_table"));
        if (slowWasSubmitted) {
            assertTrue(integration.canceledHandles().contains("job-slow"));
        }
    }

    @Test
    void testStartAnalysis_TwoFailures_FirstRecordedWins() {
        // Given: the first query in submission order fails only after the second one has
        integration.returnsWhen("FROM late_table", () -> hasQueryWithStatus(QueryStatus.FAILED),
                SubmitResult.failed("late failure"));
        integration.throwsOnSubmit("FROM early_table", new IntegrationException("warehouse unreachable"));
        QueryRunner runner = runner(advancingSleeper());

        // When
        AnalysisRecord analysis = runner.startAnalysis(integration, request("target-two-failures", List.of(
                query("late", "SELECT * FROM late_table"),
                query("early", "SELECT * FROM early_table")), results -> results.size()));

        // Then
        assertEquals(AnalysisStatus.ERROR, analysis.getStatus());
        assertEquals(ErrorKind.SUBMISSION, analysis.getErrorKind());
        assertTrue(analysis.getError().contains("'early'"));
        assertTrue(analysis.getError().contains("warehouse unreachable"));

        List<QueryRecord> queries = store.getQueriesByIds(analysis.getQueryIds());
        assertEquals(QueryStatus.FAILED, queries.get(0).getStatus());
        assertEquals(ErrorKind.EXECUTION, queries.get(0).getErrorKind());
        assertEquals(QueryStatus.FAILED, queries.get(1).getStatus());
        assertEquals(ErrorKind.SUBMISSION, queries.get(1).getErrorKind());
    }

    @Test
    void testStartAnalysis_SyncResultAfterSiblingFailure_Canceled() {
        // Given: rows arrive only after the sibling has already failed
        integration.returnsWhen("FROM fast_table", () -> hasQueryWithStatus(QueryStatus.FAILED),
                SubmitResult.rows(RawResult.of(List.of(Map.of("x", 1)))));
        integration.returns("FROM broken_table", SubmitResult.failed("division by zero"));
        QueryRunner runner = runner(advancingSleeper());

        // When
        AnalysisRecord analysis = runner.startAnalysis(integration, request("target-sync-sibling", List.of(
                query("fast", "SELECT x FROM fast_table"),
                query("broken", "SELECT 1 / 0 FROM broken_table")), results -> results.size()));

        // Then
        assertEquals(AnalysisStatus.ERROR, analysis.getStatus());
        assertEquals(ErrorKind.EXECUTION, analysis.getErrorKind());

        List<QueryRecord> queries = store.getQueriesByIds(analysis.getQueryIds());
        assertEquals(QueryStatus.CANCELED, queries.get(0).getStatus());
        assertNull(queries.get(0).getRawResult());
        assertEquals(QueryStatus.FAILED, queries.get(1).getStatus());
    }

    @Test
    void testStartAnalysis_NoPollResult_FailsAndCancelsJob() {
        // Given: the warehouse answers polls with nothing
        FakeIntegration silent = new FakeIntegration("warehouse") {
            @Override
            public PollResult pollQuery(String handle) {
                super.pollQuery(handle);
                return null;
            }
        };
        silent.neverCompletes("FROM events", "job-silent");
        QueryRunner runner = runner(advancingSleeper());

        // When
        AnalysisRecord analysis = runner.startAnalysis(silent, request("target-silent",
                List.of(query("count", "SELECT COUNT(*) FROM events")), results -> results.size()));

        // Then
        assertEquals(AnalysisStatus.ERROR, analysis.getStatus());
        assertEquals(ErrorKind.EXECUTION, analysis.getErrorKind());

        QueryRecord query = store.getQueryById(analysis.getQueryIds().get(0)).orElseThrow();
        assertEquals(QueryStatus.FAILED, query.getStatus());
        assertTrue(query.getError().contains("no poll result"));
        assertEquals(1, silent.pollCount("job-silent"));
        assertEquals(List.of("job-silent"), silent.canceledHandles());
    }

    @Test
    void testStartAnalysis_CanceledWhileQueued_NothingSubmitted() {
        // Given: the analysis is canceled while its query records are being created
        integration.returns("FROM events", SubmitResult.rows(RawResult.of(List.of(Map.of("n", 1)))));
        QueryRunner runner = runner(advancingSleeper());
        AtomicBoolean canceled = new AtomicBoolean();
        store.onQueryCreated(record -> {
            if (canceled.compareAndSet(false, true)) {
                runner.cancelQueries(integration, record.getAnalysisId());
            }
        });

        // When
        AnalysisRecord analysis = runner.startAnalysis(integration, request("target-queued", List.of(
                query("a", "SELECT a FROM events"),
                query("b", "SELECT b FROM events")), results -> results.size()));

        // Then
        assertEquals(AnalysisStatus.CANCELED, analysis.getStatus());
        assertEquals(List.of(AnalysisStatus.QUEUED, AnalysisStatus.CANCELED), store.statusHistory(analysis.getId()));

        List<QueryRecord> queries = store.getQueriesByIds(analysis.getQueryIds());
        assertEquals(2, queries.size());
        for (QueryRecord query : queries) {
            assertEquals(QueryStatus.CANCELED, query.getStatus());
        }
        assertTrue(integration.submittedQueries().isEmpty());
        assertFalse(runner.isActive(analysis.getId()));
    }

    @Test
    void testStartAnalysis_PollTimeout() {
        // Given: timeout of two poll intervals, warehouse never completes
        properties.setQueryTimeout(Duration.ofSeconds(2));
        integration.neverCompletes("FROM stuck_table", "job-stuck");
        QueryRunner runner = runner(advancingSleeper());

        // When
        AnalysisRecord analysis = runner.startAnalysis(integration, request("target-d",
                List.of(query("stuck", "SELECT * FROM stuck_table")), results -> results.size()));

        // Then
        assertEquals(AnalysisStatus.ERROR, analysis.getStatus());
        assertEquals(ErrorKind.TIMEOUT, analysis.getErrorKind());

        QueryRecord query = store.getQueryById(analysis.getQueryIds().get(0)).orElseThrow();
        assertEquals(QueryStatus.FAILED, query.getStatus());
        assertEquals(ErrorKind.TIMEOUT, query.getErrorKind());
        assertEquals("job-stuck", query.getExternalHandle());
        assertEquals(2, integration.pollCount("job-stuck"));
        assertEquals(List.of("job-stuck"), integration.canceledHandles());
    }

    @Test
    void testStartAnalysis_PollableSuccess() {
        // Given
        integration.pollable("FROM events", "job-1", 3, PollResult.succeeded(RawResult.of(List.of(Map.of("count", 7)))));
        QueryRunner runner = runner(advancingSleeper());

        // When
        AnalysisRecord analysis = runner.startAnalysis(integration, request("target-poll",
                List.of(query("count", "SELECT COUNT(*) FROM events")), results -> results.get(0).getRows().get(0)));

        // Then
        assertEquals(AnalysisStatus.SUCCESS, analysis.getStatus());
        assertEquals(7, analysis.getResult().get("count").asInt());
        assertEquals(4, integration.pollCount("job-1"));
        assertTrue(integration.canceledHandles().isEmpty());
    }

    @Test
    void testStartAnalysis_SubmissionError() {
        // Given
        integration.throwsOnSubmit("FROM events", new IntegrationException("authentication failed"));
        QueryRunner runner = runner(advancingSleeper());

        // When
        AnalysisRecord analysis = runner.startAnalysis(integration, request("target-submit",
                List.of(query("count", "SELECT COUNT(*) FROM events")), results -> results.size()));

        // Then
        assertEquals(AnalysisStatus.ERROR, analysis.getStatus());
        assertEquals(ErrorKind.SUBMISSION, analysis.getErrorKind());
        assertTrue(analysis.getError().contains("authentication failed"));

        QueryRecord query = store.getQueryById(analysis.getQueryIds().get(0)).orElseThrow();
        assertEquals(QueryStatus.FAILED, query.getStatus());
        assertEquals(ErrorKind.SUBMISSION, query.getErrorKind());
    }

    @Test
    void testStartAnalysis_TransformError() {
        // Given
        integration.returns("FROM events", SubmitResult.rows(RawResult.of(List.of())));
        QueryRunner runner = runner(advancingSleeper());

        ResultTransform<Integer> transform = results -> {
            throw new ResultTransformException("expected one row");
        };

        // When
        AnalysisRecord analysis = runner.startAnalysis(integration, request("target-transform",
                List.of(query("count", "SELECT COUNT(*) FROM events")), transform));

        // Then
        assertEquals(AnalysisStatus.ERROR, analysis.getStatus());
        assertEquals(ErrorKind.TRANSFORM, analysis.getErrorKind());
        assertTrue(analysis.getError().contains("expected one row"));

        QueryRecord query = store.getQueryById(analysis.getQueryIds().get(0)).orElseThrow();
        assertEquals(QueryStatus.SUCCEEDED, query.getStatus());
    }

    @Test
    void testStartAnalysis_ExpectedQueriesMismatch() {
        // Given
        integration.returns("FROM events", SubmitResult.rows(RawResult.of(List.of())));
        QueryRunner runner = runner(advancingSleeper());

        ResultTransform<Integer> transform = new ResultTransform<>() {
            @Override
            public Integer apply(List<RawResult> orderedResults) {
                return orderedResults.size();
            }

            @Override
            public List<String> expectedQueries() {
                return List.of("first", "second");
            }
        };

        // When
        AnalysisRecord analysis = runner.startAnalysis(integration, request("target-expected",
                List.of(query("first", "SELECT * FROM events")), transform));

        // Then
        assertEquals(AnalysisStatus.ERROR, analysis.getStatus());
        assertEquals(ErrorKind.TRANSFORM, analysis.getErrorKind());
    }

    @Test
    void testStartAnalysis_BuildError_NothingPersisted() {
        // Given
        QueryRunner runner = runner(advancingSleeper());
        QueryBuilder<String> broken = params -> {
            throw new IllegalStateException("no lookback window");
        };

        // When / Then
        QueryBuildException error = assertThrows(QueryBuildException.class, () ->
                runner.startAnalysis(integration, request("target-build",
                        List.of(query("ok", "SELECT 1"), broken), results -> results.size())));

        assertTrue(error.getMessage().contains("no lookback window"));
        assertTrue(store.allAnalyses().isEmpty());
        assertEquals(0, store.queryCount());
        assertTrue(integration.submittedQueries().isEmpty());
    }

    @Test
    void testStartAnalysis_NoQueries_BuildError() {
        // Given
        QueryRunner runner = runner(advancingSleeper());

        // When / Then
        assertThrows(QueryBuildException.class, () ->
                runner.startAnalysis(integration, request("target-empty", List.of(), results -> results.size())));
        assertTrue(store.allAnalyses().isEmpty());
    }

    @Test
    void testStartAnalysis_LongErrorIsTruncated() {
        // Given
        properties.setMaxErrorLength(50);
        integration.returns("FROM events", SubmitResult.failed("x".repeat(500)));
        QueryRunner runner = runner(advancingSleeper());

        // When
        AnalysisRecord analysis = runner.startAnalysis(integration, request("target-truncate",
                List.of(query("count", "SELECT * FROM events")), results -> results.size()));

        // Then
        assertEquals(AnalysisStatus.ERROR, analysis.getStatus());
        assertEquals(50, analysis.getError().length());
        QueryRecord query = store.getQueryById(analysis.getQueryIds().get(0)).orElseThrow();
        assertEquals(50, query.getError().length());
    }

    @Test
    void testCancelQueries_TerminalAnalysisIsNoOp() {
        // Given
        integration.returns("SELECT 1", SubmitResult.rows(RawResult.of(List.of(Map.of("one", 1)))));
        QueryRunner runner = runner(advancingSleeper());
        AnalysisRecord analysis = runner.startAnalysis(integration, request("target-noop",
                List.of(query("one", "SELECT 1")), results -> results.size()));

        // When
        assertDoesNotThrow(() -> runner.cancelQueries(integration, analysis.getId()));
        assertDoesNotThrow(() -> runner.cancelQueries(integration, analysis.getId()));

        // Then
        AnalysisRecord after = store.getAnalysisById(analysis.getId()).orElseThrow();
        assertEquals(AnalysisStatus.SUCCESS, after.getStatus());
        assertEquals(List.of(AnalysisStatus.QUEUED, AnalysisStatus.RUNNING, AnalysisStatus.SUCCESS),
                store.statusHistory(analysis.getId()));
        assertTrue(integration.canceledHandles().isEmpty());
    }

    @Test
    void testCancelQueries_InFlightPollableQuery() throws Exception {
        // Given
        integration.neverCompletes("FROM huge_table", "job-huge");
        QueryRunner runner = runner(duration -> Thread.sleep(5));

        AnalysisExecution execution = runner.launch(integration, request("target-cancel",
                List.of(query("huge", "SELECT * FROM huge_table")), results -> results.size()));
        String analysisId = execution.getStarted().getId();
        String queryId = execution.getStarted().getQueryIds().get(0);
        awaitCondition(() -> store.getQueryById(queryId).map(q -> q.getExternalHandle() != null).orElse(false));

        // When
        runner.cancelQueries(integration, analysisId);

        // Then
        AnalysisRecord settled = execution.getCompletion().get(5, TimeUnit.SECONDS);
        assertEquals(AnalysisStatus.CANCELED, settled.getStatus());
        assertEquals(QueryStatus.CANCELED, store.getQueryById(queryId).orElseThrow().getStatus());
        assertTrue(integration.canceledHandles().contains("job-huge"));
        assertFalse(runner.isActive(analysisId));
    }

    @Test
    void testCancelQueries_WarehouseCancelFails_StillCanceled() throws Exception {
        // Given
        integration.neverCompletes("FROM huge_table", "job-huge")
                .failCancels(new IntegrationException("warehouse unreachable"));
        QueryRunner runner = runner(duration -> Thread.sleep(5));

        AnalysisExecution execution = runner.launch(integration, request("target-cancel-fails",
                List.of(query("huge", "SELECT * FROM huge_table")), results -> results.size()));
        String analysisId = execution.getStarted().getId();
        String queryId = execution.getStarted().getQueryIds().get(0);
        awaitCondition(() -> store.getQueryById(queryId).map(q -> q.getExternalHandle() != null).orElse(false));

        // When
        assertDoesNotThrow(() -> runner.cancelQueries(integration, analysisId));

        // Then
        AnalysisRecord settled = execution.getCompletion().get(5, TimeUnit.SECONDS);
        assertEquals(AnalysisStatus.CANCELED, settled.getStatus());
        assertEquals(QueryStatus.CANCELED, store.getQueryById(queryId).orElseThrow().getStatus());
    }

    @Test
    void testSubmitAnalysis_ReturnsRunningRecord() throws Exception {
        // Given
        integration.neverCompletes("FROM huge_table", "job-huge");
        QueryRunner runner = runner(duration -> Thread.sleep(5));

        // When
        AnalysisRecord started = runner.submitAnalysis(integration, request("target-submit-async",
                List.of(query("huge", "SELECT * FROM huge_table")), results -> results.size()));

        // Then
        assertEquals(AnalysisStatus.RUNNING, started.getStatus());
        assertEquals(1, started.getQueryIds().size());
        assertEquals(AnalysisKind.CUSTOM, started.getKind());
        assertEquals("warehouse", started.getIntegrationId());
        assertTrue(runner.isActive(started.getId()));

        runner.cancelQueries(integration, started.getId());
        awaitCondition(() -> !runner.isActive(started.getId()));
    }

    @Test
    void testRecoverAbandoned_AllSucceeded_Aggregates() {
        // Given: a record left RUNNING by another process, its query already done
        QueryRunner runner = runner(advancingSleeper());
        store.createQuery(QueryRecord.builder()
                .id("qry_done")
                .analysisId("ana_orphan")
                .name("count")
                .sql("SELECT 1")
                .status(QueryStatus.SUCCEEDED)
                .rawResult(RawResult.of(List.of(Map.of("count", 4))))
                .startedAt(T0)
                .finishedAt(T0)
                .build());
        AnalysisRecord orphan = orphan("ana_orphan", List.of("qry_done"));
        store.putAnalysis(orphan);

        // When
        AnalysisRecord recovered = runner.recoverAbandoned(orphan, integration,
                results -> results.get(0).getRows().get(0));

        // Then
        assertEquals(AnalysisStatus.SUCCESS, recovered.getStatus());
        assertEquals(4, recovered.getResult().get("count").asInt());
    }

    @Test
    void testRecoverAbandoned_RunningQuery_CanceledAndAbandoned() {
        // Given
        QueryRunner runner = runner(advancingSleeper());
        store.createQuery(QueryRecord.builder()
                .id("qry_running")
                .analysisId("ana_orphan")
                .name("count")
                .sql("SELECT 1")
                .status(QueryStatus.RUNNING)
                .externalHandle("job-orphan")
                .startedAt(T0)
                .build());
        AnalysisRecord orphan = orphan("ana_orphan", List.of("qry_running"));
        store.putAnalysis(orphan);

        // When
        AnalysisRecord recovered = runner.recoverAbandoned(orphan, integration, results -> results.size());

        // Then
        assertEquals(AnalysisStatus.ERROR, recovered.getStatus());
        assertEquals(ErrorKind.ABANDONED, recovered.getErrorKind());
        assertEquals(QueryStatus.CANCELED, store.getQueryById("qry_running").orElseThrow().getStatus());
        assertEquals(List.of("job-orphan"), integration.canceledHandles());
    }

    @Test
    void testRecoverAbandoned_NoTransform_Abandoned() {
        // Given
        QueryRunner runner = runner(advancingSleeper());
        store.createQuery(QueryRecord.builder()
                .id("qry_done")
                .analysisId("ana_orphan")
                .name("count")
                .sql("SELECT 1")
                .status(QueryStatus.SUCCEEDED)
                .rawResult(RawResult.of(List.of()))
                .build());
        AnalysisRecord orphan = orphan("ana_orphan", List.of("qry_done"));
        store.putAnalysis(orphan);

        // When
        AnalysisRecord recovered = runner.recoverAbandoned(orphan, null, null);

        // Then
        assertEquals(AnalysisStatus.ERROR, recovered.getStatus());
        assertEquals(ErrorKind.ABANDONED, recovered.getErrorKind());
        assertTrue(recovered.getError().contains("CUSTOM"));
    }

    private QueryRunner runner(PollSleeper sleeper) {
        return new QueryRunner(store, executor, properties, meterRegistry, objectMapper, clock, sleeper);
    }

    private PollSleeper advancingSleeper() {
        return duration -> clock.advance(duration);
    }

    private boolean hasQueryWithStatus(QueryStatus status) {
        return store.allAnalyses().stream()
                .flatMap(a -> store.getQueriesByIds(a.getQueryIds()).stream())
                .anyMatch(q -> q.getStatus() == status);
    }

    private static AnalysisRecord orphan(String id, List<String> queryIds) {
        return AnalysisRecord.builder()
                .id(id)
                .targetKey("target-orphan")
                .kind(AnalysisKind.CUSTOM)
                .integrationId("warehouse")
                .status(AnalysisStatus.RUNNING)
                .queryIds(queryIds)
                .createdAt(T0)
                .startedAt(T0)
                .build();
    }

    private static QueryBuilder<String> query(String name, String sql) {
        return params -> QuerySpec.builder().name(name).sql(sql).build();
    }

    private static <A> AnalysisRequest<String, A> request(
            String targetKey, List<QueryBuilder<String>> builders, ResultTransform<A> transform) {
        return AnalysisRequest.<String, A>builder()
                .targetKey(targetKey)
                .params("params")
                .queryBuilders(builders)
                .resultTransform(transform)
                .build();
    }

    static void awaitCondition(BooleanSupplier condition) {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("Condition not met within 5 seconds");
            }
            try {
                Thread.sleep(2);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new AssertionError("Interrupted while waiting", e);
            }
        }
    }
}
