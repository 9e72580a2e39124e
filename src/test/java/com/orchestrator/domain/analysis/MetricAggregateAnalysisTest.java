package com.orchestrator.domain.analysis;

import com.orchestrator.domain.exception.QueryBuildException;
import com.orchestrator.domain.exception.ResultTransformException;
import com.orchestrator.domain.model.MetricAggregate;
import com.orchestrator.domain.model.MetricAggregateParams;
import com.orchestrator.domain.model.QuerySpec;
import com.orchestrator.domain.model.RawResult;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MetricAggregateAnalysisTest {

    private final MetricAggregateAnalysis analysis = new MetricAggregateAnalysis();

    @Test
    void testQueryBuilder() {
        // Given
        MetricAggregateParams params = params("SELECT timestamp, amount AS value FROM purchases");

        // When
        List<QueryBuilder<MetricAggregateParams>> builders = analysis.queryBuilders(params);
        QuerySpec spec = builders.get(0).build(params);

        // Then
        assertEquals(1, builders.size());
        assertEquals("metric:warehouse:revenue", analysis.targetKey(params));
        assertEquals(MetricAggregateAnalysis.QUERY_NAME, spec.getName());
        assertTrue(spec.getSql().contains("SUM(m.value * m.value) AS main_sum_squares"));
        assertTrue(spec.getSql().contains("FROM purchases"));
        assertEquals("2024-02-01 00:00:00", spec.getTemplateVariables().get("startDate"));
        assertEquals(List.of(MetricAggregateAnalysis.QUERY_NAME), analysis.resultTransform().expectedQueries());
    }

    @Test
    void testQueryBuilder_MissingQuery() {
        MetricAggregateParams params = params(null);

        assertThrows(QueryBuildException.class, () -> analysis.queryBuilders(params).get(0).build(params));
    }

    @Test
    void testAggregate_MeanAndStddev() {
        // Given: values 2, 4, 4, 4, 5, 5, 7, 9
        RawResult result = RawResult.of(List.of(Map.of(
                "count", 8L,
                "main_sum", new BigDecimal("40"),
                "main_sum_squares", new BigDecimal("232"))));

        // When
        MetricAggregate aggregate = analysis.resultTransform().apply(List.of(result));

        // Then
        assertEquals(8, aggregate.getCount());
        assertEquals(40.0, aggregate.getSum(), 1e-9);
        assertEquals(5.0, aggregate.getMean(), 1e-9);
        assertEquals(Math.sqrt(32.0 / 7.0), aggregate.getStddev(), 1e-9);
    }

    @Test
    void testAggregate_NoRowsMatched() {
        // Given: SUM over an empty set is NULL
        Map<String, Object> row = new HashMap<>();
        row.put("count", 0L);
        row.put("main_sum", null);
        row.put("main_sum_squares", null);

        // When
        MetricAggregate aggregate = analysis.resultTransform().apply(List.of(RawResult.of(List.of(row))));

        // Then
        assertEquals(0, aggregate.getCount());
        assertEquals(0.0, aggregate.getMean());
        assertEquals(0.0, aggregate.getStddev());
    }

    @Test
    void testAggregate_WrongShape() {
        RawResult twoRows = RawResult.of(List.of(
                Map.of("count", 1, "main_sum", 1, "main_sum_squares", 1),
                Map.of("count", 1, "main_sum", 1, "main_sum_squares", 1)));

        assertThrows(ResultTransformException.class, () -> analysis.resultTransform().apply(List.of(twoRows)));
        assertThrows(ResultTransformException.class, () -> analysis.resultTransform().apply(List.of()));
    }

    private static MetricAggregateParams params(String metricQuery) {
        return MetricAggregateParams.builder()
                .dataSourceId("warehouse")
                .metricId("revenue")
                .metricQuery(metricQuery)
                .startDate(Instant.parse("2024-02-01T00:00:00Z"))
                .build();
    }
}
