package com.orchestrator.domain.analysis;

import com.orchestrator.domain.exception.QueryBuildException;
import com.orchestrator.domain.exception.ResultTransformException;
import com.orchestrator.domain.model.AnalysisKind;
import com.orchestrator.domain.model.MetricAggregate;
import com.orchestrator.domain.model.MetricAggregateParams;
import com.orchestrator.domain.model.QuerySpec;
import com.orchestrator.domain.model.RawResult;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Count, mean and standard deviation of a metric's value column.
 */
@Component
public class MetricAggregateAnalysis implements AnalysisDefinition<MetricAggregateParams, MetricAggregate> {

    static final String QUERY_NAME = "metric:aggregate";

    @Override
    public AnalysisKind kind() {
        return AnalysisKind.METRIC_AGGREGATE;
    }

    @Override
    public String targetKey(MetricAggregateParams params) {
        return "metric:" + params.getDataSourceId() + ":" + params.getMetricId();
    }

    @Override
    public List<QueryBuilder<MetricAggregateParams>> queryBuilders(MetricAggregateParams params) {
        return List.of(MetricAggregateAnalysis::buildQuery);
    }

    private static QuerySpec buildQuery(MetricAggregateParams params) {
        if (params.getMetricQuery() == null || params.getMetricQuery().isBlank()) {
            throw new QueryBuildException("Metric query SQL is required");
        }
        if (params.getStartDate() == null) {
            throw new QueryBuildException("Start date is required");
        }

        String sql = "SELECT COUNT(*) AS count, "
                + "SUM(m.value) AS main_sum, "
                + "SUM(m.value * m.value) AS main_sum_squares\n"
                + "FROM (\n" + params.getMetricQuery().trim() + "\n) m\n"
                + "WHERE m.timestamp >= '{{ startDate }}'";

        return QuerySpec.builder()
                .name(QUERY_NAME)
                .sql(sql)
                .templateVariables(Map.of("startDate", SqlDates.format(params.getStartDate())))
                .build();
    }

    @Override
    public ResultTransform<MetricAggregate> resultTransform() {
        return new ResultTransform<>() {
            @Override
            public MetricAggregate apply(List<RawResult> orderedResults) {
                return aggregate(orderedResults);
            }

            @Override
            public List<String> expectedQueries() {
                return List.of(QUERY_NAME);
            }
        };
    }

    static MetricAggregate aggregate(List<RawResult> results) {
        RawResult result = ResultTransforms.single(results);
        if (result.size() != 1) {
            throw new ResultTransformException("Expected a single aggregate row but got " + result.size());
        }
        Map<String, Object> row = result.getRows().get(0);
        long count = ResultTransforms.longValue(row, "count");
        double sum = ResultTransforms.doubleValue(row, "main_sum");
        double sumSquares = ResultTransforms.doubleValue(row, "main_sum_squares");

        double mean = count == 0 ? 0.0 : sum / count;
        double variance = count < 2 ? 0.0 : (sumSquares - sum * sum / count) / (count - 1);

        return MetricAggregate.builder()
                .count(count)
                .sum(sum)
                .mean(mean)
                .stddev(Math.sqrt(Math.max(0.0, variance)))
                .build();
    }
}
