package com.orchestrator.domain.analysis;

import com.orchestrator.domain.exception.QueryBuildException;
import com.orchestrator.domain.exception.ResultTransformException;
import com.orchestrator.domain.model.AnalysisKind;
import com.orchestrator.domain.model.DimensionSlicesParams;
import com.orchestrator.domain.model.DimensionSlicesResult;
import com.orchestrator.domain.model.QuerySpec;
import com.orchestrator.domain.model.RawResult;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Dimension slices: the most common values of each dimension column of an
 * exposure query over a lookback window.
 *
 * One query per dimension, so a slow dimension does not hold up the others.
 * Each query tags its rows with the dimension name, which keeps the transform
 * independent of params.
 */
@Component
public class DimensionSlicesAnalysis implements AnalysisDefinition<DimensionSlicesParams, DimensionSlicesResult> {

    static final int MAX_SLICES_PER_DIMENSION = 20;

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    @Override
    public AnalysisKind kind() {
        return AnalysisKind.DIMENSION_SLICES;
    }

    @Override
    public String targetKey(DimensionSlicesParams params) {
        return "dimension-slices:" + params.getDataSourceId() + ":" + params.getExposureQueryId();
    }

    @Override
    public List<QueryBuilder<DimensionSlicesParams>> queryBuilders(DimensionSlicesParams params) {
        if (params.getDimensions().isEmpty()) {
            throw new QueryBuildException("At least one dimension is required");
        }
        List<QueryBuilder<DimensionSlicesParams>> builders = new ArrayList<>();
        for (String dimension : params.getDimensions()) {
            builders.add(p -> buildDimensionQuery(p, dimension));
        }
        return builders;
    }

    private QuerySpec buildDimensionQuery(DimensionSlicesParams params, String dimension) {
        if (dimension == null || !IDENTIFIER.matcher(dimension).matches()) {
            throw new QueryBuildException("Invalid dimension name: " + dimension);
        }
        if (params.getExposureQuery() == null || params.getExposureQuery().isBlank()) {
            throw new QueryBuildException("Exposure query SQL is required");
        }
        if (params.getStartDate() == null) {
            throw new QueryBuildException("Start date is required");
        }

        String sql = "SELECT '" + dimension + "' AS dimension, "
                + "CAST(e." + dimension + " AS VARCHAR) AS value, "
                + "COUNT(*) AS units\n"
                + "FROM (\n" + params.getExposureQuery().trim() + "\n) e\n"
                + "WHERE e.timestamp >= '{{ startDate }}'\n"
                + "GROUP BY e." + dimension + "\n"
                + "ORDER BY units DESC\n"
                + "LIMIT " + MAX_SLICES_PER_DIMENSION;

        return QuerySpec.builder()
                .name("dimension:" + dimension)
                .sql(sql)
                .templateVariables(Map.of("startDate", SqlDates.format(params.getStartDate())))
                .build();
    }

    @Override
    public ResultTransform<DimensionSlicesResult> resultTransform() {
        return DimensionSlicesAnalysis::aggregate;
    }

    static DimensionSlicesResult aggregate(List<RawResult> results) {
        if (results.isEmpty()) {
            throw new ResultTransformException("Expected at least one dimension result");
        }
        Map<String, List<Map<String, Object>>> rowsByDimension = new LinkedHashMap<>();
        for (RawResult result : results) {
            for (Map<String, Object> row : result.getRows()) {
                String dimension = Objects.toString(ResultTransforms.required(row, "dimension"), null);
                if (dimension == null) {
                    throw new ResultTransformException("Row without dimension name: " + row);
                }
                rowsByDimension.computeIfAbsent(dimension, d -> new ArrayList<>()).add(row);
            }
        }

        List<DimensionSlicesResult.DimensionSlices> dimensions = new ArrayList<>();
        rowsByDimension.forEach((dimension, rows) -> {
            long total = 0;
            for (Map<String, Object> row : rows) {
                total += ResultTransforms.longValue(row, "units");
            }
            List<DimensionSlicesResult.Slice> slices = new ArrayList<>();
            for (Map<String, Object> row : rows) {
                long units = ResultTransforms.longValue(row, "units");
                slices.add(DimensionSlicesResult.Slice.builder()
                        .value(Objects.toString(ResultTransforms.required(row, "value"), ""))
                        .units(units)
                        .percent(total == 0 ? 0.0 : units * 100.0 / total)
                        .build());
            }
            dimensions.add(DimensionSlicesResult.DimensionSlices.builder()
                    .dimension(dimension)
                    .totalUnits(total)
                    .slices(slices)
                    .build());
        });

        return DimensionSlicesResult.builder().dimensions(dimensions).build();
    }
}
