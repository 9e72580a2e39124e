package com.orchestrator.domain.analysis;

import com.orchestrator.domain.exception.ResultTransformException;
import com.orchestrator.domain.model.RawResult;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Stock transforms and row helpers shared by the analysis kinds.
 */
public final class ResultTransforms {

    private ResultTransforms() {
    }

    /**
     * Identity over a single query returning a single row.
     */
    public static ResultTransform<Map<String, Object>> firstRow() {
        return results -> {
            RawResult only = single(results);
            if (only.getRows().isEmpty()) {
                throw new ResultTransformException("Expected one row but the query returned none");
            }
            return new LinkedHashMap<>(only.getRows().get(0));
        };
    }

    public static RawResult single(List<RawResult> results) {
        if (results.size() != 1) {
            throw new ResultTransformException("Expected 1 query result but got " + results.size());
        }
        return results.get(0);
    }

    public static Object required(Map<String, Object> row, String column) {
        if (!row.containsKey(column)) {
            throw new ResultTransformException("Missing column '" + column + "' in " + row.keySet());
        }
        return row.get(column);
    }

    /**
     * Reads a numeric column; NULL counts as zero (SUM over no rows).
     */
    public static long longValue(Map<String, Object> row, String column) {
        Object value = required(row, column);
        if (value == null) {
            return 0L;
        }
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        try {
            return Long.parseLong(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new ResultTransformException("Column '" + column + "' is not an integer: " + value, e);
        }
    }

    public static double doubleValue(Map<String, Object> row, String column) {
        Object value = required(row, column);
        if (value == null) {
            return 0.0;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        try {
            return Double.parseDouble(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new ResultTransformException("Column '" + column + "' is not numeric: " + value, e);
        }
    }
}
