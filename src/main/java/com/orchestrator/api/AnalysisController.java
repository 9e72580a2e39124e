package com.orchestrator.api;

import com.orchestrator.domain.model.AnalysisRecord;
import com.orchestrator.domain.model.DimensionSlicesRequest;
import com.orchestrator.domain.model.MetricAggregateRequest;
import com.orchestrator.domain.model.QueryRecord;
import com.orchestrator.domain.service.AnalysisService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API for analyses.
 *
 * Endpoints:
 * - POST /api/v1/dimension-slices - Start dimension slices for an exposure query
 * - GET /api/v1/dimension-slices/latest - Latest dimension slices for an exposure query
 * - POST /api/v1/metric-analyses - Start a metric aggregate
 * - GET /api/v1/analyses/{analysisId} - Get analysis status and result
 * - POST /api/v1/analyses/{analysisId}/cancel - Cancel a running analysis
 * - GET /api/v1/queries/{queryIds} - Get query records, comma-separated ids
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class AnalysisController {

    private final AnalysisService analysisService;

    /**
     * Start dimension slices.
     *
     * POST /api/v1/dimension-slices
     *
     * Request body:
     * {
     *   "dataSourceId": "default",
     *   "exposureQueryId": "exp_1",
     *   "exposureQuery": "SELECT ...",
     *   "dimensions": ["country", "browser"],
     *   "lookbackDays": 30
     * }
     *
     * Returns 202 with the RUNNING analysis, 409 if one is already running.
     */
    @PostMapping("/dimension-slices")
    public ResponseEntity<AnalysisRecord> startDimensionSlices(@Valid @RequestBody DimensionSlicesRequest request) {
        AnalysisRecord analysis = analysisService.startDimensionSlices(request);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(analysis);
    }

    @GetMapping("/dimension-slices/latest")
    public ResponseEntity<AnalysisRecord> getLatestDimensionSlices(
            @RequestParam String dataSourceId,
            @RequestParam String exposureQueryId) {

        log.info("Get latest dimension slices: dataSource={}, exposureQuery={}", dataSourceId, exposureQueryId);

        return analysisService.getLatestDimensionSlices(dataSourceId, exposureQueryId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    /**
     * Start a metric aggregate (count, mean, stddev of a metric query).
     *
     * POST /api/v1/metric-analyses
     */
    @PostMapping("/metric-analyses")
    public ResponseEntity<AnalysisRecord> startMetricAggregate(@Valid @RequestBody MetricAggregateRequest request) {
        AnalysisRecord analysis = analysisService.startMetricAggregate(request);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(analysis);
    }

    /**
     * Get analysis status and result.
     *
     * GET /api/v1/analyses/{analysisId}
     *
     * Response:
     * {
     *   "id": "ana_...",
     *   "status": "QUEUED|RUNNING|SUCCESS|ERROR|CANCELED",
     *   "queryIds": ["qry_..."],
     *   "result": { ... },
     *   "error": "...",
     *   "errorKind": "EXECUTION"
     * }
     */
    @GetMapping("/analyses/{analysisId}")
    public ResponseEntity<AnalysisRecord> getAnalysis(@PathVariable String analysisId) {
        log.info("Get analysis: analysisId={}", analysisId);
        return ResponseEntity.ok(analysisService.getAnalysis(analysisId));
    }

    @PostMapping("/analyses/{analysisId}/cancel")
    public ResponseEntity<AnalysisRecord> cancelAnalysis(@PathVariable String analysisId) {
        log.info("Cancel analysis: analysisId={}", analysisId);
        analysisService.cancelAnalysis(analysisId);
        return ResponseEntity.ok(analysisService.getAnalysis(analysisId));
    }

    /**
     * Get query records in the requested order; unknown ids come back as null.
     *
     * GET /api/v1/queries/qry_1,qry_2
     */
    @GetMapping("/queries/{queryIds}")
    public ResponseEntity<List<QueryRecord>> getQueries(@PathVariable List<String> queryIds) {
        return ResponseEntity.ok(analysisService.getQueries(queryIds));
    }

    /**
     * Health check endpoint.
     */
    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
