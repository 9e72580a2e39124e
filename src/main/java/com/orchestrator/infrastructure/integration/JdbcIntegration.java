package com.orchestrator.infrastructure.integration;

import com.orchestrator.domain.integration.Integration;
import com.orchestrator.domain.integration.IntegrationException;
import com.orchestrator.domain.integration.PollResult;
import com.orchestrator.domain.integration.SubmitResult;
import com.orchestrator.domain.model.RawResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.List;
import java.util.Map;

/**
 * Synchronous integration running queries over JDBC.
 *
 * Every query completes inside submitQuery, so there are no handles to poll or cancel.
 * Connection problems are reported as submission errors, SQL errors as execution errors.
 */
@Slf4j
public class JdbcIntegration implements Integration {

    private final String id;
    private final JdbcTemplate jdbcTemplate;

    public JdbcIntegration(String id, JdbcTemplate jdbcTemplate) {
        this.id = id;
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public SubmitResult submitQuery(String sql, Map<String, String> templateVariables) {
        String rendered = SqlTemplates.render(sql, templateVariables);
        long start = System.currentTimeMillis();
        try {
            List<Map<String, Object>> rows = jdbcTemplate.queryForList(rendered);
            long durationMs = System.currentTimeMillis() - start;
            log.debug("JDBC query on {} returned {} rows in {} ms", id, rows.size(), durationMs);
            return SubmitResult.rows(RawResult.builder().rows(rows).durationMs(durationMs).build());
        } catch (DataAccessResourceFailureException e) {
            throw new IntegrationException("Could not reach data source " + id + ": " + e.getMessage(), e);
        } catch (DataAccessException e) {
            String message = e.getMostSpecificCause().getMessage();
            return SubmitResult.failed(message != null ? message : e.getMessage());
        }
    }

    @Override
    public PollResult pollQuery(String handle) {
        return PollResult.failed("Data source " + id + " does not run pollable jobs");
    }

    @Override
    public void cancelQuery(String handle) {
        log.debug("Ignoring cancel of {} on synchronous data source {}", handle, id);
    }
}
