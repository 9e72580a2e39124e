package com.orchestrator.infrastructure.integration;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;

@Configuration
public class IntegrationConfig {

    @Bean
    public JdbcIntegration jdbcIntegration(
            DataSource dataSource,
            @Value("${app.integrations.jdbc.id:default}") String id,
            @Value("${app.integrations.jdbc.query-timeout-seconds:300}") int queryTimeoutSeconds,
            @Value("${app.integrations.jdbc.max-rows:100000}") int maxRows) {
        JdbcTemplate jdbcTemplate = new JdbcTemplate(dataSource);
        jdbcTemplate.setQueryTimeout(queryTimeoutSeconds);
        jdbcTemplate.setMaxRows(maxRows);
        return new JdbcIntegration(id, jdbcTemplate);
    }
}
