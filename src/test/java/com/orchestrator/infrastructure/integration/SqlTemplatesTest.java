package com.orchestrator.infrastructure.integration;

import com.orchestrator.domain.integration.IntegrationException;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SqlTemplatesTest {

    @Test
    void testRender_ReplacesPlaceholders() {
        String sql = "SELECT * FROM e WHERE ts >= '{{ startDate }}' AND ts < '{{endDate}}'";

        String rendered = SqlTemplates.render(sql, Map.of(
                "startDate", "2024-02-01 00:00:00",
                "endDate", "2024-03-01 00:00:00"));

        assertEquals("SELECT * FROM e WHERE ts >= '2024-02-01 00:00:00' AND ts < '2024-03-01 00:00:00'", rendered);
    }

    @Test
    void testRender_ValueWithDollarSign() {
        String rendered = SqlTemplates.render("SELECT '{{ label }}'", Map.of("label", "$1"));

        assertEquals("SELECT '$1'", rendered);
    }

    @Test
    void testRender_NoPlaceholders() {
        assertEquals("SELECT 1", SqlTemplates.render("SELECT 1", Map.of()));
    }

    @Test
    void testRender_UnknownVariable() {
        IntegrationException error = assertThrows(IntegrationException.class,
                () -> SqlTemplates.render("SELECT '{{ missing }}'", Map.of()));

        assertTrue(error.getMessage().contains("missing"));
    }
}
