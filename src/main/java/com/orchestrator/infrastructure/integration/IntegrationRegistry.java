package com.orchestrator.infrastructure.integration;

import com.orchestrator.domain.integration.Integration;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Integrations available to the runner, by id.
 */
@Component
public class IntegrationRegistry {

    private final Map<String, Integration> byId = new LinkedHashMap<>();

    public IntegrationRegistry(List<Integration> integrations) {
        for (Integration integration : integrations) {
            if (byId.putIfAbsent(integration.getId(), integration) != null) {
                throw new IllegalStateException("Duplicate integration id: " + integration.getId());
            }
        }
    }

    public Optional<Integration> find(String id) {
        return Optional.ofNullable(byId.get(id));
    }

    public Integration get(String id) {
        return find(id).orElseThrow(() -> new IllegalArgumentException("Unknown data source: " + id));
    }
}
