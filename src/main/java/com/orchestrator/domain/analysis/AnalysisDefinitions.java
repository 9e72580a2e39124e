package com.orchestrator.domain.analysis;

import com.orchestrator.domain.model.AnalysisKind;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registered analysis definitions by kind.
 */
@Component
public class AnalysisDefinitions {

    private final Map<AnalysisKind, AnalysisDefinition<?, ?>> byKind = new EnumMap<>(AnalysisKind.class);

    public AnalysisDefinitions(List<AnalysisDefinition<?, ?>> definitions) {
        for (AnalysisDefinition<?, ?> definition : definitions) {
            if (byKind.putIfAbsent(definition.kind(), definition) != null) {
                throw new IllegalStateException("Duplicate analysis definition for " + definition.kind());
            }
        }
    }

    public Optional<AnalysisDefinition<?, ?>> forKind(AnalysisKind kind) {
        return Optional.ofNullable(byKind.get(kind));
    }
}
