package com.orchestrator.infrastructure.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.orchestrator.domain.exception.AnalysisConflictException;
import com.orchestrator.domain.model.AnalysisRecord;
import com.orchestrator.domain.model.AnalysisStatus;
import com.orchestrator.domain.model.AnalysisUpdate;
import com.orchestrator.domain.model.QueryRecord;
import com.orchestrator.domain.model.QueryStatus;
import com.orchestrator.domain.model.QueryUpdate;
import com.orchestrator.domain.model.RawResult;
import com.orchestrator.domain.store.AnalysisStore;
import com.orchestrator.infrastructure.persistence.entity.AnalysisRecordEntity;
import com.orchestrator.infrastructure.persistence.entity.QueryRecordEntity;
import com.orchestrator.infrastructure.persistence.repository.AnalysisRecordRepository;
import com.orchestrator.infrastructure.persistence.repository.QueryRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * JPA-backed store for analyses and their queries.
 *
 * Status writes are single UPDATE statements guarded by the current status,
 * so a terminal record can never be overwritten. They also bump the entity
 * version, so saving a stale copy of an analysis fails instead of reverting it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JpaAnalysisStore implements AnalysisStore {

    private static final TypeReference<Map<String, String>> TEMPLATE_VARIABLES = new TypeReference<>() {
    };

    private final AnalysisRecordRepository analysisRepository;
    private final QueryRecordRepository queryRepository;
    private final ObjectMapper objectMapper;

    @Override
    public QueryRecord createQuery(QueryRecord record) {
        QueryRecordEntity entity = QueryRecordEntity.builder()
                .id(record.getId())
                .analysisId(record.getAnalysisId())
                .name(record.getName())
                .sql(record.getSql())
                .templateVariables(writeJson(record.getTemplateVariables()))
                .status(record.getStatus())
                .externalHandle(record.getExternalHandle())
                .rawResult(writeJson(record.getRawResult()))
                .error(record.getError())
                .errorKind(record.getErrorKind())
                .startedAt(record.getStartedAt())
                .finishedAt(record.getFinishedAt())
                .build();
        return toRecord(queryRepository.save(entity));
    }

    @Override
    @Transactional
    public boolean updateQuery(String queryId, QueryUpdate update) {
        if (!update.isTerminal()) {
            return queryRepository.attachHandle(queryId, update.getExternalHandle(), QueryStatus.RUNNING) == 1;
        }
        return queryRepository.complete(
                queryId,
                update.getStatus(),
                writeJson(update.getRawResult()),
                update.getError(),
                update.getErrorKind(),
                update.getFinishedAt(),
                QueryStatus.RUNNING
        ) == 1;
    }

    @Override
    @Transactional(readOnly = true)
    public List<QueryRecord> getQueriesByIds(List<String> queryIds) {
        if (queryIds.isEmpty()) {
            return List.of();
        }
        Map<String, QueryRecordEntity> byId = queryRepository.findAllById(queryIds).stream()
                .collect(Collectors.toMap(QueryRecordEntity::getId, Function.identity()));

        // Same order as requested
        List<QueryRecord> records = new ArrayList<>(queryIds.size());
        for (String id : queryIds) {
            QueryRecordEntity entity = byId.get(id);
            if (entity != null) {
                records.add(toRecord(entity));
            }
        }
        return records;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<QueryRecord> getQueryById(String queryId) {
        return queryRepository.findById(queryId).map(this::toRecord);
    }

    /**
     * Not transactional on purpose: the insert runs in its own transaction so a
     * unique constraint violation can be followed by a lookup of the winner.
     */
    @Override
    public AnalysisRecord createAnalysisIfAbsent(AnalysisRecord initial) {
        String targetKey = initial.getTargetKey();

        Optional<AnalysisRecordEntity> active = analysisRepository.findByActiveTargetKey(targetKey);
        if (active.isPresent()) {
            throw new AnalysisConflictException(targetKey, active.get().getId());
        }

        AnalysisRecordEntity entity = AnalysisRecordEntity.builder()
                .id(initial.getId())
                .targetKey(targetKey)
                .activeTargetKey(initial.getStatus().isTerminal() ? null : targetKey)
                .kind(initial.getKind())
                .integrationId(initial.getIntegrationId())
                .status(initial.getStatus())
                .queryIds(new ArrayList<>(initial.getQueryIds()))
                .createdAt(initial.getCreatedAt())
                .startedAt(initial.getStartedAt())
                .build();

        try {
            return toRecord(analysisRepository.saveAndFlush(entity));
        } catch (DataIntegrityViolationException e) {
            // Lost the race against a concurrent insert for the same target
            String existingId = analysisRepository.findByActiveTargetKey(targetKey)
                    .map(AnalysisRecordEntity::getId)
                    .orElse("unknown");
            log.debug("Single-flight insert rejected for {}: active analysis {}", targetKey, existingId);
            throw new AnalysisConflictException(targetKey, existingId);
        }
    }

    @Override
    @Transactional
    public boolean updateAnalysis(String analysisId, AnalysisUpdate update) {
        if (update.getStatus() == AnalysisStatus.RUNNING) {
            return analysisRepository.markRunning(
                    analysisId, update.getAt(), AnalysisStatus.QUEUED, AnalysisStatus.RUNNING) == 1;
        }

        return analysisRepository.complete(
                analysisId,
                update.getStatus(),
                writeJson(update.getResult()),
                update.getError(),
                update.getErrorKind(),
                update.getAt(),
                AnalysisStatus.ACTIVE
        ) == 1;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<AnalysisRecord> getAnalysisById(String analysisId) {
        return analysisRepository.findById(analysisId).map(this::toRecord);
    }

    @Override
    @Transactional(readOnly = true)
    public List<AnalysisRecord> findActiveAnalyses() {
        return analysisRepository.findByStatusIn(AnalysisStatus.ACTIVE).stream()
                .map(this::toRecord)
                .collect(Collectors.toList());
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<AnalysisRecord> findLatestAnalysis(String targetKey) {
        return analysisRepository.findFirstByTargetKeyOrderByCreatedAtDesc(targetKey).map(this::toRecord);
    }

    private QueryRecord toRecord(QueryRecordEntity entity) {
        return QueryRecord.builder()
                .id(entity.getId())
                .analysisId(entity.getAnalysisId())
                .name(entity.getName())
                .sql(entity.getSql())
                .templateVariables(entity.getTemplateVariables() == null
                        ? Map.of()
                        : readJson(entity.getTemplateVariables(), TEMPLATE_VARIABLES))
                .status(entity.getStatus())
                .externalHandle(entity.getExternalHandle())
                .rawResult(entity.getRawResult() == null ? null : readJson(entity.getRawResult(), RawResult.class))
                .error(entity.getError())
                .errorKind(entity.getErrorKind())
                .startedAt(entity.getStartedAt())
                .finishedAt(entity.getFinishedAt())
                .build();
    }

    private AnalysisRecord toRecord(AnalysisRecordEntity entity) {
        return AnalysisRecord.builder()
                .id(entity.getId())
                .targetKey(entity.getTargetKey())
                .kind(entity.getKind())
                .integrationId(entity.getIntegrationId())
                .status(entity.getStatus())
                .queryIds(List.copyOf(entity.getQueryIds()))
                .result(entity.getResult() == null ? null : readTree(entity.getResult()))
                .error(entity.getError())
                .errorKind(entity.getErrorKind())
                .createdAt(entity.getCreatedAt())
                .startedAt(entity.getStartedAt())
                .finishedAt(entity.getFinishedAt())
                .build();
    }

    private String writeJson(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private <T> T readJson(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt " + type.getSimpleName() + " JSON in store", e);
        }
    }

    private <T> T readJson(String json, TypeReference<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt JSON in store", e);
        }
    }

    private JsonNode readTree(String json) {
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt analysis result JSON in store", e);
        }
    }
}
