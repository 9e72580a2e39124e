package com.orchestrator.infrastructure.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.orchestrator.domain.model.AnalysisRecord;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Redis cache for finished analyses.
 *
 * Only terminal records are cached. They never change again, so an entry can
 * only expire, never become stale.
 *
 * Failure Handling:
 * - Circuit breaker keeps a Redis outage from slowing down reads
 * - Every failure falls back to the database
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AnalysisCacheService {

    private static final String KEY_PREFIX = "analysis:";

    private final RedisTemplate<String, String> redisTemplate;
    private final ObjectMapper objectMapper;

    @CircuitBreaker(name = "redis", fallbackMethod = "getFallback")
    public Optional<AnalysisRecord> get(String analysisId) {
        try {
            String cached = redisTemplate.opsForValue().get(KEY_PREFIX + analysisId);
            if (cached == null) {
                log.debug("Cache miss for analysis {}", analysisId);
                return Optional.empty();
            }
            log.debug("Cache hit for analysis {}", analysisId);
            return Optional.of(objectMapper.readValue(cached, AnalysisRecord.class));

        } catch (Exception e) {
            log.error("Error reading analysis {} from cache: {}", analysisId, e.getMessage());
            return Optional.empty();
        }
    }

    @CircuitBreaker(name = "redis", fallbackMethod = "putFallback")
    public void put(AnalysisRecord record, long ttlSeconds) {
        if (!record.isTerminal()) {
            return;
        }
        try {
            String json = objectMapper.writeValueAsString(record);
            redisTemplate.opsForValue().set(KEY_PREFIX + record.getId(), json, ttlSeconds, TimeUnit.SECONDS);
            log.debug("Cached analysis {} (TTL: {}s)", record.getId(), ttlSeconds);

        } catch (Exception e) {
            // A failed cache write must not fail the read
            log.error("Error writing analysis {} to cache: {}", record.getId(), e.getMessage());
        }
    }

    private Optional<AnalysisRecord> getFallback(String analysisId, Exception e) {
        log.warn("Redis circuit breaker open, reading analysis {} from database", analysisId);
        return Optional.empty();
    }

    private void putFallback(AnalysisRecord record, long ttlSeconds, Exception e) {
        log.warn("Redis circuit breaker open, skipping cache write");
    }
}
