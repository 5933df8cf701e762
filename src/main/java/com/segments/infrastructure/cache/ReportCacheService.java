package com.segments.infrastructure.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Redis cache for finished reports.
 *
 * Only whole-table aggregations are worth caching here; per-user and per-segment
 * lookups go straight to the store.
 *
 * Failure Handling:
 * - Redis errors read as a cache miss / skipped write
 * - Circuit breaker stops calling Redis while it is down
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReportCacheService {

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;

    @CircuitBreaker(name = "redis", fallbackMethod = "getCacheFallback")
    public <T> Optional<T> get(String key, Class<T> type) {
        String cached = redisTemplate.opsForValue().get(key);
        if (cached == null) {
            log.debug("Cache miss for key: {}", key);
            return Optional.empty();
        }

        try {
            T value = objectMapper.readValue(cached, type);
            log.debug("Cache hit for key: {}", key);
            return Optional.of(value);
        } catch (Exception e) {
            log.error("Unreadable cache entry {}, ignoring: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    @CircuitBreaker(name = "redis", fallbackMethod = "setCacheFallback")
    public void set(String key, Object value, long ttlSeconds) {
        String json;
        try {
            json = objectMapper.writeValueAsString(value);
        } catch (Exception e) {
            log.error("Error serializing cache entry {}: {}", key, e.getMessage());
            return;
        }
        redisTemplate.opsForValue().set(key, json, ttlSeconds, TimeUnit.SECONDS);
        log.debug("Cached result for key: {} (TTL: {}s)", key, ttlSeconds);
    }

    public String key(String prefix, Object... parts) {
        StringBuilder key = new StringBuilder(prefix);
        for (Object part : parts) {
            key.append(":").append(part != null ? part.toString() : "null");
        }
        return key.toString();
    }

    // Fallback methods (circuit breaker)

    private <T> Optional<T> getCacheFallback(String key, Class<T> type, Exception e) {
        log.warn("Redis unavailable ({}), reading {} from the store", e.getMessage(), key);
        return Optional.empty();
    }

    private void setCacheFallback(String key, Object value, long ttlSeconds, Exception e) {
        log.warn("Redis unavailable ({}), skipping cache write for {}", e.getMessage(), key);
    }
}
