package com.dashboard.infrastructure.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.Set;

/**
 * TTL cache shared across service instances through Redis.
 * 
 * Keys are namespaced per cache instance ("{namespace}{key}").
 * Entries are stored as a JSON {@link CacheEntry} envelope and freshness is
 * decided on read against the caller's maxAge, exactly like the in-memory
 * cache. The Redis key expiry (retention) only bounds memory; it must be
 * longer than any maxAge callers use.
 * 
 * Failure Handling:
 * - Circuit breaker prevents cascading failures
 * - Redis down reads as a miss, writes and invalidations are skipped
 */
@Slf4j
public class RedisTtlCache<V> implements TtlCache<V> {
    
    private final RedisTemplate<String, String> redisTemplate;
    private final ObjectMapper objectMapper;
    private final String namespace;
    private final JavaType entryType;
    private final Duration retention;
    private final Clock clock;
    
    public RedisTtlCache(RedisTemplate<String, String> redisTemplate,
                         ObjectMapper objectMapper,
                         String namespace,
                         Class<V> valueType,
                         Duration retention,
                         Clock clock) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.namespace = namespace;
        this.entryType = objectMapper.getTypeFactory().constructParametricType(CacheEntry.class, valueType);
        this.retention = retention;
        this.clock = clock;
    }
    
    @Override
    @CircuitBreaker(name = "redis", fallbackMethod = "getFallback")
    public Optional<V> get(String key, Duration maxAge) {
        String cached = redisTemplate.opsForValue().get(namespace + key);
        
        if (cached == null) {
            log.debug("Cache miss for key: {}", key);
            return Optional.empty();
        }
        
        CacheEntry<V> entry;
        try {
            entry = objectMapper.readValue(cached, entryType);
        } catch (JsonProcessingException e) {
            log.error("Error reading from cache for key {}: {}", key, e.getMessage());
            return Optional.empty();
        }
        
        if (!entry.isFreshAt(clock.instant(), maxAge)) {
            log.debug("Cache entry too old for key: {}", key);
            return Optional.empty();
        }
        
        log.debug("Cache hit for key: {}", key);
        return Optional.of(entry.getValue());
    }
    
    @Override
    @CircuitBreaker(name = "redis", fallbackMethod = "setFallback")
    public void set(String key, V value) {
        try {
            String json = objectMapper.writeValueAsString(new CacheEntry<>(key, value, clock.instant()));
            redisTemplate.opsForValue().set(namespace + key, json, retention);
            log.debug("Cached value for key: {} (retention: {})", key, retention);
            
        } catch (JsonProcessingException e) {
            log.error("Error writing to cache for key {}: {}", key, e.getMessage());
            // Don't throw - cache write failure shouldn't fail the query
        }
    }
    
    /**
     * Invalidate every key with the prefix.
     * 
     * KEYS is O(n) over the keyspace; fine for a dedicated cache database
     * holding a few keys per AC.
     */
    @Override
    @CircuitBreaker(name = "redis", fallbackMethod = "invalidateFallback")
    public void invalidate(String prefix) {
        Set<String> keys = redisTemplate.keys(namespace + prefix + "*");
        
        if (keys == null || keys.isEmpty()) {
            return;
        }
        
        Long removed = redisTemplate.delete(keys);
        log.debug("Invalidated {} cache entries with prefix: {}", removed, prefix);
    }
    
    @Override
    public int size() {
        Set<String> keys = redisTemplate.keys(namespace + "*");
        return keys != null ? keys.size() : 0;
    }
    
    // Fallback methods (circuit breaker)
    
    private Optional<V> getFallback(String key, Duration maxAge, Throwable t) {
        log.warn("Redis unavailable, treating {} as a miss: {}", key, t.getMessage());
        return Optional.empty();
    }
    
    private void setFallback(String key, V value, Throwable t) {
        log.warn("Redis unavailable, skipping cache write for {}: {}", key, t.getMessage());
    }
    
    private void invalidateFallback(String prefix, Throwable t) {
        log.error("Redis unavailable, could not invalidate prefix {}: {}", prefix, t.getMessage());
    }
}
