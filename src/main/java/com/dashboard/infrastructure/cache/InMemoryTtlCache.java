package com.dashboard.infrastructure.cache;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.Iterator;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Process-local TTL cache.
 * 
 * Expiry is lazy: an old entry is simply not returned. Reads never remove
 * entries, since a caller with a longer tolerance may still accept them.
 * Key space is bounded (a few keys per AC) so there is no sweeper.
 */
@Slf4j
public class InMemoryTtlCache<V> implements TtlCache<V> {
    
    private final ConcurrentMap<String, CacheEntry<V>> entries = new ConcurrentHashMap<>();
    private final Clock clock;
    
    public InMemoryTtlCache(Clock clock) {
        this.clock = clock;
    }
    
    @Override
    public Optional<V> get(String key, Duration maxAge) {
        CacheEntry<V> entry = entries.get(key);
        
        if (entry == null) {
            log.debug("Cache miss for key: {}", key);
            return Optional.empty();
        }
        
        if (!entry.isFreshAt(clock.instant(), maxAge)) {
            log.debug("Cache entry too old for key: {} (inserted at {}, max age {})", key, entry.getInsertedAt(), maxAge);
            return Optional.empty();
        }
        
        log.debug("Cache hit for key: {}", key);
        return Optional.of(entry.getValue());
    }
    
    @Override
    public void set(String key, V value) {
        Objects.requireNonNull(value, "value");
        entries.put(key, new CacheEntry<>(key, value, clock.instant()));
        log.debug("Cached value for key: {}", key);
    }
    
    @Override
    public void invalidate(String prefix) {
        int removed = 0;
        Iterator<String> keys = entries.keySet().iterator();
        while (keys.hasNext()) {
            if (keys.next().startsWith(prefix)) {
                keys.remove();
                removed++;
            }
        }
        log.debug("Invalidated {} cache entries with prefix: {}", removed, prefix);
    }
    
    @Override
    public int size() {
        return entries.size();
    }
}
