package com.dashboard.infrastructure.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Time-bounded key/value cache.
 * 
 * Entries do not carry their own TTL: each reader states how old a value it
 * will accept, so one entry can serve callers with different tolerances.
 * Time is the only eviction axis.
 */
public interface TtlCache<V> {
    
    /**
     * Hit iff now - insertedAt <= maxAge.
     */
    Optional<V> get(String key, Duration maxAge);
    
    /**
     * Unconditional overwrite, stamped with the current time.
     */
    void set(String key, V value);
    
    /**
     * Removes every key starting with prefix.
     */
    void invalidate(String prefix);
    
    int size();
}
