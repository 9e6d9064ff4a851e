package com.dashboard.infrastructure.cache;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;

/**
 * A cached value and the moment it was stored.
 * 
 * Also the JSON envelope written to Redis.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CacheEntry<V> {
    
    private String key;
    private V value;
    private Instant insertedAt;
    
    public boolean isFreshAt(Instant now, Duration maxAge) {
        return Duration.between(insertedAt, now).compareTo(maxAge) <= 0;
    }
}
