package com.dashboard.infrastructure.cache;

import com.dashboard.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for InMemoryTtlCache.
 * 
 * Expiry is evaluated against the reader's maxAge, so most tests move a
 * fake clock rather than sleeping.
 */
class InMemoryTtlCacheTest {
    
    private MutableClock clock;
    private InMemoryTtlCache<String> cache;
    
    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-01-01T10:00:00Z");
        cache = new InMemoryTtlCache<>(clock);
    }
    
    @Test
    void testGet_MissingKey() {
        assertTrue(cache.get("ac:111:dashboard:stats", Duration.ofMinutes(5)).isEmpty());
    }
    
    @Test
    void testGet_HitWithinMaxAge() {
        cache.set("ac:111:dashboard:stats", "stats");
        clock.advance(Duration.ofMinutes(4));
        
        assertEquals(Optional.of("stats"), cache.get("ac:111:dashboard:stats", Duration.ofMinutes(5)));
    }
    
    @Test
    void testGet_BoundaryElapsedEqualsMaxAgeIsHit() {
        cache.set("key", "value");
        clock.advance(Duration.ofMinutes(5));
        
        assertEquals(Optional.of("value"), cache.get("key", Duration.ofMinutes(5)));
        
        clock.advance(Duration.ofMillis(1));
        assertTrue(cache.get("key", Duration.ofMinutes(5)).isEmpty());
    }
    
    @Test
    void testGet_ZeroMaxAgeHitsOnlyAtInsertInstant() {
        cache.set("key", "value");
        
        assertEquals(Optional.of("value"), cache.get("key", Duration.ZERO));
        
        clock.advance(Duration.ofMillis(1));
        assertTrue(cache.get("key", Duration.ZERO).isEmpty());
    }
    
    @Test
    void testGet_SameEntryServesDifferentTolerances() {
        cache.set("key", "value");
        clock.advance(Duration.ofMinutes(3));
        
        // A strict reader misses without evicting the entry for a tolerant one
        assertTrue(cache.get("key", Duration.ofMinutes(1)).isEmpty());
        assertEquals(Optional.of("value"), cache.get("key", Duration.ofMinutes(10)));
        assertEquals(1, cache.size());
    }
    
    @Test
    void testSet_OverwriteRestampsEntry() {
        cache.set("key", "old");
        clock.advance(Duration.ofMinutes(4));
        cache.set("key", "new");
        clock.advance(Duration.ofMinutes(4));
        
        assertEquals(Optional.of("new"), cache.get("key", Duration.ofMinutes(5)));
    }
    
    @Test
    void testInvalidate_RemovesAllAndOnlyMatchingKeys() {
        cache.set("ac:111:dashboard:stats", "a");
        cache.set("ac:111:booths", "b");
        cache.set("ac:11:dashboard:stats", "c");
        cache.set("ac:119:dashboard:stats", "d");
        cache.set("global:overview", "e");
        
        cache.invalidate(CacheKeys.tenantPrefix(111));
        
        Duration maxAge = Duration.ofMinutes(5);
        assertTrue(cache.get("ac:111:dashboard:stats", maxAge).isEmpty());
        assertTrue(cache.get("ac:111:booths", maxAge).isEmpty());
        assertEquals(Optional.of("c"), cache.get("ac:11:dashboard:stats", maxAge));
        assertEquals(Optional.of("d"), cache.get("ac:119:dashboard:stats", maxAge));
        assertEquals(Optional.of("e"), cache.get("global:overview", maxAge));
        assertEquals(3, cache.size());
    }
    
    @Test
    void testInvalidate_UnknownPrefixIsNoop() {
        cache.set("ac:111:dashboard:stats", "a");
        
        cache.invalidate("ac:999:");
        
        assertEquals(1, cache.size());
    }
    
    @Test
    void testConcurrentInvalidateAndGet() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        Duration maxAge = Duration.ofMinutes(5);
        
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int worker = 0; worker < 8; worker++) {
                int id = worker;
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < 2_000; i++) {
                        String key = "ac:" + (100 + (i % 5)) + ":k" + id;
                        if (i % 3 == 0) {
                            cache.invalidate("ac:" + (100 + (i % 5)) + ":");
                        } else if (i % 3 == 1) {
                            cache.set(key, "v" + i);
                        } else {
                            cache.get(key, maxAge);
                        }
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }
        
        // Once an invalidate has returned, nothing it removed is readable
        for (int ac = 100; ac < 105; ac++) {
            cache.invalidate("ac:" + ac + ":");
            for (int id = 0; id < 8; id++) {
                assertTrue(cache.get("ac:" + ac + ":k" + id, maxAge).isEmpty());
            }
        }
        assertEquals(0, cache.size());
    }
    
    @Test
    void testSet_RejectsNullValue() {
        assertThrows(NullPointerException.class, () -> cache.set("key", null));
    }
}
