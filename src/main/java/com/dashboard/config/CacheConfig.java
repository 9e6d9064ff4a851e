package com.dashboard.config;

import com.dashboard.domain.model.DashboardStatsResponse;
import com.dashboard.domain.model.TenantOverviewResponse;
import com.dashboard.infrastructure.cache.InMemoryTtlCache;
import com.dashboard.infrastructure.cache.RedisTtlCache;
import com.dashboard.infrastructure.cache.TtlCache;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;
import java.time.Duration;

/**
 * TTL cache instances.
 * 
 * app.cache.backend=memory (default): one process-local cache per instance.
 * app.cache.backend=redis: shared across instances, same read semantics.
 */
@Configuration
public class CacheConfig {
    
    @Configuration
    @ConditionalOnProperty(name = "app.cache.backend", havingValue = "memory", matchIfMissing = true)
    static class InMemoryCaches {
        
        @Bean
        public TtlCache<DashboardStatsResponse> dashboardStatsCache(Clock clock) {
            return new InMemoryTtlCache<>(clock);
        }
        
        @Bean
        public TtlCache<TenantOverviewResponse> overviewCache(Clock clock) {
            return new InMemoryTtlCache<>(clock);
        }
    }
    
    @Configuration
    @ConditionalOnProperty(name = "app.cache.backend", havingValue = "redis")
    static class RedisCaches {
        
        @Value("${app.cache.redis.retention:PT1H}")
        private Duration retention;
        
        @Bean
        public TtlCache<DashboardStatsResponse> dashboardStatsCache(StringRedisTemplate redisTemplate,
                                                                    ObjectMapper objectMapper,
                                                                    Clock clock) {
            return new RedisTtlCache<>(redisTemplate, objectMapper, "dashboard:stats:",
                    DashboardStatsResponse.class, retention, clock);
        }
        
        @Bean
        public TtlCache<TenantOverviewResponse> overviewCache(StringRedisTemplate redisTemplate,
                                                              ObjectMapper objectMapper,
                                                              Clock clock) {
            return new RedisTtlCache<>(redisTemplate, objectMapper, "dashboard:overview:",
                    TenantOverviewResponse.class, retention, clock);
        }
    }
}
