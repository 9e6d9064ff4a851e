package com.dashboard.domain.service;

import com.dashboard.domain.exception.PersistenceFailureException;
import com.dashboard.domain.model.DashboardStatsResponse;
import com.dashboard.domain.model.SnapshotLookup;
import com.dashboard.domain.model.StatsSnapshot;
import com.dashboard.domain.model.StatsSource;
import com.dashboard.domain.model.Tenant;
import com.dashboard.domain.model.TenantOverviewResponse;
import com.dashboard.infrastructure.cache.CacheKeys;
import com.dashboard.infrastructure.cache.TtlCache;
import com.dashboard.infrastructure.persistence.PrecomputedStatsStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Single read entry point for AC dashboard statistics.
 * 
 * Query Flow:
 * 1. Generate cache key from AC id and query shape
 * 2. Check TTL cache (app.cache.stats-ttl, default 5 minutes)
 * 3. Check precomputed snapshot (app.snapshot.max-age, default 10 minutes)
 * 4. Compute in real time from the shard; the computer saves the snapshot
 * 5. Store result in cache and return it tagged with its source
 * 
 * Cache Invalidation:
 * - Mutating one AC's voters: invalidateTenant(acId)
 * - Schema-wide change (e.g. a field added to every voter): invalidateAllTenants()
 * - A read that overlaps an invalidation returns its result but does not cache it
 * 
 * The cross-AC overview reads every snapshot from the store and never fans
 * out real-time computations.
 */
@Slf4j
@Service
public class DashboardQueryService {
    
    private final TenantRegistry tenantRegistry;
    private final TtlCache<DashboardStatsResponse> statsCache;
    private final TtlCache<TenantOverviewResponse> overviewCache;
    private final PrecomputedStatsStore statsStore;
    private final StatsComputer statsComputer;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final Duration statsTtl;
    private final Duration snapshotMaxAge;
    
    // Bumped on every invalidation; a read only caches if its generation is still current
    private final ConcurrentMap<Integer, AtomicLong> generations = new ConcurrentHashMap<>();
    private final AtomicLong overviewGeneration = new AtomicLong();
    
    public DashboardQueryService(TenantRegistry tenantRegistry,
                                 TtlCache<DashboardStatsResponse> statsCache,
                                 TtlCache<TenantOverviewResponse> overviewCache,
                                 PrecomputedStatsStore statsStore,
                                 StatsComputer statsComputer,
                                 MeterRegistry meterRegistry,
                                 Clock clock,
                                 @Value("${app.cache.stats-ttl:PT5M}") Duration statsTtl,
                                 @Value("${app.snapshot.max-age:PT10M}") Duration snapshotMaxAge) {
        this.tenantRegistry = tenantRegistry;
        this.statsCache = statsCache;
        this.overviewCache = overviewCache;
        this.statsStore = statsStore;
        this.statsComputer = statsComputer;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.statsTtl = statsTtl;
        this.snapshotMaxAge = snapshotMaxAge;
        
        Gauge.builder("dashboard.cache.entries", statsCache, TtlCache::size)
                .tag("cache", "stats")
                .register(meterRegistry);
        Gauge.builder("dashboard.cache.entries", overviewCache, TtlCache::size)
                .tag("cache", "overview")
                .register(meterRegistry);
    }
    
    /**
     * Dashboard statistics for one AC.
     */
    public DashboardStatsResponse getStats(int acId) {
        Timer.Sample sample = Timer.start(meterRegistry);
        
        // Fail fast before touching any cache layer
        tenantRegistry.require(acId);
        
        String cacheKey = CacheKeys.dashboardStats(acId);
        long generation = generationOf(acId).get();
        
        Optional<DashboardStatsResponse> cached = statsCache.get(cacheKey, statsTtl);
        if (cached.isPresent()) {
            log.debug("Cache hit for AC {} stats", acId);
            return record(sample, cached.get().copy().toBuilder().source(StatsSource.CACHE).build());
        }
        
        SnapshotLookup lookup = lookupSnapshot(acId);
        if (lookup.isFresh()) {
            DashboardStatsResponse response = DashboardStatsResponse.from(lookup.getSnapshot(), StatsSource.PRECOMPUTED);
            cacheIfCurrent(acId, generation, cacheKey, response);
            return record(sample, response);
        }
        
        log.info("Computing stats for AC {} (precomputed {})", acId, lookup.getStatus().name().toLowerCase());
        
        // Failures propagate and nothing is cached
        StatsSnapshot stats = statsComputer.compute(acId);
        DashboardStatsResponse response = DashboardStatsResponse.from(stats, StatsSource.REALTIME);
        cacheIfCurrent(acId, generation, cacheKey, response);
        return record(sample, response);
    }
    
    /**
     * Roll-up across every AC, from precomputed snapshots only.
     */
    public TenantOverviewResponse getOverview() {
        long generation = overviewGeneration.get();
        
        Optional<TenantOverviewResponse> cached = overviewCache.get(CacheKeys.OVERVIEW, statsTtl);
        if (cached.isPresent()) {
            log.debug("Cache hit for overview");
            return cached.get();
        }
        
        Map<Integer, StatsSnapshot> snapshots = statsStore.getAll().stream()
                .filter(snapshot -> tenantRegistry.contains(snapshot.getAcId()))
                .collect(Collectors.toMap(StatsSnapshot::getAcId, Function.identity(), (a, b) -> a));
        
        List<TenantOverviewResponse.TenantSummary> summaries = new ArrayList<>();
        List<Integer> missing = new ArrayList<>();
        
        for (Tenant tenant : tenantRegistry.all()) {
            StatsSnapshot snapshot = snapshots.get(tenant.getId());
            if (snapshot == null) {
                missing.add(tenant.getId());
                continue;
            }
            summaries.add(TenantOverviewResponse.TenantSummary.builder()
                    .acId(snapshot.getAcId())
                    .acName(snapshot.getAcName() != null ? snapshot.getAcName() : tenant.getName())
                    .totalMembers(snapshot.getTotalMembers())
                    .totalFamilies(snapshot.getTotalFamilies())
                    .totalBooths(snapshot.getTotalBooths())
                    .surveysCompleted(snapshot.getSurveysCompleted())
                    .computedAt(snapshot.getComputedAt())
                    .build());
        }
        
        summaries.sort(Comparator.comparingInt(TenantOverviewResponse.TenantSummary::getAcId));
        
        TenantOverviewResponse overview = TenantOverviewResponse.builder()
                .tenants(summaries)
                .missingAcIds(missing)
                .totalMembers(summaries.stream().mapToLong(TenantOverviewResponse.TenantSummary::getTotalMembers).sum())
                .totalFamilies(summaries.stream().mapToLong(TenantOverviewResponse.TenantSummary::getTotalFamilies).sum())
                .totalBooths(summaries.stream().mapToLong(TenantOverviewResponse.TenantSummary::getTotalBooths).sum())
                .surveysCompleted(summaries.stream().mapToLong(TenantOverviewResponse.TenantSummary::getSurveysCompleted).sum())
                .generatedAt(clock.instant())
                .build();
        
        if (!missing.isEmpty()) {
            log.info("Overview built without snapshots for ACs {}", missing);
        }
        
        if (overviewGeneration.get() == generation) {
            overviewCache.set(CacheKeys.OVERVIEW, overview);
            if (overviewGeneration.get() != generation) {
                overviewCache.invalidate(CacheKeys.OVERVIEW);
            }
        }
        return overview;
    }
    
    /**
     * Drop every cached value derived from one AC's voters.
     */
    public void invalidateTenant(int acId) {
        tenantRegistry.require(acId);
        generationOf(acId).incrementAndGet();
        statsCache.invalidate(CacheKeys.tenantPrefix(acId));
        log.info("Invalidated cache for AC {}", acId);
    }
    
    /**
     * Drop every AC's cached values plus global keys, for changes affecting all voters.
     */
    public void invalidateAllTenants() {
        for (Tenant tenant : tenantRegistry.all()) {
            generationOf(tenant.getId()).incrementAndGet();
            statsCache.invalidate(CacheKeys.tenantPrefix(tenant.getId()));
        }
        overviewGeneration.incrementAndGet();
        statsCache.invalidate(CacheKeys.GLOBAL_PREFIX);
        overviewCache.invalidate(CacheKeys.GLOBAL_PREFIX);
        log.info("Invalidated cache for all {} ACs and global keys", tenantRegistry.all().size());
    }
    
    /**
     * Cache a result unless the AC was invalidated after the read started.
     * 
     * The generation is checked again after the write: an invalidation that
     * lands between check and write would otherwise be undone.
     */
    private void cacheIfCurrent(int acId, long generation, String cacheKey, DashboardStatsResponse response) {
        AtomicLong current = generationOf(acId);
        if (current.get() != generation) {
            log.debug("AC {} invalidated during read, not caching", acId);
            return;
        }
        statsCache.set(cacheKey, response.copy());
        if (current.get() != generation) {
            statsCache.invalidate(cacheKey);
        }
    }
    
    private AtomicLong generationOf(int acId) {
        return generations.computeIfAbsent(acId, id -> new AtomicLong());
    }
    
    private SnapshotLookup lookupSnapshot(int acId) {
        try {
            return statsStore.get(acId, snapshotMaxAge);
        } catch (PersistenceFailureException e) {
            // Store down: fall through to a real-time computation
            log.warn("Precomputed store unavailable for AC {}: {}", acId, e.getMessage());
            return SnapshotLookup.missing();
        }
    }
    
    private DashboardStatsResponse record(Timer.Sample sample, DashboardStatsResponse response) {
        String source = response.getSource().getValue();
        
        Counter.builder("dashboard.stats.requests")
                .tag("source", source)
                .register(meterRegistry)
                .increment();
        
        sample.stop(Timer.builder("dashboard.stats.latency")
                .tag("source", source)
                .register(meterRegistry));
        
        return response;
    }
}
