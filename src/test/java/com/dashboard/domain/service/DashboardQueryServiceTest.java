package com.dashboard.domain.service;

import com.dashboard.domain.exception.PersistenceFailureException;
import com.dashboard.domain.exception.ShardUnavailableException;
import com.dashboard.domain.exception.UnknownTenantException;
import com.dashboard.domain.model.DashboardStatsResponse;
import com.dashboard.domain.model.SnapshotLookup;
import com.dashboard.domain.model.StatsSnapshot;
import com.dashboard.domain.model.StatsSource;
import com.dashboard.domain.model.TenantOverviewResponse;
import com.dashboard.infrastructure.cache.InMemoryTtlCache;
import com.dashboard.infrastructure.persistence.PrecomputedStatsStore;
import com.dashboard.infrastructure.shard.JdbcShardRouter;
import com.dashboard.support.InMemoryPrecomputedStatsStore;
import com.dashboard.support.InMemoryVoterShardRepository;
import com.dashboard.support.MutableClock;
import com.dashboard.support.TestTenants;
import com.dashboard.support.VoterRecord;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for DashboardQueryService.
 * 
 * The whole read path is real: in-memory caches, snapshot store and
 * shards, with the snapshot writer invoked directly so saves are visible
 * to the next call.
 */
class DashboardQueryServiceTest {
    
    private static final Executor DIRECT = Runnable::run;
    private static final Duration STATS_TTL = Duration.ofMinutes(5);
    private static final Duration SNAPSHOT_MAX_AGE = Duration.ofMinutes(10);
    
    private MutableClock clock;
    private MeterRegistry meterRegistry;
    private TenantRegistry tenantRegistry;
    private InMemoryVoterShardRepository voters;
    private InMemoryPrecomputedStatsStore statsStore;
    private InMemoryTtlCache<DashboardStatsResponse> statsCache;
    private InMemoryTtlCache<TenantOverviewResponse> overviewCache;
    private DashboardQueryService queryService;
    
    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-01-01T10:00:00Z");
        meterRegistry = new SimpleMeterRegistry();
        tenantRegistry = TestTenants.registry();
        voters = new InMemoryVoterShardRepository();
        statsStore = new InMemoryPrecomputedStatsStore(clock);
        statsCache = new InMemoryTtlCache<>(clock);
        overviewCache = new InMemoryTtlCache<>(clock);
        queryService = service(statsStore);
        
        voters.add("voters_111",
                voter("B1", 1, "F1", true),
                voter("B1", 1, "F1", false),
                voter("B2", 2, "F2", true));
        voters.add("voters_101", voter("B1", 1, "F9", false));
    }
    
    @Test
    void testGetStats_RealtimeThenCacheThenPrecomputed() {
        DashboardStatsResponse first = queryService.getStats(111);
        assertEquals(StatsSource.REALTIME, first.getSource());
        assertEquals(3, first.getTotalMembers());
        assertEquals(2, first.getTotalFamilies());
        assertEquals(2, first.getSurveysCompleted());
        assertEquals(2, first.getTotalBooths());
        assertTrue(statsStore.has(111));
        
        int queriesAfterCompute = voters.queryCount();
        
        DashboardStatsResponse second = queryService.getStats(111);
        assertEquals(StatsSource.CACHE, second.getSource());
        assertEquals(3, second.getTotalMembers());
        
        // Cache expired, snapshot still within its max age
        clock.advance(Duration.ofMinutes(6));
        DashboardStatsResponse third = queryService.getStats(111);
        assertEquals(StatsSource.PRECOMPUTED, third.getSource());
        assertEquals(first.getComputedAt(), third.getComputedAt());
        
        assertEquals(queriesAfterCompute, voters.queryCount());
        assertEquals(1.0, meterRegistry.get("dashboard.stats.requests").tag("source", "cache").counter().count());
    }
    
    @Test
    void testGetStats_StaleSnapshotIsRecomputed() {
        queryService.getStats(111);
        
        clock.advance(Duration.ofMinutes(11));
        DashboardStatsResponse response = queryService.getStats(111);
        
        assertEquals(StatsSource.REALTIME, response.getSource());
        assertEquals(Instant.parse("2026-01-01T10:11:00Z"), response.getComputedAt());
    }
    
    @Test
    void testGetStats_CacheHitAtExactlyTtl() {
        queryService.getStats(111);
        
        clock.advance(STATS_TTL);
        
        assertEquals(StatsSource.CACHE, queryService.getStats(111).getSource());
    }
    
    @Test
    void testGetStats_CachedCopyIsNotTheReturnedInstance() {
        DashboardStatsResponse first = queryService.getStats(111);
        first.setTotalMembers(-1);
        
        assertEquals(3, queryService.getStats(111).getTotalMembers());
    }
    
    @Test
    void testGetStats_MutatingReturnedBoothLeavesCacheIntact() {
        queryService.getStats(111).getBoothStats().get(0).setVoterCount(-1);
        
        DashboardStatsResponse cached = queryService.getStats(111);
        cached.getBoothStats().get(0).setBoothName("changed");
        
        DashboardStatsResponse again = queryService.getStats(111);
        assertEquals(StatsSource.CACHE, again.getSource());
        assertEquals(2, again.getBoothStats().get(0).getVoterCount());
        assertNull(again.getBoothStats().get(0).getBoothName());
    }
    
    @Test
    void testGetStats_InvalidationDuringRealtimeReadIsNotUndone() {
        DashboardQueryService service = serviceInvalidatingOnFirstRead();
        
        DashboardStatsResponse response = service.getStats(111);
        
        assertEquals(StatsSource.REALTIME, response.getSource());
        assertEquals(0, statsCache.size());
        
        // Reads that start after the invalidation cache normally
        service.getStats(111);
        assertEquals(1, statsCache.size());
        assertEquals(StatsSource.CACHE, service.getStats(111).getSource());
    }
    
    @Test
    void testGetStats_InvalidationDuringSnapshotReadIsNotUndone() {
        statsStore.save(snapshot(111, 3, "2026-01-01T09:59:00Z"));
        DashboardQueryService service = serviceInvalidatingOnFirstRead();
        
        DashboardStatsResponse response = service.getStats(111);
        
        assertEquals(StatsSource.PRECOMPUTED, response.getSource());
        assertEquals(0, statsCache.size());
    }
    
    @Test
    void testCacheEntriesGauge() {
        queryService.getStats(111);
        queryService.getStats(101);
        queryService.getOverview();
        
        assertEquals(2.0, meterRegistry.get("dashboard.cache.entries").tag("cache", "stats").gauge().value());
        assertEquals(1.0, meterRegistry.get("dashboard.cache.entries").tag("cache", "overview").gauge().value());
        
        queryService.invalidateAllTenants();
        assertEquals(0.0, meterRegistry.get("dashboard.cache.entries").tag("cache", "stats").gauge().value());
    }
    
    @Test
    void testGetStats_UnknownAcFailsFast() {
        assertThrows(UnknownTenantException.class, () -> queryService.getStats(999));
        
        assertEquals(0, voters.queryCount());
        assertEquals(0, statsCache.size());
    }
    
    @Test
    void testGetStats_ShardFailureIsNeverCached() {
        voters.failOn("voters_118", new ShardUnavailableException(118, "connection refused", null));
        
        assertThrows(ShardUnavailableException.class, () -> queryService.getStats(118));
        int queriesAfterFirst = voters.queryCount();
        assertThrows(ShardUnavailableException.class, () -> queryService.getStats(118));
        
        assertTrue(voters.queryCount() > queriesAfterFirst);
        assertEquals(0, statsCache.size());
        assertFalse(statsStore.has(118));
    }
    
    @Test
    void testGetStats_StoreReadFailureFallsThroughToRealtime() {
        PrecomputedStatsStore brokenStore = mock(PrecomputedStatsStore.class);
        when(brokenStore.get(anyInt(), any())).thenThrow(new PersistenceFailureException("store down", null));
        DashboardQueryService service = service(brokenStore);
        
        DashboardStatsResponse response = service.getStats(111);
        
        assertEquals(StatsSource.REALTIME, response.getSource());
        assertEquals(3, response.getTotalMembers());
    }
    
    @Test
    void testInvalidateTenant_OnlyDropsThatAc() {
        queryService.getStats(111);
        queryService.getStats(101);
        assertEquals(2, statsCache.size());
        
        queryService.invalidateTenant(111);
        
        assertEquals(1, statsCache.size());
        // Snapshot is still fresh, so no recomputation
        assertEquals(StatsSource.PRECOMPUTED, queryService.getStats(111).getSource());
        assertEquals(StatsSource.CACHE, queryService.getStats(101).getSource());
    }
    
    @Test
    void testInvalidateTenant_UnknownAc() {
        assertThrows(UnknownTenantException.class, () -> queryService.invalidateTenant(999));
    }
    
    @Test
    void testInvalidateAllTenants_DropsEverything() {
        queryService.getStats(111);
        queryService.getStats(101);
        queryService.getOverview();
        
        queryService.invalidateAllTenants();
        
        assertEquals(0, statsCache.size());
        assertEquals(0, overviewCache.size());
    }
    
    @Test
    void testGetOverview_UsesSnapshotsOnly() {
        statsStore.save(snapshot(101, 100, "2026-01-01T09:58:00Z"));
        statsStore.save(snapshot(119, 250, "2026-01-01T09:59:00Z"));
        
        TenantOverviewResponse overview = queryService.getOverview();
        
        assertEquals(List.of(101, 119), overview.getTenants().stream()
                .map(TenantOverviewResponse.TenantSummary::getAcId)
                .toList());
        assertEquals(List.of(111, 118, 125), overview.getMissingAcIds());
        assertEquals(350, overview.getTotalMembers());
        assertEquals("Thondamuthur", overview.getTenants().get(1).getAcName());
        assertEquals(0, voters.queryCount());
    }
    
    @Test
    void testGetOverview_CachedUntilTtl() {
        statsStore.save(snapshot(101, 100, "2026-01-01T09:58:00Z"));
        TenantOverviewResponse first = queryService.getOverview();
        
        statsStore.save(snapshot(111, 70, "2026-01-01T10:00:00Z"));
        assertEquals(first.getTotalMembers(), queryService.getOverview().getTotalMembers());
        
        clock.advance(Duration.ofMinutes(6));
        assertEquals(170, queryService.getOverview().getTotalMembers());
    }
    
    private DashboardQueryService service(PrecomputedStatsStore store) {
        SnapshotWriter snapshotWriter = new SnapshotWriter(store, meterRegistry);
        StatsComputer computer = new StatsComputer(tenantRegistry, new JdbcShardRouter(tenantRegistry, "voters_"),
                voters, snapshotWriter, DIRECT, meterRegistry, clock);
        return new DashboardQueryService(tenantRegistry, statsCache, overviewCache, store, computer,
                meterRegistry, clock, STATS_TTL, SNAPSHOT_MAX_AGE);
    }
    
    /**
     * Service whose first snapshot read is overtaken by a voter mutation on the same AC.
     */
    private DashboardQueryService serviceInvalidatingOnFirstRead() {
        AtomicReference<DashboardQueryService> service = new AtomicReference<>();
        AtomicBoolean mutated = new AtomicBoolean();
        PrecomputedStatsStore racingStore = new PrecomputedStatsStore() {
            @Override
            public SnapshotLookup get(int acId, Duration maxAge) {
                SnapshotLookup lookup = statsStore.get(acId, maxAge);
                if (mutated.compareAndSet(false, true)) {
                    service.get().invalidateTenant(acId);
                }
                return lookup;
            }
            
            @Override
            public void save(StatsSnapshot snapshot) {
                statsStore.save(snapshot);
            }
            
            @Override
            public List<StatsSnapshot> getAll() {
                return statsStore.getAll();
            }
        };
        service.set(service(racingStore));
        return service.get();
    }
    
    private static StatsSnapshot snapshot(int acId, long totalMembers, String computedAt) {
        return StatsSnapshot.builder()
                .acId(acId)
                .acName(acId == 119 ? "Thondamuthur" : "AC " + acId)
                .totalMembers(totalMembers)
                .computedAt(Instant.parse(computedAt))
                .build();
    }
    
    private static VoterRecord voter(String boothId, int boothNo, String familyId, boolean surveyed) {
        return VoterRecord.builder()
                .boothId(boothId)
                .boothNo(boothNo)
                .familyId(familyId)
                .gender("Male")
                .surveyed(surveyed)
                .build();
    }
}
