package com.dashboard.domain.service;

import com.dashboard.domain.exception.DashboardStatsException;
import com.dashboard.domain.exception.PartialAggregateFailureException;
import com.dashboard.domain.exception.ShardUnavailableException;
import com.dashboard.domain.model.BoothStat;
import com.dashboard.domain.model.StatsSnapshot;
import com.dashboard.domain.model.Tenant;
import com.dashboard.infrastructure.persistence.repository.VoterField;
import com.dashboard.infrastructure.persistence.repository.VoterFilter;
import com.dashboard.infrastructure.persistence.repository.VoterShardRepository;
import com.dashboard.infrastructure.shard.ShardHandle;
import com.dashboard.infrastructure.shard.ShardRouter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;

/**
 * Computes the canonical statistics of one AC straight from its shard.
 * 
 * This is the expensive path. The five aggregates are independent, so they
 * run concurrently and are joined; latency is that of the slowest one.
 * 
 * Aggregates:
 * 1. totalMembers - every voter record
 * 2. surveysCompleted - voters flagged as surveyed
 * 3. totalFamilies - distinct non-empty family ids
 * 4. totalBooths - distinct non-empty booth ids
 * 5. boothStats - per-booth breakdown, sorted by booth number
 * 
 * Any aggregate failing fails the whole computation; there is no partial result.
 */
@Slf4j
@Service
public class StatsComputer {
    
    private static final Comparator<BoothStat> BY_BOOTH_NO = Comparator
            .comparing(BoothStat::getBoothNo, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(BoothStat::getBoothId, Comparator.nullsLast(Comparator.naturalOrder()));
    
    private final TenantRegistry tenantRegistry;
    private final ShardRouter shardRouter;
    private final VoterShardRepository voterRepository;
    private final SnapshotWriter snapshotWriter;
    private final Executor aggregateExecutor;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    
    public StatsComputer(TenantRegistry tenantRegistry,
                         ShardRouter shardRouter,
                         VoterShardRepository voterRepository,
                         SnapshotWriter snapshotWriter,
                         @Qualifier("aggregateExecutor") Executor aggregateExecutor,
                         MeterRegistry meterRegistry,
                         Clock clock) {
        this.tenantRegistry = tenantRegistry;
        this.shardRouter = shardRouter;
        this.voterRepository = voterRepository;
        this.snapshotWriter = snapshotWriter;
        this.aggregateExecutor = aggregateExecutor;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }
    
    /**
     * Compute stats and hand them to the snapshot store in the background.
     * 
     * The save is best effort: if the write pool is saturated the snapshot is
     * dropped and the caller still gets its result.
     */
    public StatsSnapshot compute(int acId) {
        StatsSnapshot stats = computeFresh(acId);
        
        try {
            snapshotWriter.writeAsync(stats);
            
        } catch (TaskRejectedException e) {
            log.error("Snapshot save for AC {} rejected, write pool saturated: {}", acId, e.getMessage());
            
            Counter.builder("stats.snapshot.save")
                    .tag("result", "rejected")
                    .register(meterRegistry)
                    .increment();
        }
        
        return stats;
    }
    
    /**
     * Compute stats without persisting them.
     */
    public StatsSnapshot computeFresh(int acId) {
        Tenant tenant = tenantRegistry.require(acId);
        ShardHandle shard = shardRouter.resolve(acId);
        
        Timer.Sample sample = Timer.start(meterRegistry);
        // computedAt is the start time: every record read is at least this recent
        Instant startedAt = clock.instant().truncatedTo(ChronoUnit.MILLIS);
        
        CompletableFuture<Long> totalMembers = aggregate(acId, "totalMembers",
                () -> voterRepository.count(shard, VoterFilter.ALL));
        CompletableFuture<Long> surveysCompleted = aggregate(acId, "surveysCompleted",
                () -> voterRepository.count(shard, VoterFilter.SURVEYED));
        CompletableFuture<Long> totalFamilies = aggregate(acId, "totalFamilies",
                () -> voterRepository.countDistinct(shard, VoterField.FAMILY_ID));
        CompletableFuture<Long> totalBooths = aggregate(acId, "totalBooths",
                () -> voterRepository.countDistinct(shard, VoterField.BOOTH_ID));
        CompletableFuture<List<BoothStat>> boothStats = aggregate(acId, "boothStats",
                () -> voterRepository.boothBreakdown(shard));
        
        try {
            CompletableFuture.allOf(totalMembers, surveysCompleted, totalFamilies, totalBooths, boothStats).join();
        } catch (CompletionException e) {
            sample.stop(Timer.builder("stats.compute.latency")
                    .tag("result", "error")
                    .register(meterRegistry));
            throw unwrap(acId, e);
        }
        
        List<BoothStat> sortedBooths = new ArrayList<>(boothStats.join());
        sortedBooths.sort(BY_BOOTH_NO);
        
        long durationMs = clock.millis() - startedAt.toEpochMilli();
        
        StatsSnapshot stats = StatsSnapshot.builder()
                .acId(acId)
                .acName(tenant.getName())
                .totalMembers(totalMembers.join())
                .totalFamilies(totalFamilies.join())
                .totalBooths(totalBooths.join())
                .surveysCompleted(surveysCompleted.join())
                .boothStats(sortedBooths)
                .computedAt(startedAt)
                .computeDurationMs(Math.max(durationMs, 0))
                .build();
        
        sample.stop(Timer.builder("stats.compute.latency")
                .tag("result", "success")
                .register(meterRegistry));
        
        log.info("Computed stats for AC {}: {} voters, {} booths, {} ms",
                acId, stats.getTotalMembers(), stats.getTotalBooths(), stats.getComputeDurationMs());
        
        return stats;
    }
    
    private <T> CompletableFuture<T> aggregate(int acId, String name, Supplier<T> query) {
        try {
            return CompletableFuture.supplyAsync(() -> {
                try {
                    return query.get();
                } catch (ShardUnavailableException e) {
                    throw e;
                } catch (RuntimeException e) {
                    throw new PartialAggregateFailureException(acId, name, e);
                }
            }, aggregateExecutor);
            
        } catch (RejectedExecutionException e) {
            // Aggregate pool saturated; fails the computation like any other aggregate failure
            log.warn("Aggregate {} for AC {} rejected: {}", name, acId, e.getMessage());
            return CompletableFuture.failedFuture(new PartialAggregateFailureException(acId, name, e));
        }
    }
    
    private DashboardStatsException unwrap(int acId, CompletionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof DashboardStatsException statsException) {
            log.error("Stats computation failed for AC {}: {}", acId, cause.getMessage());
            return statsException;
        }
        log.error("Stats computation failed for AC {}: {}", acId, String.valueOf(cause), cause);
        return new PartialAggregateFailureException(acId, "unknown", cause != null ? cause : e);
    }
}
