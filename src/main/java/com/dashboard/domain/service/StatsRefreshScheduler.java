package com.dashboard.domain.service;

import com.dashboard.domain.model.RefreshReport;
import com.dashboard.domain.model.StatsSnapshot;
import com.dashboard.domain.model.Tenant;
import com.dashboard.infrastructure.persistence.PrecomputedStatsStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Keeps every AC's precomputed snapshot warm, independent of request traffic.
 * 
 * Processing Flow:
 * 1. Tick every 5 minutes (app.refresh.interval)
 * 2. Skip the tick if the previous cycle is still running (skip, don't queue)
 * 3. Recompute and save every AC on a bounded worker pool (app.refresh.workers)
 * 4. Log start/end/error per AC and a summary per cycle
 * 
 * Failure Handling:
 * - A failing AC is logged and counted; the other ACs are still refreshed
 * - No retry within a cycle; the next cycle is the retry
 */
@Slf4j
@Service
public class StatsRefreshScheduler {
    
    private final TenantRegistry tenantRegistry;
    private final StatsComputer statsComputer;
    private final PrecomputedStatsStore statsStore;
    private final Executor workerExecutor;
    private final Executor cycleExecutor;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final boolean enabled;
    
    private final AtomicBoolean cycleRunning = new AtomicBoolean(false);
    
    public StatsRefreshScheduler(TenantRegistry tenantRegistry,
                                 StatsComputer statsComputer,
                                 PrecomputedStatsStore statsStore,
                                 @Qualifier("refreshWorkerExecutor") Executor workerExecutor,
                                 @Qualifier("refreshCycleExecutor") Executor cycleExecutor,
                                 MeterRegistry meterRegistry,
                                 Clock clock,
                                 @Value("${app.refresh.enabled:true}") boolean enabled) {
        this.tenantRegistry = tenantRegistry;
        this.statsComputer = statsComputer;
        this.statsStore = statsStore;
        this.workerExecutor = workerExecutor;
        this.cycleExecutor = cycleExecutor;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.enabled = enabled;
    }
    
    @Scheduled(fixedRateString = "${app.refresh.interval:PT5M}",
               initialDelayString = "${app.refresh.initial-delay:PT30S}")
    public void scheduledRefresh() {
        if (!enabled) {
            log.debug("[Refresh] Background refresh disabled");
            return;
        }
        triggerRefresh();
    }
    
    /**
     * Start a refresh cycle unless one is already running.
     * 
     * @return the running cycle, or empty if this trigger was skipped
     */
    public Optional<CompletableFuture<RefreshReport>> triggerRefresh() {
        if (!cycleRunning.compareAndSet(false, true)) {
            log.warn("[Refresh] Skipping - previous cycle still running");
            
            Counter.builder("stats.refresh.cycle.skipped")
                    .register(meterRegistry)
                    .increment();
            
            return Optional.empty();
        }
        
        try {
            CompletableFuture<RefreshReport> cycle = CompletableFuture
                    .supplyAsync(this::refreshAllTenants, cycleExecutor)
                    .whenComplete((report, error) -> {
                        cycleRunning.set(false);
                        if (error != null) {
                            log.error("[Refresh] Cycle failed: {}", error.getMessage(), error);
                        }
                    });
            return Optional.of(cycle);
            
        } catch (RejectedExecutionException e) {
            cycleRunning.set(false);
            log.error("[Refresh] Could not start cycle: {}", e.getMessage());
            return Optional.empty();
        }
    }
    
    public boolean isCycleRunning() {
        return cycleRunning.get();
    }
    
    RefreshReport refreshAllTenants() {
        List<Tenant> tenants = tenantRegistry.all();
        log.info("[Refresh] Starting stats computation for {} ACs", tenants.size());
        
        Timer.Sample sample = Timer.start(meterRegistry);
        long startTime = clock.millis();
        
        List<CompletableFuture<RefreshReport.TenantResult>> results = tenants.stream()
                .map(tenant -> CompletableFuture.supplyAsync(() -> refreshTenant(tenant), workerExecutor))
                .toList();
        
        List<RefreshReport.TenantResult> details = results.stream()
                .map(CompletableFuture::join)
                .toList();
        
        int succeeded = (int) details.stream()
                .filter(result -> result.getOutcome() == RefreshReport.Outcome.SUCCESS)
                .count();
        
        RefreshReport report = RefreshReport.builder()
                .succeeded(succeeded)
                .failed(details.size() - succeeded)
                .details(details)
                .durationMs(clock.millis() - startTime)
                .build();
        
        sample.stop(Timer.builder("stats.refresh.cycle")
                .register(meterRegistry));
        
        log.info("[Refresh] Completed: {} success, {} failed in {} ms",
                report.getSucceeded(), report.getFailed(), report.getDurationMs());
        
        return report;
    }
    
    /**
     * Refresh one AC. Never throws: failures become a FAILED result.
     */
    RefreshReport.TenantResult refreshTenant(Tenant tenant) {
        int acId = tenant.getId();
        long startTime = clock.millis();
        log.info("[Refresh] AC {} started", acId);
        
        try {
            StatsSnapshot stats = statsComputer.computeFresh(acId);
            statsStore.save(stats);
            
            long durationMs = clock.millis() - startTime;
            log.info("[Refresh] AC {} finished: {} voters, {} ms", acId, stats.getTotalMembers(), durationMs);
            
            Counter.builder("stats.refresh.tenant")
                    .tag("result", "success")
                    .register(meterRegistry)
                    .increment();
            
            return RefreshReport.TenantResult.builder()
                    .acId(acId)
                    .outcome(RefreshReport.Outcome.SUCCESS)
                    .totalMembers(stats.getTotalMembers())
                    .durationMs(durationMs)
                    .build();
            
        } catch (Exception e) {
            log.error("[Refresh] AC {} failed: {}", acId, e.getMessage(), e);
            
            Counter.builder("stats.refresh.tenant")
                    .tag("result", "error")
                    .register(meterRegistry)
                    .increment();
            
            return RefreshReport.TenantResult.builder()
                    .acId(acId)
                    .outcome(RefreshReport.Outcome.FAILED)
                    .durationMs(clock.millis() - startTime)
                    .error(e.getMessage())
                    .build();
        }
    }
}
