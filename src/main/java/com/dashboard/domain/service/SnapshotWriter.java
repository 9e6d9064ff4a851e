package com.dashboard.domain.service;

import com.dashboard.domain.model.StatsSnapshot;
import com.dashboard.infrastructure.persistence.PrecomputedStatsStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Persists snapshots produced on the request path.
 * 
 * The caller already holds a correct result, so a failed save is logged
 * and counted, never rethrown. Runs on its own pool so the save completes
 * even if the caller has given up on the request.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SnapshotWriter {
    
    private final PrecomputedStatsStore statsStore;
    private final MeterRegistry meterRegistry;
    
    @Async("snapshotWriteExecutor")
    public void writeAsync(StatsSnapshot snapshot) {
        try {
            statsStore.save(snapshot);
            
            Counter.builder("stats.snapshot.save")
                    .tag("result", "success")
                    .register(meterRegistry)
                    .increment();
            
        } catch (Exception e) {
            log.error("Failed to save precomputed stats for AC {}: {}", snapshot.getAcId(), e.getMessage(), e);
            
            Counter.builder("stats.snapshot.save")
                    .tag("result", "error")
                    .register(meterRegistry)
                    .increment();
        }
    }
}
