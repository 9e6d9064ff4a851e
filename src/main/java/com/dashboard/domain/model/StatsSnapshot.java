package com.dashboard.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Canonical statistics for one AC, as computed from its shard and as
 * persisted in the precomputed store.
 * 
 * A snapshot is always replaced as a whole, never merged field by field.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class StatsSnapshot {
    
    private int acId;
    private String acName;
    private long totalMembers;
    private long totalFamilies;
    private long totalBooths;
    private long surveysCompleted;
    
    @Builder.Default
    private List<BoothStat> boothStats = new ArrayList<>();
    
    private Instant computedAt;
    private long computeDurationMs;
    
    /**
     * Stale iff now - computedAt > maxAge. An age exactly equal to maxAge is still fresh.
     */
    public boolean isStaleAt(Instant now, Duration maxAge) {
        if (computedAt == null) {
            return true;
        }
        return Duration.between(computedAt, now).compareTo(maxAge) > 0;
    }
}
