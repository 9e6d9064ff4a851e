package com.dashboard.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Cross-AC roll-up for the state-level dashboard.
 * 
 * Built only from precomputed snapshots; ACs without a snapshot yet are
 * listed in missingAcIds instead of being computed on the spot.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TenantOverviewResponse {
    
    private List<TenantSummary> tenants;
    private List<Integer> missingAcIds;
    private long totalMembers;
    private long totalFamilies;
    private long totalBooths;
    private long surveysCompleted;
    private Instant generatedAt;
    
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TenantSummary {
        private int acId;
        private String acName;
        private long totalMembers;
        private long totalFamilies;
        private long totalBooths;
        private long surveysCompleted;
        private Instant computedAt;
    }
}
