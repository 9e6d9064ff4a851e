package com.dashboard.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Outcome of one background refresh cycle over every AC.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RefreshReport {
    
    private int succeeded;
    private int failed;
    private List<TenantResult> details;
    private long durationMs;
    
    public enum Outcome {
        SUCCESS,
        FAILED
    }
    
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TenantResult {
        private int acId;
        private Outcome outcome;
        private long totalMembers;
        private long durationMs;
        private String error;
    }
}
