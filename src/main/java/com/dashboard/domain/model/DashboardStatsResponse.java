package com.dashboard.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Response model for AC dashboard statistics.
 * 
 * source tells the caller which layer answered: cache, precomputed or realtime.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class DashboardStatsResponse {
    
    private int acId;
    private String acName;
    private long totalFamilies;
    private long totalMembers;
    private long surveysCompleted;
    private long totalBooths;
    private List<BoothStat> boothStats;
    private StatsSource source;
    private Instant computedAt;
    
    public static DashboardStatsResponse from(StatsSnapshot snapshot, StatsSource source) {
        return DashboardStatsResponse.builder()
                .acId(snapshot.getAcId())
                .acName(snapshot.getAcName())
                .totalFamilies(snapshot.getTotalFamilies())
                .totalMembers(snapshot.getTotalMembers())
                .surveysCompleted(snapshot.getSurveysCompleted())
                .totalBooths(snapshot.getTotalBooths())
                .boothStats(copyOf(snapshot.getBoothStats()))
                .source(source)
                .computedAt(snapshot.getComputedAt())
                .build();
    }
    
    /**
     * Copy that shares no mutable state with this response, booths included.
     */
    public DashboardStatsResponse copy() {
        return toBuilder()
                .boothStats(copyOf(boothStats))
                .build();
    }
    
    private static List<BoothStat> copyOf(List<BoothStat> booths) {
        if (booths == null) {
            return List.of();
        }
        return booths.stream().map(BoothStat::copy).toList();
    }
}
