package com.dashboard.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One row per AC holding its latest precomputed dashboard statistics.
 * 
 * Booth stats are kept as a JSON document so the whole snapshot is a
 * single row and can be replaced in one statement.
 */
@Entity
@Table(name = "precomputed_stats", indexes = {
    @Index(name = "idx_precomputed_computed_at", columnList = "computedAt")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PrecomputedStatsEntity {
    
    @Id
    private Integer acId;
    
    @Column(length = 200)
    private String acName;
    
    @Column(nullable = false)
    private long totalMembers;
    
    @Column(nullable = false)
    private long totalFamilies;
    
    @Column(nullable = false)
    private long totalBooths;
    
    @Column(nullable = false)
    private long surveysCompleted;
    
    @Column(nullable = false, columnDefinition = "TEXT")
    private String boothStats;
    
    @Column(nullable = false)
    private Instant computedAt;
    
    @Column
    private long computeDurationMs;
    
    @Column(nullable = false)
    private Instant updatedAt;
}
