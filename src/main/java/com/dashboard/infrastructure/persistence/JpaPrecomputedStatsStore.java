package com.dashboard.infrastructure.persistence;

import com.dashboard.domain.exception.PersistenceFailureException;
import com.dashboard.domain.model.BoothStat;
import com.dashboard.domain.model.SnapshotLookup;
import com.dashboard.domain.model.StatsSnapshot;
import com.dashboard.infrastructure.persistence.entity.PrecomputedStatsEntity;
import com.dashboard.infrastructure.persistence.repository.PrecomputedStatsRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Precomputed snapshots in the precomputed_stats table.
 * 
 * Why a table and not Redis?
 * - Survives restarts, so a cold process serves snapshots immediately
 * - Shared by every instance behind the load balancer
 * - One row read per dashboard request
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JpaPrecomputedStatsStore implements PrecomputedStatsStore {
    
    private static final TypeReference<List<BoothStat>> BOOTH_STATS = new TypeReference<>() {};
    
    private final PrecomputedStatsRepository repository;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    
    @Override
    public SnapshotLookup get(int acId, Duration maxAge) {
        Optional<PrecomputedStatsEntity> row;
        try {
            row = repository.findById(acId);
        } catch (DataAccessException e) {
            throw new PersistenceFailureException("Failed to read snapshot for AC " + acId, e);
        }
        
        if (row.isEmpty()) {
            log.debug("No precomputed snapshot for AC {}", acId);
            return SnapshotLookup.missing();
        }
        
        StatsSnapshot snapshot = toSnapshot(row.get());
        if (snapshot.isStaleAt(clock.instant(), maxAge)) {
            log.debug("Precomputed snapshot for AC {} is stale (computed at {})", acId, snapshot.getComputedAt());
            return SnapshotLookup.stale(snapshot);
        }
        return SnapshotLookup.fresh(snapshot);
    }
    
    @Override
    public void save(StatsSnapshot snapshot) {
        try {
            PrecomputedStatsEntity entity = PrecomputedStatsEntity.builder()
                    .acId(snapshot.getAcId())
                    .acName(snapshot.getAcName())
                    .totalMembers(snapshot.getTotalMembers())
                    .totalFamilies(snapshot.getTotalFamilies())
                    .totalBooths(snapshot.getTotalBooths())
                    .surveysCompleted(snapshot.getSurveysCompleted())
                    .boothStats(objectMapper.writeValueAsString(snapshot.getBoothStats()))
                    .computedAt(snapshot.getComputedAt())
                    .computeDurationMs(snapshot.getComputeDurationMs())
                    .updatedAt(clock.instant())
                    .build();
            
            int updated = repository.upsert(entity);
            
            if (updated == 0) {
                log.info("Ignored snapshot for AC {} computed at {}: a newer one is already stored",
                        snapshot.getAcId(), snapshot.getComputedAt());
            } else {
                log.debug("Saved snapshot for AC {} computed at {}", snapshot.getAcId(), snapshot.getComputedAt());
            }
            
        } catch (JsonProcessingException | DataAccessException e) {
            throw new PersistenceFailureException("Failed to save snapshot for AC " + snapshot.getAcId(), e);
        }
    }
    
    @Override
    public List<StatsSnapshot> getAll() {
        try {
            return repository.findAll().stream()
                    .map(this::toSnapshot)
                    .toList();
        } catch (DataAccessException e) {
            throw new PersistenceFailureException("Failed to read snapshots", e);
        }
    }
    
    private StatsSnapshot toSnapshot(PrecomputedStatsEntity entity) {
        List<BoothStat> boothStats;
        try {
            boothStats = objectMapper.readValue(entity.getBoothStats(), BOOTH_STATS);
        } catch (JsonProcessingException e) {
            throw new PersistenceFailureException("Corrupt booth stats for AC " + entity.getAcId(), e);
        }
        
        return StatsSnapshot.builder()
                .acId(entity.getAcId())
                .acName(entity.getAcName())
                .totalMembers(entity.getTotalMembers())
                .totalFamilies(entity.getTotalFamilies())
                .totalBooths(entity.getTotalBooths())
                .surveysCompleted(entity.getSurveysCompleted())
                .boothStats(boothStats)
                .computedAt(entity.getComputedAt())
                .computeDurationMs(entity.getComputeDurationMs())
                .build();
    }
}
