package com.dashboard.infrastructure.persistence;

import com.dashboard.domain.exception.PersistenceFailureException;
import com.dashboard.domain.model.SnapshotLookup;
import com.dashboard.domain.model.StatsSnapshot;

import java.time.Duration;
import java.util.List;

/**
 * Durable store of the latest statistics snapshot per AC.
 */
public interface PrecomputedStatsStore {
    
    /**
     * Reads the AC's snapshot and classifies it against maxAge.
     *
     * @throws PersistenceFailureException if the store cannot be read
     */
    SnapshotLookup get(int acId, Duration maxAge);
    
    /**
     * Replaces the AC's snapshot as a whole. Readers never observe a partial write.
     * A snapshot computed earlier than the stored one is ignored.
     *
     * @throws PersistenceFailureException if the write fails
     */
    void save(StatsSnapshot snapshot);
    
    /**
     * Latest snapshot of every AC that has one. Empty store gives an empty list.
     */
    List<StatsSnapshot> getAll();
}
