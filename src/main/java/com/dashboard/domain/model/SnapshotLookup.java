package com.dashboard.domain.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Result of reading a precomputed snapshot against a caller-supplied max age.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SnapshotLookup {
    
    public enum Status {
        FRESH,
        STALE,
        MISSING
    }
    
    private final Status status;
    
    // Present for FRESH and STALE lookups
    private final StatsSnapshot snapshot;
    
    public static SnapshotLookup fresh(StatsSnapshot snapshot) {
        return new SnapshotLookup(Status.FRESH, snapshot);
    }
    
    public static SnapshotLookup stale(StatsSnapshot snapshot) {
        return new SnapshotLookup(Status.STALE, snapshot);
    }
    
    public static SnapshotLookup missing() {
        return new SnapshotLookup(Status.MISSING, null);
    }
    
    public boolean isFresh() {
        return status == Status.FRESH;
    }
}
