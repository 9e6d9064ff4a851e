package com.dashboard.infrastructure.persistence.repository;

/**
 * Record filters supported by {@link VoterShardRepository#count}.
 */
public enum VoterFilter {
    ALL,
    /** Voters who completed at least one survey. */
    SURVEYED
}
