package com.dashboard.infrastructure.persistence.repository;

import com.dashboard.domain.exception.ShardUnavailableException;
import com.dashboard.domain.model.BoothStat;
import com.dashboard.infrastructure.shard.ShardHandle;

import java.util.List;

/**
 * Read access to one AC's voter partition.
 * 
 * Every method may throw {@link ShardUnavailableException} when the
 * partition cannot be reached.
 */
public interface VoterShardRepository {
    
    long count(ShardHandle shard, VoterFilter filter);
    
    /**
     * Number of distinct non-null, non-empty values of the field.
     */
    long countDistinct(ShardHandle shard, VoterField field);
    
    /**
     * One row per non-empty booth id. Order is not guaranteed.
     */
    List<BoothStat> boothBreakdown(ShardHandle shard);
}
