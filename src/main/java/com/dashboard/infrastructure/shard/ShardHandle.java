package com.dashboard.infrastructure.shard;

import lombok.Value;

/**
 * Binding of an AC to the physical table holding its voters.
 * 
 * Only {@link ShardRouter} creates handles; callers never assemble table names.
 */
@Value
public class ShardHandle {

    int acId;
    String tableName;
}
