package com.dashboard.infrastructure.shard;

import com.dashboard.domain.exception.UnknownTenantException;

/**
 * Resolves an AC id to its voter partition.
 * 
 * One implementation per storage backend.
 */
public interface ShardRouter {

    /**
     * Same AC id, same handle, for the lifetime of the process.
     *
     * @throws UnknownTenantException if the AC is not configured
     */
    ShardHandle resolve(int acId);
}
