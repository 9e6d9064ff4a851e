package com.dashboard.domain.exception;

import lombok.Getter;

/**
 * The AC's voter partition could not be reached. Transient; results are never cached.
 */
@Getter
public class ShardUnavailableException extends DashboardStatsException {

    private final int acId;

    public ShardUnavailableException(int acId, String message, Throwable cause) {
        super("Shard for AC " + acId + " unavailable: " + message, cause);
        this.acId = acId;
    }
}
