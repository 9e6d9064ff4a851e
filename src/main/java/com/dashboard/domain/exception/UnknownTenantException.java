package com.dashboard.domain.exception;

import lombok.Getter;

/**
 * AC id outside the configured set. Never retried.
 */
@Getter
public class UnknownTenantException extends DashboardStatsException {

    private final int acId;

    public UnknownTenantException(int acId) {
        super("Unknown AC: " + acId);
        this.acId = acId;
    }
}
