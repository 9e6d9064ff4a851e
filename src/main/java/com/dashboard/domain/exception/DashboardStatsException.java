package com.dashboard.domain.exception;

/**
 * Base type for failures on the dashboard statistics path.
 */
public abstract class DashboardStatsException extends RuntimeException {

    protected DashboardStatsException(String message) {
        super(message);
    }

    protected DashboardStatsException(String message, Throwable cause) {
        super(message, cause);
    }
}
