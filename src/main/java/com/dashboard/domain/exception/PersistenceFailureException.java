package com.dashboard.domain.exception;

/**
 * Reading or writing the precomputed snapshot store failed.
 */
public class PersistenceFailureException extends DashboardStatsException {

    public PersistenceFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
