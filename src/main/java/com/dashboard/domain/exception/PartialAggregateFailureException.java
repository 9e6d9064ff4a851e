package com.dashboard.domain.exception;

import lombok.Getter;

/**
 * One of the sub-aggregates of a stats computation failed, so the whole computation did.
 */
@Getter
public class PartialAggregateFailureException extends DashboardStatsException {

    private final int acId;
    private final String aggregate;

    public PartialAggregateFailureException(int acId, String aggregate, Throwable cause) {
        super("Aggregate '" + aggregate + "' failed for AC " + acId + ": " + cause.getMessage(), cause);
        this.acId = acId;
        this.aggregate = aggregate;
    }
}
