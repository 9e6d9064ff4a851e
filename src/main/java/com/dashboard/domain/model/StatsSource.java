package com.dashboard.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Where a dashboard response was served from.
 */
public enum StatsSource {
    CACHE("cache"),
    PRECOMPUTED("precomputed"),
    REALTIME("realtime");
    
    private final String value;
    
    StatsSource(String value) {
        this.value = value;
    }
    
    @JsonValue
    public String getValue() {
        return value;
    }
}
