package com.dashboard.infrastructure.persistence.repository;

/**
 * Grouping keys supported by {@link VoterShardRepository#countDistinct}.
 */
public enum VoterField {
    FAMILY_ID("family_id"),
    BOOTH_ID("booth_id");
    
    private final String column;
    
    VoterField(String column) {
        this.column = column;
    }
    
    public String getColumn() {
        return column;
    }
}
