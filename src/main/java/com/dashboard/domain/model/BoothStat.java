package com.dashboard.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-booth slice of an AC's statistics.
 * 
 * boothName is the first non-null name seen for the booth. avgAge is the
 * mean of the known ages, rounded to whole years; 0 when no age is known.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class BoothStat {
    
    private String boothId;
    private Integer boothNo;
    private String boothName;
    private long voterCount;
    
    // Demographics for booth reports
    private long surveyedVoters;
    private long maleVoters;
    private long femaleVoters;
    private long familyCount;
    private long verifiedVoters;
    private long avgAge;
    
    public BoothStat copy() {
        return toBuilder().build();
    }
}
