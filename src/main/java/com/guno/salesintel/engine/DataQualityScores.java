package com.guno.salesintel.engine;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Aggregate quality of a collection, every score in 0-1.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DataQualityScores {
    private double completeness;
    private double freshness;
    private double reliability;

    public static DataQualityScores empty() {
        return new DataQualityScores(0, 0, 0);
    }
}
