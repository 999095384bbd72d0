package com.guno.salesintel.catalog;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Quality of one dataset as served by one source, every score in 0-1.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DatasetQuality {

    private double completeness;
    private double freshness;
    private double reliability;
    private double overall;

    public static DatasetQuality none() {
        return new DatasetQuality(0, 0, 0, 0);
    }
}
