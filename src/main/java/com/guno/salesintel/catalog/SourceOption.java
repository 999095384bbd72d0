package com.guno.salesintel.catalog;

import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * One way of satisfying a dataset: a source with its cost and quality profile.
 */
@Value
@Builder
public class SourceOption {

    SourceType source;

    /** 1 = highest priority within the owning dataset. */
    int priority;

    double cost;

    /** 0-1 reliability score. */
    double reliability;

    FreshnessNeed freshnessNeeded;

    ExtractionComplexity extractionComplexity;

    int typicalTtlHours;

    /** Rank by ascending cost per quality within the dataset, 1 = first fallback. */
    @With
    int fallbackPriority;

    public CostTier getCostTier() {
        return CostTier.forCost(cost);
    }

    public double getCostPerQuality() {
        return reliability > 0 ? cost / reliability : Double.MAX_VALUE;
    }
}
