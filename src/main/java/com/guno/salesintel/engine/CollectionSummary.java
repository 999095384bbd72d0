package com.guno.salesintel.engine;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class CollectionSummary {
    int totalTasks;
    int successfulTasks;
    int failedTasks;
    /** Sum of costs of sources fetched from the API; cache hits are free. */
    double totalCost;
    long totalDuration;
    double cacheHitRate;
    /** 0-100, mean over successful sources. */
    int qualityScore;
}
