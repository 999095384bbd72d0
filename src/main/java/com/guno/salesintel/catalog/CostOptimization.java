package com.guno.salesintel.catalog;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class CostOptimization {
    double maxCostPerDataset;
    CostTier preferredTier;
    FallbackStrategy fallbackStrategy;
}
