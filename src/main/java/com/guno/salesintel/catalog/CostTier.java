package com.guno.salesintel.catalog;

/**
 * Coarse cost bucket, TIER_1 cheapest.
 */
public enum CostTier {
    TIER_1,
    TIER_2,
    TIER_3;

    public static CostTier forCost(double cost) {
        if (cost <= 0.02) {
            return TIER_1;
        }
        if (cost <= 0.08) {
            return TIER_2;
        }
        return TIER_3;
    }
}
