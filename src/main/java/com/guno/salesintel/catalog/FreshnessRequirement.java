package com.guno.salesintel.catalog;

public enum FreshnessRequirement {
    REAL_TIME,
    DAILY,
    WEEKLY,
    MONTHLY
}
