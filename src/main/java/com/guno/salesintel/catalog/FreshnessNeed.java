package com.guno.salesintel.catalog;

public enum FreshnessNeed {
    HIGH,
    MEDIUM,
    LOW
}
