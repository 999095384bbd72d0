package com.guno.salesintel.catalog;

public enum CollectionPriority {
    HIGH,
    MEDIUM,
    LOW
}
