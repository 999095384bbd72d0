package com.guno.salesintel.catalog;

/**
 * What to do when a dataset's preferred source cannot be used.
 */
public enum FallbackStrategy {
    /** Try the next option in priority order. */
    NEXT_PRIORITY,
    /** Try the option with the lowest cost per quality point. */
    CHEAPEST,
    /** Leave the dataset uncollected. */
    SKIP
}
