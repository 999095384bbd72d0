package com.guno.salesintel.engine;

/**
 * Outcome of one source within a collection run.
 */
public enum SourceStatus {
    /** Served from a cache entry within the consumer's maximum age. */
    CACHED,
    /** Fetched from the source API and written back to cache. */
    COLLECTED,
    /** The API answered but had nothing for this company. */
    EMPTY,
    /** Every attempt failed, or no collector is registered. */
    FAILED;

    public boolean hasData() {
        return this == CACHED || this == COLLECTED;
    }
}
