package com.guno.salesintel.cache;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Key/value store behind the orchestrator. Implementations must tolerate concurrent access;
 * duplicate writes to the same key are acceptable.
 */
public interface CacheStore {

    /**
     * @return the entry, or {@code null} when absent or expired store-side
     */
    CacheEntry get(String key);

    void set(String key, CacheEntry entry, CacheType cacheType);

    /**
     * @return true if a value was removed
     */
    boolean delete(String key);

    /**
     * Raw JSON variant, bypassing the {@link CacheEntry} wrapper.
     */
    JsonNode getRawJson(String key);

    void setRawJson(String key, JsonNode value, CacheType cacheType);

    boolean healthCheck();
}
