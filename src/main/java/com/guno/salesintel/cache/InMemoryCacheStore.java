package com.guno.salesintel.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local {@link CacheStore}. Values are kept as JSON trees and expire after the
 * cache type's default TTL.
 */
@Slf4j
@RequiredArgsConstructor
public class InMemoryCacheStore implements CacheStore {

    private final Map<String, StoredValue> values = new ConcurrentHashMap<>();
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    public CacheEntry get(String key) {
        JsonNode json = getRawJson(key);
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.treeToValue(json, CacheEntry.class);
        } catch (Exception e) {
            log.warn("Corrupt cache entry for key {} - dropping: {}", key, e.getMessage());
            values.remove(key);
            return null;
        }
    }

    @Override
    public void set(String key, CacheEntry entry, CacheType cacheType) {
        setRawJson(key, objectMapper.valueToTree(entry), cacheType);
    }

    @Override
    public boolean delete(String key) {
        return values.remove(key) != null;
    }

    @Override
    public JsonNode getRawJson(String key) {
        StoredValue stored = values.get(key);
        if (stored == null) {
            return null;
        }
        if (stored.getExpiresAt() <= clock.millis()) {
            log.debug("Cache entry {} expired - evicting", key);
            values.remove(key, stored);
            return null;
        }
        return stored.getValue().deepCopy();
    }

    @Override
    public void setRawJson(String key, JsonNode value, CacheType cacheType) {
        CacheType type = cacheType != null ? cacheType : CacheType.UNKNOWN;
        long expiresAt = clock.millis() + type.getDefaultTtlHours() * 3_600_000L;
        values.put(key, new StoredValue(value.deepCopy(), expiresAt));
    }

    @Override
    public boolean healthCheck() {
        return true;
    }

    public int size() {
        return values.size();
    }

    @Value
    private static class StoredValue {
        JsonNode value;
        long expiresAt;
    }
}
