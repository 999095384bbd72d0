package com.guno.salesintel.collector;

import com.fasterxml.jackson.databind.JsonNode;
import com.guno.salesintel.catalog.SourceType;

/**
 * Fetches the raw payload of one source for one company. Implementations are idempotent and
 * have no side effect beyond the outbound call.
 */
public interface SourceCollector {

    SourceType source();

    /**
     * @return the raw payload, or {@code null} when the source has nothing for this company
     * @throws com.guno.salesintel.exception.SourceUnavailableException when the call fails
     */
    JsonNode collect(String companyName);

    /**
     * Cheap readiness check. Must not issue a paid call.
     */
    default boolean isAvailable() {
        return true;
    }
}
