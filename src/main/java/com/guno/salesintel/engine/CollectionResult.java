package com.guno.salesintel.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.guno.salesintel.catalog.SourceType;
import lombok.Builder;
import lombok.Value;

/**
 * What happened to one source. {@code cost} is non-zero only for data fetched from the API.
 */
@Value
@Builder
public class CollectionResult {

    SourceType source;
    JsonNode data;
    boolean success;
    long duration;
    double cost;
    boolean cached;
    SourceStatus status;
    String error;

    /** Age of the cached payload in ms, 0 for fresh API data. */
    long ageMs;

    static CollectionResult failed(CollectionTask task, long duration, String error) {
        return CollectionResult.builder()
                .source(task.getSource())
                .success(false)
                .duration(duration)
                .status(SourceStatus.FAILED)
                .error(error)
                .build();
    }
}
