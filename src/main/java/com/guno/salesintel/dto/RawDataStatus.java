package com.guno.salesintel.dto;

import com.guno.salesintel.catalog.SourceType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.EnumMap;
import java.util.Map;

/**
 * Which sources already have usable cached data for a company. Built without any paid call.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RawDataStatus {

    private String companyName;

    @Builder.Default
    private Map<SourceType, SourceCacheStatus> sources = new EnumMap<>(SourceType.class);

    /** Share of checked sources with a fresh entry, 0-1. */
    private double overallAvailability;

    private int freshWindowHours;
    private long lastChecked;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SourceCacheStatus {
        private SourceType source;
        private boolean cached;
        private boolean fresh;
        /** {@code null} when nothing is cached. */
        private Long ageMs;
        /** What a fresh call would cost. */
        private double cost;
        private String cacheKey;
    }

    public boolean isAvailable(SourceType source) {
        SourceCacheStatus status = sources.get(source);
        return status != null && status.isFresh();
    }
}
