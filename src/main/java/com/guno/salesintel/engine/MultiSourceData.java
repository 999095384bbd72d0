package com.guno.salesintel.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.guno.salesintel.catalog.ConsumerType;
import com.guno.salesintel.catalog.SourceType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Merged result of one collection run: per-source payloads from cache and API, cost and cache
 * counters, quality, and an explicit outcome per planned source.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MultiSourceData {

    private String companyName;
    private ConsumerType requester;

    @Builder.Default
    private Map<SourceType, JsonNode> payloads = new EnumMap<>(SourceType.class);

    @Builder.Default
    private Map<SourceType, SourceStatus> sourceStatus = new EnumMap<>(SourceType.class);

    private double totalNewCost;
    private double totalCacheSavings;
    private int cacheHits;
    private int newApiCalls;

    @Builder.Default
    private Map<ConsumerType, Double> costsAttribution = new EnumMap<>(ConsumerType.class);

    private long collectionDuration;

    @Builder.Default
    private DataQualityScores dataQuality = DataQualityScores.empty();

    private CollectionSummary summary;

    @Builder.Default
    private List<CollectionResult> results = new ArrayList<>();

    // Convenience methods
    public JsonNode get(SourceType source) {
        return payloads.get(source);
    }

    public boolean has(SourceType source) {
        return payloads.containsKey(source);
    }

    public SourceStatus statusOf(SourceType source) {
        return sourceStatus.get(source);
    }

    public int getContributingSources() {
        return payloads.size();
    }

    public JsonNode getOrganic() {
        return get(SourceType.SERP_ORGANIC);
    }

    public JsonNode getNews() {
        return get(SourceType.SERP_NEWS);
    }

    public JsonNode getJobs() {
        return get(SourceType.SERP_JOBS);
    }

    public JsonNode getLinkedin() {
        return get(SourceType.SERP_LINKEDIN);
    }

    public JsonNode getYoutube() {
        return get(SourceType.SERP_YOUTUBE);
    }

    public JsonNode getBrightdata() {
        return get(SourceType.BRIGHTDATA);
    }
}
