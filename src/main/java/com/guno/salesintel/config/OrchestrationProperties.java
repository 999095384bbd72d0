package com.guno.salesintel.config;

import com.guno.salesintel.cache.CacheType;
import com.guno.salesintel.catalog.ConsumerType;
import com.guno.salesintel.catalog.SourceType;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static com.guno.salesintel.catalog.SourceType.*;

/**
 * Orchestration Configuration - budgets, pacing, retry policy and the source table
 *
 * Usage in application.yml:
 * orchestration:
 *   max-parallel-sources: 5
 *   batch-pacing-ms: 500
 *   consumers:
 *     profile:
 *       budget: 2.0
 *
 * Defaults live here so components can be built with {@code new OrchestrationProperties()}.
 */
@Configuration
@ConfigurationProperties(prefix = "orchestration")
@Data
public class OrchestrationProperties {

    private int maxParallelSources = 5;
    private int retryAttempts = 2;
    private long retryBaseDelayMs = 1000;
    private long batchPacingMs = 500;
    private boolean cacheEnabled = true;
    private boolean redundancyOptimizationEnabled = true;
    private int freshStatusHours = 24;
    private int vendorContextTtlHours = 168;

    // Used for any source missing from the table
    private double fallbackCost = 1.00;
    private long fallbackDurationMs = 3000;
    private int fallbackReliability = 70;

    private Map<SourceType, SourceProfile> sources = defaultSources();
    private Map<ConsumerType, ConsumerSettings> consumers = defaultConsumers();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SourceProfile {
        private double cost;
        private long durationMs;
        /** 0-100 */
        private int reliability;
        /** Higher is collected first. */
        private int priority;
        private CacheType cacheType = CacheType.UNKNOWN;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ConsumerSettings {
        private double budget;
        private int cacheTtlHours;
        private double qualityTarget;
        /** Empty means the default set is derived from the consumer's datasets. */
        private List<SourceType> defaultSources = new ArrayList<>();
    }

    // Convenience methods
    public ConsumerSettings consumer(ConsumerType consumerType) {
        ConsumerSettings settings = consumers.get(consumerType);
        return settings != null ? settings : consumers.get(ConsumerType.TEST);
    }

    public double budgetFor(ConsumerType consumerType) {
        return consumer(consumerType).getBudget();
    }

    public int cacheTtlHoursFor(ConsumerType consumerType) {
        return consumer(consumerType).getCacheTtlHours();
    }

    private static Map<SourceType, SourceProfile> defaultSources() {
        Map<SourceType, SourceProfile> table = new EnumMap<>(SourceType.class);
        table.put(SERP_ORGANIC, new SourceProfile(0.05, 2000, 85, 9, CacheType.SERP_ORGANIC_RAW));
        table.put(SERP_LINKEDIN, new SourceProfile(0.08, 2500, 90, 8, CacheType.SERP_LINKEDIN_RAW));
        table.put(SERP_NEWS, new SourceProfile(0.05, 2000, 75, 7, CacheType.SERP_NEWS_RAW));
        table.put(SERP_JOBS, new SourceProfile(0.05, 2000, 70, 6, CacheType.SERP_JOBS_RAW));
        table.put(SERP_YOUTUBE, new SourceProfile(0.05, 2000, 60, 5, CacheType.SERP_YOUTUBE_RAW));
        table.put(BRIGHTDATA, new SourceProfile(0.15, 4000, 88, 4, CacheType.BRIGHTDATA_COMPANY_ENRICHMENT));
        table.put(SNOV_CONTACTS, new SourceProfile(0.12, 3000, 80, 3, CacheType.SNOV_CONTACTS_RAW));
        table.put(APOLLO_CONTACTS, new SourceProfile(0.10, 3000, 85, 2, CacheType.APOLLO_CONTACT_ENRICHMENT));
        table.put(ZOOMINFO, new SourceProfile(0.20, 4000, 88, 2, CacheType.ZOOMINFO_CONTACT_ENRICHMENT));
        table.put(CLEARBIT, new SourceProfile(0.18, 3000, 80, 2, CacheType.CLEARBIT_COMPANY_ENRICHMENT));
        table.put(HUNTER, new SourceProfile(0.08, 2500, 78, 1, CacheType.HUNTER_EMAIL_ENRICHMENT));
        table.put(COMPANY_DB, new SourceProfile(0.05, 1500, 75, 1, CacheType.COMPANY_DATABASE_ENRICHMENT));
        return table;
    }

    private static Map<ConsumerType, ConsumerSettings> defaultConsumers() {
        Map<ConsumerType, ConsumerSettings> table = new EnumMap<>(ConsumerType.class);
        table.put(ConsumerType.PROFILE, new ConsumerSettings(2.00, 168, 0.70,
                new ArrayList<>(List.of(SERP_ORGANIC, SERP_NEWS, BRIGHTDATA))));
        table.put(ConsumerType.VENDOR_CONTEXT, new ConsumerSettings(5.00, 72, 0.80,
                new ArrayList<>(List.of(SERP_ORGANIC, SERP_NEWS, APOLLO_CONTACTS))));
        table.put(ConsumerType.CUSTOMER_INTELLIGENCE, new ConsumerSettings(7.00, 24, 0.85,
                new ArrayList<>(List.of(SERP_ORGANIC, SERP_NEWS, SERP_JOBS, SERP_LINKEDIN, BRIGHTDATA, SNOV_CONTACTS))));
        table.put(ConsumerType.TEST, new ConsumerSettings(1.00, 1, 0.60,
                new ArrayList<>(List.of(SERP_ORGANIC, SERP_NEWS))));
        table.put(ConsumerType.RESEARCH, new ConsumerSettings(3.00, 24, 0.80, new ArrayList<>()));
        return table;
    }
}
