package com.guno.salesintel.service;

import com.guno.salesintel.cache.CacheEntry;
import com.guno.salesintel.cache.CacheStore;
import com.guno.salesintel.catalog.ConsumerType;
import com.guno.salesintel.catalog.DatasetCatalog;
import com.guno.salesintel.catalog.DatasetQuality;
import com.guno.salesintel.catalog.DatasetType;
import com.guno.salesintel.catalog.ResearchArea;
import com.guno.salesintel.catalog.SourceOption;
import com.guno.salesintel.catalog.SourceType;
import com.guno.salesintel.collector.SourceCollector;
import com.guno.salesintel.collector.SourceCollectorRegistry;
import com.guno.salesintel.config.OrchestrationProperties;
import com.guno.salesintel.core.OrchestrationCore;
import com.guno.salesintel.dto.CollectionMetrics;
import com.guno.salesintel.dto.CustomerIntelligenceRequest;
import com.guno.salesintel.dto.CustomerIntelligenceResponse;
import com.guno.salesintel.dto.OrchestrationHealth;
import com.guno.salesintel.dto.RawDataStatus;
import com.guno.salesintel.dto.RawDataStatus.SourceCacheStatus;
import com.guno.salesintel.dto.SourceAvailability;
import com.guno.salesintel.engine.CollectionResult;
import com.guno.salesintel.engine.DataCollectionEngine;
import com.guno.salesintel.engine.MultiSourceData;
import com.guno.salesintel.engine.SourceStatus;
import com.guno.salesintel.exception.OrchestrationException;
import com.guno.salesintel.planner.CollectionPlanner;
import com.guno.salesintel.planner.ContextAwareCollectionPlan;
import com.guno.salesintel.planner.DataCollectionPlan;
import com.guno.salesintel.planner.VendorContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * DataSourceOrchestrator - entry point for every collection request
 *
 * Composes {@link CollectionPlanner} and {@link DataCollectionEngine} and owns the consumer
 * defaults. Only a budget violation is raised to callers; everything else degrades into a
 * lower-completeness result.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DataSourceOrchestrator {

    static final int LOW_QUALITY_THRESHOLD = 70;
    static final long SLOW_SOURCE_MS = 5000;
    private static final List<SourceType> STATUS_SOURCES =
            List.of(SourceType.SERP_ORGANIC, SourceType.BRIGHTDATA, SourceType.APOLLO_CONTACTS);

    private final CollectionPlanner planner;
    private final DataCollectionEngine engine;
    private final OrchestrationCore core;
    private final OrchestrationProperties properties;
    private final DatasetCatalog catalog;
    private final CacheStore cacheStore;
    private final SourceCollectorRegistry collectorRegistry;
    private final VendorContextResolver vendorContextResolver;

    // ================================
    // PUBLIC API
    // ================================

    public MultiSourceData getMultiSourceData(String companyName, ConsumerType consumerType) {
        return getMultiSourceData(companyName, consumerType, null, null);
    }

    /**
     * @param maxCost         {@code null} for the consumer's default budget
     * @param requiredSources {@code null} for the consumer's default sources
     */
    public MultiSourceData getMultiSourceData(String companyName, ConsumerType consumerType,
                                              Double maxCost, List<SourceType> requiredSources) {
        OrchestrationCore.normalizeCompanyName(companyName);
        DataCollectionPlan plan = planner.createCollectionPlan(companyName, consumerType, maxCost, requiredSources);
        return engine.executeParallelCollection(plan);
    }

    public DataCollectionPlan createCollectionPlan(String companyName, ConsumerType consumerType,
                                                   Double maxCost, List<SourceType> requiredSources) {
        OrchestrationCore.normalizeCompanyName(companyName);
        return planner.createCollectionPlan(companyName, consumerType, maxCost, requiredSources);
    }

    /**
     * Collection for one research area; unknown areas fall back to the company overview.
     */
    public MultiSourceData getResearchData(String companyName, String researchArea, Double maxCost) {
        OrchestrationCore.normalizeCompanyName(companyName);
        ResearchArea area = ResearchArea.fromId(researchArea);
        log.info("Research collection for '{}' - area: {}", companyName, area.getId());
        DataCollectionPlan plan = planner.createResearchPlan(companyName, area, maxCost);
        return engine.executeParallelCollection(plan);
    }

    /**
     * Customer intelligence steered by the vendor's own context.
     */
    public CustomerIntelligenceResponse getCustomerIntelligence(CustomerIntelligenceRequest request) {
        validate(request);
        String customerCompany = request.getCustomerCompany();
        String vendorCompany = request.getVendorCompany();
        ConsumerType consumerType = request.getConsumerType() != null
                ? request.getConsumerType() : ConsumerType.CUSTOMER_INTELLIGENCE;

        log.info("🚀 Starting customer intelligence for '{}' (vendor: '{}', consumer: {}, urgency: {})",
                customerCompany, vendorCompany, consumerType, request.getUrgency());

        VendorContext vendorContext = vendorContextResolver.resolve(vendorCompany);

        ContextAwareCollectionPlan plan = planner.createContextAwareCollectionPlan(
                customerCompany, consumerType, request.getMaxCost(), vendorContext,
                request.getRequiredSources(), request.getRequiredDatasets());

        MultiSourceData data = engine.executeParallelCollection(plan.getPlan());

        int qualityScore = qualityScore(data, plan.getPlan());
        List<String> recommendations = generateRecommendations(data, vendorContext, qualityScore);

        log.info("✅ Customer intelligence completed for '{}' - quality: {}, sources: {}/{}",
                customerCompany, qualityScore, data.getContributingSources(), plan.getPlan().getToCollect().size());

        return CustomerIntelligenceResponse.builder()
                .plan(plan)
                .data(data)
                .metrics(CollectionMetrics.from(data))
                .vendorContext(vendorContext)
                .qualityScore(qualityScore)
                .recommendations(recommendations)
                .datasetQuality(datasetQuality(plan.getPlan(), data))
                .build();
    }

    // ================================
    // STATUS & MAINTENANCE
    // ================================

    /**
     * Cache-only view per source: no collector is called.
     */
    public RawDataStatus getRawDataStatus(String companyName, List<SourceType> sources) {
        OrchestrationCore.normalizeCompanyName(companyName);
        List<SourceType> checkSources = sources != null && !sources.isEmpty() ? sources : STATUS_SOURCES;
        int freshHours = properties.getFreshStatusHours();
        Map<SourceType, SourceCacheStatus> statuses = new EnumMap<>(SourceType.class);

        for (SourceType source : checkSources) {
            String cacheKey = core.cacheKey(source, companyName);
            CacheEntry entry = null;
            try {
                entry = cacheStore.get(cacheKey);
            } catch (Exception e) {
                log.warn("Cache read failed while checking {} for '{}': {}", source, companyName, e.getMessage());
            }

            boolean cached = entry != null && entry.hasData();
            statuses.put(source, SourceCacheStatus.builder()
                    .source(source)
                    .cached(cached)
                    .fresh(cached && !core.isExpired(entry, freshHours))
                    .ageMs(cached && entry.getTimestamp() != null ? core.ageMs(entry) : null)
                    .cost(core.costOf(source))
                    .cacheKey(cacheKey)
                    .build());
        }

        long available = statuses.values().stream().filter(SourceCacheStatus::isFresh).count();

        return RawDataStatus.builder()
                .companyName(companyName)
                .sources(statuses)
                .overallAvailability(statuses.isEmpty() ? 0 : (double) available / statuses.size())
                .freshWindowHours(freshHours)
                .lastChecked(core.now())
                .build();
    }

    /**
     * Cache and collector readiness. No paid call is made.
     */
    public OrchestrationHealth checkOrchestrationHealth() {
        boolean cacheHealthy;
        try {
            cacheHealthy = cacheStore.healthCheck();
        } catch (Exception e) {
            log.warn("Cache health check failed: {}", e.getMessage());
            cacheHealthy = false;
        }

        List<SourceAvailability> sources = new ArrayList<>();
        for (SourceType source : properties.getSources().keySet()) {
            sources.add(checkSourceAvailability(source));
        }

        int available = (int) sources.stream().filter(SourceAvailability::isAvailable).count();
        double ratio = sources.isEmpty() ? 0 : (double) available / sources.size();

        OrchestrationHealth.Status status;
        if (ratio >= 0.8) {
            status = OrchestrationHealth.Status.HEALTHY;
        } else if (ratio >= 0.5) {
            status = OrchestrationHealth.Status.DEGRADED;
        } else {
            status = OrchestrationHealth.Status.UNHEALTHY;
        }

        log.info("Orchestration health: {} - {}/{} sources available, cache: {}",
                status, available, sources.size(), cacheHealthy ? "up" : "down");

        return OrchestrationHealth.builder()
                .status(status)
                .cacheHealthy(cacheHealthy)
                .availableSources(available)
                .totalSources(sources.size())
                .sources(sources)
                .recommendations(healthRecommendations(sources, cacheHealthy))
                .lastCheck(core.now())
                .build();
    }

    /**
     * Drops cached payloads of a company.
     *
     * @param sources {@code null} or empty for every source
     * @return number of entries removed
     */
    public int invalidate(String companyName, List<SourceType> sources) {
        OrchestrationCore.normalizeCompanyName(companyName);
        List<SourceType> targets = sources != null && !sources.isEmpty() ? sources : Arrays.asList(SourceType.values());
        int removed = 0;
        for (SourceType source : targets) {
            try {
                if (cacheStore.delete(core.cacheKey(source, companyName))) {
                    removed++;
                }
            } catch (Exception e) {
                log.warn("Failed to invalidate {} for '{}': {}", source, companyName, e.getMessage());
            }
        }
        log.info("Invalidated {} cache entries for '{}'", removed, companyName);
        return removed;
    }

    // ================================
    // HELPERS
    // ================================

    private void validate(CustomerIntelligenceRequest request) {
        if (request == null || request.getCustomerCompany() == null || request.getCustomerCompany().isBlank()) {
            throw new OrchestrationException("INVALID_REQUEST", "customerCompany is required");
        }
        if (request.getVendorCompany() == null || request.getVendorCompany().isBlank()) {
            throw new OrchestrationException("INVALID_REQUEST", "vendorCompany is required");
        }
        OrchestrationCore.normalizeCompanyName(request.getCustomerCompany());
        OrchestrationCore.normalizeCompanyName(request.getVendorCompany());
    }

    /**
     * Reliability of the first contributing source in plan order, +5 with more than one source.
     */
    int qualityScore(MultiSourceData data, DataCollectionPlan plan) {
        Optional<SourceType> primary = plan.getToCollect().stream().filter(data::has).findFirst();
        return primary.map(source -> core.dataQualityScore(data.getContributingSources(), source)).orElse(0);
    }

    List<String> generateRecommendations(MultiSourceData data, VendorContext vendorContext, int qualityScore) {
        List<String> recommendations = new ArrayList<>();

        if (qualityScore < LOW_QUALITY_THRESHOLD) {
            recommendations.add("Consider collecting additional data sources to improve data quality");
        }
        if (!data.has(SourceType.SERP_ORGANIC)) {
            recommendations.add("Organic search data unavailable - consider using alternative sources");
        }
        if (!vendorContext.hasCompetitors()) {
            recommendations.add("Enhance vendor context with competitive analysis");
        }

        long failed = data.getSourceStatus().values().stream().filter(s -> s == SourceStatus.FAILED).count();
        if (failed > 0) {
            recommendations.add(failed + " sources failed - retry later or plan fallback sources");
        }
        return recommendations;
    }

    /**
     * Best quality per dataset across the sources that returned data.
     */
    private Map<DatasetType, DatasetQuality> datasetQuality(DataCollectionPlan plan, MultiSourceData data) {
        Map<SourceType, Long> ages = new EnumMap<>(SourceType.class);
        for (CollectionResult result : data.getResults()) {
            if (result.isSuccess()) {
                ages.put(result.getSource(), result.getAgeMs());
            }
        }

        Map<DatasetType, DatasetQuality> qualities = new LinkedHashMap<>();
        for (DatasetType dataset : plan.getDatasets()) {
            DatasetQuality best = DatasetQuality.none();
            for (SourceOption option : catalog.requirementsFor(dataset).getSources()) {
                Long age = ages.get(option.getSource());
                if (age == null) {
                    continue;
                }
                DatasetQuality quality = catalog.datasetQuality(dataset, option.getSource(), age, 1.0);
                if (quality.getOverall() > best.getOverall()) {
                    best = quality;
                }
            }
            qualities.put(dataset, best);
        }
        return qualities;
    }

    private SourceAvailability checkSourceAvailability(SourceType source) {
        long start = core.now();
        try {
            boolean available = collectorRegistry.find(source).map(SourceCollector::isAvailable).orElse(false);
            return SourceAvailability.builder()
                    .source(source)
                    .available(available)
                    .responseTime(core.now() - start)
                    .errorMessage(collectorRegistry.isRegistered(source) ? null : "No collector registered")
                    .lastChecked(core.now())
                    .errorRate(0)
                    .build();
        } catch (Exception e) {
            log.warn("Availability check for {} failed: {}", source, e.getMessage());
            return SourceAvailability.builder()
                    .source(source)
                    .available(false)
                    .errorMessage(e.getMessage())
                    .lastChecked(core.now())
                    .errorRate(100)
                    .build();
        }
    }

    private List<String> healthRecommendations(List<SourceAvailability> sources, boolean cacheHealthy) {
        List<String> recommendations = new ArrayList<>();

        long unavailable = sources.stream().filter(s -> !s.isAvailable()).count();
        if (unavailable > 0) {
            recommendations.add(unavailable + " sources are unavailable. Consider using fallback sources.");
        }

        long slow = sources.stream().filter(s -> s.getResponseTime() > SLOW_SOURCE_MS).count();
        if (slow > 0) {
            recommendations.add(slow + " sources have slow response times. Consider reducing parallelism.");
        }

        if (!cacheHealthy) {
            recommendations.add("Cache store is unreachable - every request will hit paid APIs.");
        }
        return recommendations;
    }
}
