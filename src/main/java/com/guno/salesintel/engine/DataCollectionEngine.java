package com.guno.salesintel.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.guno.salesintel.cache.CacheEntry;
import com.guno.salesintel.cache.CacheStore;
import com.guno.salesintel.cache.CacheType;
import com.guno.salesintel.catalog.ConsumerType;
import com.guno.salesintel.catalog.SourceType;
import com.guno.salesintel.collector.SourceCollector;
import com.guno.salesintel.collector.SourceCollectorRegistry;
import com.guno.salesintel.config.OrchestrationProperties;
import com.guno.salesintel.core.BoundedBatchExecutor;
import com.guno.salesintel.core.BoundedBatchExecutor.Settled;
import com.guno.salesintel.core.OrchestrationCore;
import com.guno.salesintel.core.RetryExecutor;
import com.guno.salesintel.planner.DataCollectionPlan;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Data Collection Engine - executes a {@link DataCollectionPlan}
 *
 * 1. Cache phase: every planned source is looked up concurrently; read failures count as misses
 * 2. API phase: misses are fetched in batches of {@code maxParallelSources} with per-call retry
 *    and a pacing delay between batches; fetched data is written back to cache
 * 3. Merge: cache and API results land in one {@link MultiSourceData}
 *
 * Source failures never escape; only a plan over its budget does.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DataCollectionEngine {

    private final OrchestrationCore core;
    private final OrchestrationProperties properties;
    private final CacheStore cacheStore;
    private final SourceCollectorRegistry collectorRegistry;
    private final RetryExecutor retryExecutor;
    private final BoundedBatchExecutor batchExecutor;
    private final ObjectMapper objectMapper;

    // ================================
    // PUBLIC API
    // ================================

    /**
     * @throws com.guno.salesintel.exception.CostLimitExceededException if the plan's estimated
     *         cost is above its budget and a paid call would be needed
     */
    public MultiSourceData executeParallelCollection(DataCollectionPlan plan) {
        long startTime = core.now();
        String companyName = plan.getCompanyName();
        int maxAgeHours = properties.cacheTtlHoursFor(plan.getRequester());

        log.info("Starting collection for '{}' ({}) - {} sources, estimated cost: ${}",
                companyName, plan.getRequester(), plan.getToCollect().size(), plan.getEstimatedCost());

        List<CollectionTask> tasks = createTasks(plan);
        Map<SourceType, CollectionResult> results = new EnumMap<>(SourceType.class);

        // Phase 1: cache
        if (properties.isCacheEnabled()) {
            collectFromCache(tasks, maxAgeHours).forEach(r -> results.put(r.getSource(), r));
        }

        // Phase 2: API
        List<CollectionTask> uncached = new ArrayList<>();
        for (CollectionTask task : tasks) {
            if (!results.containsKey(task.getSource())) {
                uncached.add(task);
            }
        }

        if (!uncached.isEmpty()) {
            core.validateCostLimits(plan.getEstimatedCost(), plan.getMaxCost());
            collectFromApis(uncached).forEach(r -> results.put(r.getSource(), r));
        }

        // Phase 3: merge
        List<CollectionResult> ordered = new ArrayList<>(tasks.size());
        for (CollectionTask task : tasks) {
            ordered.add(results.get(task.getSource()));
        }

        long totalDuration = core.now() - startTime;
        MultiSourceData data = merge(plan, ordered, maxAgeHours, totalDuration);

        CollectionSummary summary = data.getSummary();
        log.info("Collection completed for '{}' - {}/{} sources, cache hit rate: {}%, new cost: ${}, duration: {}ms",
                companyName, summary.getSuccessfulTasks(), summary.getTotalTasks(),
                Math.round(summary.getCacheHitRate() * 100), data.getTotalNewCost(), totalDuration);

        return data;
    }

    // ================================
    // CACHE PHASE
    // ================================

    private List<CollectionResult> collectFromCache(List<CollectionTask> tasks, int maxAgeHours) {
        if (tasks.isEmpty()) {
            return List.of();
        }

        List<Settled<CollectionTask, Optional<CollectionResult>>> settled = batchExecutor.withBoundedConcurrency(
                tasks, tasks.size(), 0, task -> readCache(task, maxAgeHours));

        List<CollectionResult> hits = new ArrayList<>();
        for (Settled<CollectionTask, Optional<CollectionResult>> outcome : settled) {
            if (outcome.isSuccess()) {
                outcome.getValue().ifPresent(hits::add);
            } else {
                log.warn("Cache lookup for {} failed: {}", outcome.getItem().getSource(), outcome.getError().getMessage());
            }
        }
        return hits;
    }

    private Optional<CollectionResult> readCache(CollectionTask task, int maxAgeHours) {
        SourceType source = task.getSource();
        String cacheKey = core.cacheKey(source, task.getCompanyName());
        long start = core.now();

        try {
            CacheEntry entry = cacheStore.get(cacheKey);
            if (entry == null || !entry.hasData()) {
                log.debug("Cache miss - {} for '{}'", source, task.getCompanyName());
                return Optional.empty();
            }
            if (core.isExpired(entry, maxAgeHours)) {
                log.debug("Cache entry too old - {} for '{}' (max {}h)", source, task.getCompanyName(), maxAgeHours);
                return Optional.empty();
            }

            log.debug("Cache hit - {} for '{}'", source, task.getCompanyName());
            return Optional.of(CollectionResult.builder()
                    .source(source)
                    .data(entry.getData())
                    .success(true)
                    .cached(true)
                    .status(SourceStatus.CACHED)
                    .duration(core.now() - start)
                    .cost(0)
                    .ageMs(core.ageMs(entry))
                    .build());

        } catch (Exception e) {
            log.warn("Cache read failed - {} for '{}': {}", source, task.getCompanyName(), e.getMessage());
            return Optional.empty();
        }
    }

    // ================================
    // API PHASE
    // ================================

    private List<CollectionResult> collectFromApis(List<CollectionTask> tasks) {
        List<Settled<CollectionTask, CollectionResult>> settled = batchExecutor.withBoundedConcurrency(
                tasks, properties.getMaxParallelSources(), properties.getBatchPacingMs(), this::collectFromApi);

        List<CollectionResult> results = new ArrayList<>(settled.size());
        for (Settled<CollectionTask, CollectionResult> outcome : settled) {
            if (outcome.isSuccess()) {
                results.add(outcome.getValue());
            } else {
                log.warn("API collection failed - {}: {}", outcome.getItem().getSource(), outcome.getError().getMessage());
                results.add(CollectionResult.failed(outcome.getItem(), 0, outcome.getError().getMessage()));
            }
        }
        return results;
    }

    private CollectionResult collectFromApi(CollectionTask task) {
        SourceType source = task.getSource();
        String companyName = task.getCompanyName();
        long start = core.now();

        Optional<SourceCollector> collector = collectorRegistry.find(source);
        if (collector.isEmpty()) {
            log.warn("No collector registered for source {} - skipping", source);
            return CollectionResult.failed(task, 0, "No collector registered for " + source);
        }

        JsonNode data;
        try {
            data = retryExecutor.withRetry(source + " collection for '" + companyName + "'",
                    () -> collector.get().collect(companyName),
                    properties.getRetryAttempts(), properties.getRetryBaseDelayMs());
        } catch (Exception e) {
            log.warn("API collection failed - {} for '{}': {}", source, companyName, e.getMessage());
            return CollectionResult.failed(task, core.now() - start, e.getMessage());
        }

        if (isEmpty(data)) {
            log.debug("{} returned no data for '{}'", source, companyName);
            return CollectionResult.builder()
                    .source(source)
                    .success(false)
                    .status(SourceStatus.EMPTY)
                    .duration(core.now() - start)
                    .cost(task.getEstimatedCost())
                    .build();
        }

        cacheApiResult(task, data);

        return CollectionResult.builder()
                .source(source)
                .data(data)
                .success(true)
                .cached(false)
                .status(SourceStatus.COLLECTED)
                .duration(core.now() - start)
                .cost(task.getEstimatedCost())
                .build();
    }

    private void cacheApiResult(CollectionTask task, JsonNode data) {
        if (!properties.isCacheEnabled()) {
            return;
        }
        SourceType source = task.getSource();
        try {
            String cacheKey = core.cacheKey(source, task.getCompanyName());
            CacheType cacheType = core.cacheTypeOf(source);
            long now = core.now();

            CacheEntry entry = CacheEntry.builder()
                    .data(data)
                    .timestamp(now)
                    .source(source)
                    .companyName(task.getCompanyName())
                    .expiresAt(now + cacheType.getDefaultTtlHours() * 3_600_000L)
                    .build();

            cacheStore.setRawJson(cacheKey, objectMapper.valueToTree(entry), cacheType);
            log.debug("API result cached - {} under {}", source, cacheKey);

        } catch (Exception e) {
            log.warn("Failed to cache API result - {} for '{}': {}", source, task.getCompanyName(), e.getMessage());
        }
    }

    // ================================
    // MERGE
    // ================================

    private MultiSourceData merge(DataCollectionPlan plan, List<CollectionResult> results,
                                  int maxAgeHours, long totalDuration) {
        Map<SourceType, JsonNode> payloads = new EnumMap<>(SourceType.class);
        Map<SourceType, SourceStatus> statuses = new EnumMap<>(SourceType.class);

        int cacheHits = 0;
        int newApiCalls = 0;
        double newCost = 0;
        double savings = 0;
        double freshnessSum = 0;
        double reliabilitySum = 0;
        int qualitySum = 0;
        int successful = 0;

        for (CollectionResult result : results) {
            SourceType source = result.getSource();
            statuses.put(source, result.getStatus());

            // an empty answer is still a billed call
            if (result.getStatus() == SourceStatus.EMPTY) {
                newCost += result.getCost();
            }

            if (!result.isSuccess()) {
                continue;
            }

            payloads.put(source, result.getData());
            successful++;
            reliabilitySum += core.reliabilityOf(source) / 100.0;
            qualitySum += core.dataQualityScore(1, source);

            if (result.isCached()) {
                cacheHits++;
                savings += core.costOf(source);
                freshnessSum += Math.max(0, 1 - result.getAgeMs() / (maxAgeHours * 3_600_000.0));
            } else {
                newApiCalls++;
                newCost += result.getCost();
                freshnessSum += 1.0;
            }
        }

        int total = results.size();
        newCost = OrchestrationCore.roundCost(newCost);
        savings = OrchestrationCore.roundCost(savings);

        DataQualityScores quality = DataQualityScores.builder()
                .completeness(total == 0 ? 0 : (double) successful / total)
                .freshness(successful == 0 ? 0 : freshnessSum / successful)
                .reliability(successful == 0 ? 0 : reliabilitySum / successful)
                .build();

        CollectionSummary summary = CollectionSummary.builder()
                .totalTasks(total)
                .successfulTasks(successful)
                .failedTasks(total - successful)
                .totalCost(newCost)
                .totalDuration(totalDuration)
                .cacheHitRate(total == 0 ? 0 : (double) cacheHits / total)
                .qualityScore(successful == 0 ? 0 : Math.round((float) qualitySum / successful))
                .build();

        Map<ConsumerType, Double> attribution = new EnumMap<>(ConsumerType.class);
        for (ConsumerType type : ConsumerType.values()) {
            attribution.put(type, 0.0);
        }
        if (plan.getRequester() != null) {
            attribution.put(plan.getRequester(), newCost);
        }

        return MultiSourceData.builder()
                .companyName(plan.getCompanyName())
                .requester(plan.getRequester())
                .payloads(payloads)
                .sourceStatus(statuses)
                .totalNewCost(newCost)
                .totalCacheSavings(savings)
                .cacheHits(cacheHits)
                .newApiCalls(newApiCalls)
                .costsAttribution(attribution)
                .collectionDuration(totalDuration)
                .dataQuality(quality)
                .summary(summary)
                .results(results)
                .build();
    }

    private List<CollectionTask> createTasks(DataCollectionPlan plan) {
        List<CollectionTask> tasks = new ArrayList<>(plan.getToCollect().size());
        for (SourceType source : plan.getToCollect()) {
            tasks.add(CollectionTask.builder()
                    .source(source)
                    .companyName(plan.getCompanyName())
                    .priority(core.priorityOf(source))
                    .estimatedCost(core.costOf(source))
                    .estimatedDuration(core.durationOf(source))
                    .build());
        }
        return tasks;
    }

    private static boolean isEmpty(JsonNode data) {
        return data == null || data.isNull() || data.isMissingNode() || (data.isContainerNode() && data.isEmpty());
    }
}
