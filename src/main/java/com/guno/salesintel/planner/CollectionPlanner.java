package com.guno.salesintel.planner;

import com.guno.salesintel.catalog.ConsumerRequirements;
import com.guno.salesintel.catalog.ConsumerType;
import com.guno.salesintel.catalog.DatasetCatalog;
import com.guno.salesintel.catalog.DatasetType;
import com.guno.salesintel.catalog.ResearchArea;
import com.guno.salesintel.catalog.SourceType;
import com.guno.salesintel.config.OrchestrationProperties;
import com.guno.salesintel.core.OrchestrationCore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Collection Planner - picks which sources to query for a request under its budget
 *
 * Candidates are walked in source priority order and admitted greedily while the running cost
 * stays within budget; a source that does not fit is skipped, never partially billed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CollectionPlanner {

    private static final int BASE_CONTEXT_PRIORITY = 50;
    private static final int INDUSTRY_BONUS = 20;
    private static final int PRODUCT_BONUS = 15;
    private static final int COMPETITOR_BONUS = 25;

    private final OrchestrationCore core;
    private final OrchestrationProperties properties;
    private final DatasetCatalog catalog;
    private final ConsumerRequirements consumerRequirements;

    // ================================
    // BASE PLANS
    // ================================

    public DataCollectionPlan createCollectionPlan(String companyName, ConsumerType consumerType) {
        return createCollectionPlan(companyName, consumerType, null, null);
    }

    /**
     * @param maxCost         budget in USD, {@code null} for the consumer default
     * @param requiredSources explicit candidates, {@code null} or empty for the consumer defaults
     */
    public DataCollectionPlan createCollectionPlan(String companyName, ConsumerType consumerType,
                                                   Double maxCost, List<SourceType> requiredSources) {
        ConsumerType consumer = consumerType != null ? consumerType : ConsumerType.TEST;
        List<SourceType> candidates = hasItems(requiredSources) ? requiredSources : defaultSources(consumer);
        return buildPlan(companyName, consumer, resolveBudget(consumer, maxCost),
                orderByPriority(candidates), datasetsFor(consumer));
    }

    /**
     * Plan for one research area: candidates are the primary sources of the area's datasets.
     */
    public DataCollectionPlan createResearchPlan(String companyName, ResearchArea area, Double maxCost) {
        ResearchArea resolved = area != null ? area : ResearchArea.COMPANY_OVERVIEW;
        List<SourceType> candidates = consumerRequirements.researchSources(resolved);
        return buildPlan(companyName, ConsumerType.RESEARCH, resolveBudget(ConsumerType.RESEARCH, maxCost),
                orderByPriority(candidates), consumerRequirements.datasetsFor(resolved));
    }

    // ================================
    // CONTEXT-AWARE PLANS
    // ================================

    public ContextAwareCollectionPlan createContextAwareCollectionPlan(String companyName, ConsumerType consumerType,
                                                                      Double maxCost, VendorContext vendorContext) {
        return createContextAwareCollectionPlan(companyName, consumerType, maxCost, vendorContext, null, null);
    }

    /**
     * Base candidates go first; sources serving the context datasets follow by descending
     * contextual priority and only take budget that is left over.
     */
    public ContextAwareCollectionPlan createContextAwareCollectionPlan(String companyName, ConsumerType consumerType,
                                                                      Double maxCost, VendorContext vendorContext,
                                                                      List<SourceType> requiredSources,
                                                                      List<DatasetType> requestedDatasets) {
        ConsumerType consumer = consumerType != null ? consumerType : ConsumerType.TEST;
        double budget = resolveBudget(consumer, maxCost);
        VendorContext context = vendorContext != null ? vendorContext : VendorContext.minimal(null, core.now());

        DataCollectionPlan basePlan = createCollectionPlan(companyName, consumer, budget, requiredSources);

        List<DatasetType> baseDatasets = hasItems(requestedDatasets) ? requestedDatasets : datasetsFor(consumer);
        List<DatasetType> customerSpecific = determineContextualDatasets(context,
                hasItems(requestedDatasets) ? requestedDatasets : List.of());
        Map<DatasetType, Integer> priorities = calculateContextualPriorities(context, customerSpecific);

        List<SourceType> baseCandidates = orderByPriority(
                hasItems(requiredSources) ? requiredSources : defaultSources(consumer));
        List<SourceType> contextSources = contextSources(customerSpecific, priorities, baseCandidates);

        List<SourceType> candidates = new ArrayList<>(baseCandidates);
        candidates.addAll(contextSources);

        Set<DatasetType> planDatasets = new LinkedHashSet<>(baseDatasets);
        planDatasets.addAll(customerSpecific);

        DataCollectionPlan plan = buildPlan(companyName, consumer, budget, candidates, new ArrayList<>(planDatasets));

        log.info("Context-aware plan for '{}' (vendor: {}) - {} context datasets, {} extra sources, selected: {}",
                companyName, context.getCompanyName(), customerSpecific.size(), contextSources.size(), plan.getToCollect());

        return ContextAwareCollectionPlan.builder()
                .basePlan(basePlan)
                .plan(plan)
                .vendorContext(context)
                .customerSpecificDatasets(customerSpecific)
                .contextualPriorities(priorities)
                .contextSources(contextSources)
                .build();
    }

    /**
     * {@code baseDatasets} plus the datasets implied by populated vendor attributes, without duplicates.
     */
    public List<DatasetType> determineContextualDatasets(VendorContext context, List<DatasetType> baseDatasets) {
        Set<DatasetType> datasets = new LinkedHashSet<>();
        if (baseDatasets != null) {
            baseDatasets.stream().filter(Objects::nonNull).forEach(datasets::add);
        }

        if (context.hasIndustry()) {
            datasets.add(DatasetType.INDUSTRY_ANALYSIS);
            datasets.add(DatasetType.COMPETITIVE_LANDSCAPE);
        }
        if (context.hasProducts()) {
            datasets.add(DatasetType.TECHNOLOGY_STACK);
            datasets.add(DatasetType.PRODUCT_REVIEWS);
        }
        if (context.hasTargetMarkets()) {
            datasets.add(DatasetType.MARKET_PRESENCE);
            datasets.add(DatasetType.GEOGRAPHIC_DISTRIBUTION);
        }

        return new ArrayList<>(datasets);
    }

    /**
     * 50 per dataset, plus fixed bonuses for industry, product and competitor relevance, capped at 100.
     */
    public Map<DatasetType, Integer> calculateContextualPriorities(VendorContext context, List<DatasetType> datasets) {
        Map<DatasetType, Integer> priorities = new LinkedHashMap<>();
        for (DatasetType dataset : datasets) {
            int priority = BASE_CONTEXT_PRIORITY;

            if (context.hasIndustry()
                    && (dataset == DatasetType.INDUSTRY_ANALYSIS || dataset == DatasetType.COMPETITIVE_LANDSCAPE)) {
                priority += INDUSTRY_BONUS;
            }
            if (context.hasProducts()
                    && (dataset == DatasetType.TECHNOLOGY_STACK || dataset == DatasetType.PRODUCT_REVIEWS)) {
                priority += PRODUCT_BONUS;
            }
            if (context.hasCompetitors() && dataset == DatasetType.COMPETITIVE_LANDSCAPE) {
                priority += COMPETITOR_BONUS;
            }

            priorities.put(dataset, Math.min(100, priority));
        }
        return priorities;
    }

    // ================================
    // SELECTION
    // ================================

    private DataCollectionPlan buildPlan(String companyName, ConsumerType consumer, double budget,
                                         List<SourceType> orderedCandidates, List<DatasetType> datasets) {
        List<SourceType> selected = new ArrayList<>();
        double runningCost = 0;

        for (SourceType source : orderedCandidates) {
            if (properties.isRedundancyOptimizationEnabled()) {
                var redundancy = catalog.redundancyFor(source, consumer, selected);
                if (redundancy.isPresent()) {
                    log.debug("Skipping {} for {}: {}", source, consumer, redundancy.get().getReason());
                    continue;
                }
            }

            double cost = core.costOf(source);
            double next = OrchestrationCore.roundCost(runningCost + cost);
            if (next <= OrchestrationCore.roundCost(budget)) {
                selected.add(source);
                runningCost = next;
            } else {
                log.debug("Skipping {} for '{}' - ${} would exceed budget ${}", source, companyName, next, budget);
            }
        }

        long estimatedDuration = selected.stream().mapToLong(core::durationOf).max().orElse(0L);

        Map<ConsumerType, Double> attribution = new EnumMap<>(ConsumerType.class);
        for (ConsumerType type : ConsumerType.values()) {
            attribution.put(type, 0.0);
        }
        attribution.put(consumer, runningCost);

        DataCollectionPlan plan = DataCollectionPlan.builder()
                .companyName(companyName)
                .requester(consumer)
                .toCollect(Collections.unmodifiableList(selected))
                .fromCache(List.of())
                .datasets(List.copyOf(datasets))
                .estimatedCost(runningCost)
                .maxCost(budget)
                .estimatedDuration(estimatedDuration)
                .cacheSavings(0)
                .costsAttribution(Collections.unmodifiableMap(attribution))
                .createdAt(core.now())
                .build();

        log.info("Collection plan for '{}' ({}) - sources: {}, cost: ${} of ${}, duration: {}ms",
                companyName, consumer, selected, runningCost, budget, estimatedDuration);
        return plan;
    }

    private List<SourceType> contextSources(List<DatasetType> datasets, Map<DatasetType, Integer> priorities,
                                            List<SourceType> alreadyCandidates) {
        List<DatasetType> ordered = new ArrayList<>(datasets);
        ordered.sort(Comparator.comparing((DatasetType d) -> priorities.getOrDefault(d, BASE_CONTEXT_PRIORITY))
                .reversed());

        Set<SourceType> sources = new LinkedHashSet<>();
        for (DatasetType dataset : ordered) {
            catalog.requirementsFor(dataset).primarySource().ifPresent(option -> {
                if (!alreadyCandidates.contains(option.getSource())) {
                    sources.add(option.getSource());
                }
            });
        }
        return new ArrayList<>(sources);
    }

    /**
     * De-duplicated, highest source priority first. Ties keep their input order.
     */
    private List<SourceType> orderByPriority(List<SourceType> candidates) {
        List<SourceType> ordered = new ArrayList<>(new LinkedHashSet<>(candidates));
        ordered.removeIf(Objects::isNull);
        ordered.sort(Comparator.comparingInt(core::priorityOf).reversed());
        return ordered;
    }

    private List<SourceType> defaultSources(ConsumerType consumer) {
        List<SourceType> configured = properties.consumer(consumer).getDefaultSources();
        if (hasItems(configured)) {
            return configured;
        }
        return consumerRequirements.primarySourcesFor(datasetsFor(consumer));
    }

    private List<DatasetType> datasetsFor(ConsumerType consumer) {
        return consumerRequirements.datasetsFor(consumer);
    }

    private double resolveBudget(ConsumerType consumer, Double maxCost) {
        if (maxCost == null) {
            return properties.budgetFor(consumer);
        }
        return Math.max(0, maxCost);
    }

    private static boolean hasItems(List<?> list) {
        return list != null && !list.isEmpty();
    }
}
