package com.guno.salesintel.catalog;

import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Catalog entry for one dataset: ordered source options plus quality and cost rules.
 */
@Value
@Builder
public class DatasetRequirement {

    DatasetType dataset;

    /** Ordered by ascending priority. */
    @Builder.Default
    List<SourceOption> sources = List.of();

    boolean required;

    double qualityThreshold;

    String description;

    CollectionPriority collectionPriority;

    FreshnessRequirement freshnessRequirement;

    CostOptimization costOptimization;

    /**
     * Entry returned for ids the catalog does not know: nothing to collect, never required.
     */
    public static DatasetRequirement unknown(DatasetType dataset) {
        return DatasetRequirement.builder()
                .dataset(dataset)
                .required(false)
                .qualityThreshold(0)
                .description("Unknown dataset")
                .collectionPriority(CollectionPriority.LOW)
                .freshnessRequirement(FreshnessRequirement.MONTHLY)
                .costOptimization(CostOptimization.builder()
                        .maxCostPerDataset(0)
                        .preferredTier(CostTier.TIER_1)
                        .fallbackStrategy(FallbackStrategy.SKIP)
                        .build())
                .build();
    }

    /**
     * Build an entry, sorting options by priority, ranking fallbacks by cost per quality
     * and deriving the cost optimization block.
     */
    public static DatasetRequirement of(DatasetType dataset, boolean required, double qualityThreshold,
                                        String description, CollectionPriority priority,
                                        FreshnessRequirement freshness, List<SourceOption> options) {
        List<SourceOption> ordered = new ArrayList<>(options);
        ordered.sort(Comparator.comparingInt(SourceOption::getPriority));

        List<SourceOption> byValue = new ArrayList<>(ordered);
        byValue.sort(Comparator.comparingDouble(SourceOption::getCostPerQuality)
                .thenComparingInt(SourceOption::getPriority));

        List<SourceOption> ranked = new ArrayList<>(ordered.size());
        for (SourceOption option : ordered) {
            ranked.add(option.withFallbackPriority(byValue.indexOf(option) + 1));
        }

        CostTier preferredTier = ranked.isEmpty() ? CostTier.TIER_1 : ranked.get(0).getCostTier();

        return DatasetRequirement.builder()
                .dataset(dataset)
                .sources(List.copyOf(ranked))
                .required(required)
                .qualityThreshold(qualityThreshold)
                .description(description)
                .collectionPriority(priority)
                .freshnessRequirement(freshness)
                .costOptimization(CostOptimization.builder()
                        .maxCostPerDataset(maxCostFor(priority))
                        .preferredTier(preferredTier)
                        .fallbackStrategy(fallbackFor(required, priority))
                        .build())
                .build();
    }

    public Optional<SourceOption> primarySource() {
        return sources.stream().findFirst();
    }

    public Optional<SourceOption> optionFor(SourceType source) {
        return sources.stream().filter(o -> o.getSource() == source).findFirst();
    }

    private static double maxCostFor(CollectionPriority priority) {
        switch (priority) {
            case HIGH:
                return 0.25;
            case MEDIUM:
                return 0.15;
            default:
                return 0.05;
        }
    }

    private static FallbackStrategy fallbackFor(boolean required, CollectionPriority priority) {
        if (required) {
            return FallbackStrategy.NEXT_PRIORITY;
        }
        return priority == CollectionPriority.LOW ? FallbackStrategy.SKIP : FallbackStrategy.CHEAPEST;
    }
}
