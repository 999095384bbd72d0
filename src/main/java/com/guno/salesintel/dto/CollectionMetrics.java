package com.guno.salesintel.dto;

import com.guno.salesintel.catalog.ConsumerType;
import com.guno.salesintel.engine.CollectionResult;
import com.guno.salesintel.engine.MultiSourceData;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.EnumMap;
import java.util.Map;

/**
 * Cost and cache figures of one request, attributed to its consumer.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CollectionMetrics {

    private int totalRequests;
    private int cacheHits;
    private int apiCalls;
    private double totalCost;
    private double totalSavings;
    private long averageResponseTime;

    @Builder.Default
    private Map<ConsumerType, Integer> requestsByConsumer = new EnumMap<>(ConsumerType.class);

    @Builder.Default
    private Map<ConsumerType, Double> costsByConsumer = new EnumMap<>(ConsumerType.class);

    @Builder.Default
    private Map<ConsumerType, Double> savingsByConsumer = new EnumMap<>(ConsumerType.class);

    public static CollectionMetrics from(MultiSourceData data) {
        long averageResponseTime = (long) data.getResults().stream()
                .mapToLong(CollectionResult::getDuration)
                .average()
                .orElse(0);

        CollectionMetrics metrics = CollectionMetrics.builder()
                .totalRequests(1)
                .cacheHits(data.getCacheHits())
                .apiCalls(data.getNewApiCalls())
                .totalCost(data.getTotalNewCost())
                .totalSavings(data.getTotalCacheSavings())
                .averageResponseTime(averageResponseTime)
                .build();

        ConsumerType consumer = data.getRequester();
        if (consumer != null) {
            metrics.getRequestsByConsumer().put(consumer, 1);
            metrics.getCostsByConsumer().put(consumer, data.getTotalNewCost());
            metrics.getSavingsByConsumer().put(consumer, data.getTotalCacheSavings());
        }
        return metrics;
    }
}
