package com.guno.salesintel.planner;

import com.guno.salesintel.catalog.ConsumerType;
import com.guno.salesintel.catalog.DatasetType;
import com.guno.salesintel.catalog.SourceType;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * What to collect for one request and what it is expected to cost. Immutable; consumed once
 * by the collection engine.
 */
@Value
@Builder(toBuilder = true)
public class DataCollectionPlan {

    String companyName;
    ConsumerType requester;

    @Builder.Default
    List<SourceType> toCollect = List.of();

    /** Always empty at planning time; cache hits are resolved during execution. */
    @Builder.Default
    List<SourceType> fromCache = List.of();

    /** Datasets the plan serves, used for per-dataset quality reporting. */
    @Builder.Default
    List<DatasetType> datasets = List.of();

    double estimatedCost;

    /** Budget for the run; unbounded unless set. */
    @Builder.Default
    double maxCost = Double.MAX_VALUE;

    /** Milliseconds; sources run in parallel so this is the slowest selected source. */
    long estimatedDuration;

    double cacheSavings;

    Map<ConsumerType, Double> costsAttribution;

    long createdAt;

    public boolean isEmpty() {
        return toCollect.isEmpty();
    }
}
