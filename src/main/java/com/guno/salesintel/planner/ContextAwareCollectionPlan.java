package com.guno.salesintel.planner;

import com.guno.salesintel.catalog.DatasetType;
import com.guno.salesintel.catalog.SourceType;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * A plan steered by vendor context. {@code basePlan} is the plan for the consumer's own
 * candidates; {@code plan} extends it with sources serving the context datasets and is the
 * one that gets executed.
 */
@Value
@Builder
public class ContextAwareCollectionPlan {

    DataCollectionPlan basePlan;
    DataCollectionPlan plan;
    VendorContext vendorContext;

    @Builder.Default
    List<DatasetType> customerSpecificDatasets = List.of();

    /** 0-100 per context dataset; orders optional collection only. */
    @Builder.Default
    Map<DatasetType, Integer> contextualPriorities = Map.of();

    /** Sources added on top of the base plan because of the context datasets. */
    @Builder.Default
    List<SourceType> contextSources = List.of();
}
