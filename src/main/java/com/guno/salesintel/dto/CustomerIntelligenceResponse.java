package com.guno.salesintel.dto;

import com.guno.salesintel.catalog.DatasetQuality;
import com.guno.salesintel.catalog.DatasetType;
import com.guno.salesintel.engine.MultiSourceData;
import com.guno.salesintel.planner.ContextAwareCollectionPlan;
import com.guno.salesintel.planner.VendorContext;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CustomerIntelligenceResponse {

    private ContextAwareCollectionPlan plan;
    private MultiSourceData data;
    private CollectionMetrics metrics;
    private VendorContext vendorContext;

    /** 0-100 */
    private int qualityScore;

    @Builder.Default
    private List<String> recommendations = new ArrayList<>();

    @Builder.Default
    private Map<DatasetType, DatasetQuality> datasetQuality = new LinkedHashMap<>();
}
