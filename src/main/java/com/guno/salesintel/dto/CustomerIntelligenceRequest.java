package com.guno.salesintel.dto;

import com.guno.salesintel.catalog.ConsumerType;
import com.guno.salesintel.catalog.DatasetType;
import com.guno.salesintel.catalog.SourceType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CustomerIntelligenceRequest {

    public enum Urgency { LOW, MEDIUM, HIGH }

    private String customerCompany;
    private String vendorCompany;

    @Builder.Default
    private ConsumerType consumerType = ConsumerType.CUSTOMER_INTELLIGENCE;

    /** {@code null} for the consumer default budget. */
    private Double maxCost;

    @Builder.Default
    private Urgency urgency = Urgency.MEDIUM;

    private List<DatasetType> requiredDatasets;
    private List<SourceType> requiredSources;
}
