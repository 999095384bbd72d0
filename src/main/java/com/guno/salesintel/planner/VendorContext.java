package com.guno.salesintel.planner;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Profile of the requesting (vendor) company, used to steer collection about a prospect.
 * A minimal context carries only the name and timestamp.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VendorContext {

    private String companyName;
    private String industry;

    @Builder.Default
    private List<String> products = new ArrayList<>();

    @Builder.Default
    private List<String> targetMarkets = new ArrayList<>();

    @Builder.Default
    private List<String> competitors = new ArrayList<>();

    @Builder.Default
    private List<String> valuePropositions = new ArrayList<>();

    private String positioningStrategy;
    private String pricingModel;

    /** Epoch millis. */
    private Long lastUpdated;

    public static VendorContext minimal(String companyName, long now) {
        return VendorContext.builder()
                .companyName(companyName)
                .lastUpdated(now)
                .build();
    }

    public boolean hasIndustry() {
        return industry != null && !industry.isBlank();
    }

    public boolean hasProducts() {
        return products != null && !products.isEmpty();
    }

    public boolean hasTargetMarkets() {
        return targetMarkets != null && !targetMarkets.isEmpty();
    }

    public boolean hasCompetitors() {
        return competitors != null && !competitors.isEmpty();
    }
}
