package com.guno.salesintel.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrchestrationHealth {

    public enum Status { HEALTHY, DEGRADED, UNHEALTHY }

    private Status status;
    private boolean cacheHealthy;
    private int availableSources;
    private int totalSources;

    @Builder.Default
    private List<SourceAvailability> sources = new ArrayList<>();

    @Builder.Default
    private List<String> recommendations = new ArrayList<>();

    private long lastCheck;

    public boolean isHealthy() {
        return status == Status.HEALTHY;
    }

    public double getAvailabilityRatio() {
        return totalSources > 0 ? (double) availableSources / totalSources : 0.0;
    }
}
