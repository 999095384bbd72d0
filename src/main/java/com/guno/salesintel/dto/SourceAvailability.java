package com.guno.salesintel.dto;

import com.guno.salesintel.catalog.SourceType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SourceAvailability {
    private SourceType source;
    private boolean available;
    private long responseTime;
    private String errorMessage;
    private long lastChecked;
    private double errorRate;
}
