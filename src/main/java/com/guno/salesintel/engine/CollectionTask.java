package com.guno.salesintel.engine;

import com.guno.salesintel.catalog.SourceType;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class CollectionTask {
    SourceType source;
    String companyName;
    int priority;
    double estimatedCost;
    long estimatedDuration;
}
